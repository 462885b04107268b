package com.robomania;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

final class RobomaniaBotTest {

  @Test
  void testApplicationStarts() {
    assertDoesNotThrow(
        () -> {
          final Class<?> clazz = Class.forName("com.robomania.RobomaniaBot");
          assertNotNull(clazz.getMethod("main", String[].class));
        });
  }
}
