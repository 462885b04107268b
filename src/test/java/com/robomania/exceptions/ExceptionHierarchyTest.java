package com.robomania.exceptions;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

final class ExceptionHierarchyTest {

  @Test
  @DisplayName("Exception messages should include relevant details")
  void testExceptionMessages() {
    final RemoteUnavailableException httpError =
        new RemoteUnavailableException("fetch meeting info", 503, "maintenance");
    assertTrue(httpError.getMessage().contains("fetch meeting info"));
    assertTrue(httpError.getMessage().contains("503"));
    assertTrue(httpError.getMessage().contains("maintenance"));
    assertEquals(503, httpError.getStatus());

    final FrameDecodeException decodeError = new FrameDecodeException("missing type");
    assertTrue(decodeError.getMessage().contains("missing type"));
  }

  @Test
  @DisplayName("Exceptions should preserve cause when provided")
  void testCausePreservation() {
    final Throwable originalCause = new IOException("Original cause");

    final RobomaniaException base = new RobomaniaException("Test message", originalCause);
    assertEquals(originalCause, base.getCause());

    final RemoteUnavailableException remote =
        new RemoteUnavailableException("index members", originalCause);
    assertEquals(originalCause, remote.getCause());
    assertEquals(-1, remote.getStatus());

    final FrameDecodeException decode = new FrameDecodeException("not JSON", originalCause);
    assertEquals(originalCause, decode.getCause());
  }

  @Test
  void allDomainExceptions_ShouldBeChecked() {
    assertInstanceOf(RobomaniaException.class, new FrameDecodeException("x"));
    assertInstanceOf(RobomaniaException.class, new RemoteUnavailableException("x", 500, ""));
    assertFalse(RuntimeException.class.isAssignableFrom(RobomaniaException.class));
  }
}
