package com.robomania.stream;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class ConnectionStateTest {

  private ConnectionState state;

  @BeforeEach
  void setUp() {
    state =
        new ConnectionState(
            BackoffPolicy.exponential(Duration.ofSeconds(2), Duration.ofMinutes(15), 15));
  }

  @Test
  void recordFailure_Consecutive_ShouldDoubleFromBaseDelay() {
    assertEquals(Optional.of(Duration.ofSeconds(4)), state.recordFailure());
    assertEquals(Optional.of(Duration.ofSeconds(8)), state.recordFailure());
    assertEquals(Optional.of(Duration.ofSeconds(16)), state.recordFailure());
    assertEquals(3, state.getRetryCount());
    assertEquals(ConnectionStatus.DISCONNECTED, state.getStatus());
  }

  @Test
  void recordFailure_FifteenthFailure_ShouldGiveUp() {
    for (int i = 1; i < 15; i++) {
      assertTrue(state.recordFailure().isPresent(), "failure " + i + " should retry");
    }

    assertTrue(state.recordFailure().isEmpty());
    assertEquals(ConnectionStatus.GIVING_UP, state.getStatus());
    assertEquals(15, state.getRetryCount());
  }

  @Test
  void recordFailure_LongOutage_ShouldCapDelay() {
    Duration last = Duration.ZERO;
    for (int i = 1; i < 15; i++) {
      last = state.recordFailure().orElseThrow();
    }

    assertEquals(Duration.ofMinutes(15), last);
  }

  @Test
  void markConnected_AfterFailures_ShouldResetCounters() {
    state.recordFailure();
    state.recordFailure();

    state.markConnected();

    assertEquals(ConnectionStatus.CONNECTED, state.getStatus());
    assertEquals(0, state.getRetryCount());
    assertEquals(Duration.ofSeconds(2), state.getRetryDelay());
    assertEquals(Optional.of(Duration.ofSeconds(4)), state.recordFailure());
  }

  @Test
  void markConnecting_ShouldUpdateStatus() {
    state.markConnecting();

    assertEquals(ConnectionStatus.CONNECTING, state.getStatus());
  }

  @Test
  void backoffPolicy_InvalidArguments_ShouldThrow() {
    assertThrows(
        IllegalArgumentException.class,
        () -> BackoffPolicy.exponential(Duration.ZERO, Duration.ofMinutes(1), 3));
    assertThrows(
        IllegalArgumentException.class,
        () -> new BackoffPolicy(Duration.ofSeconds(1), 0.5, Duration.ofMinutes(1), 3));
    assertThrows(
        IllegalArgumentException.class,
        () -> BackoffPolicy.exponential(Duration.ofSeconds(1), Duration.ofMinutes(1), 0));
  }
}
