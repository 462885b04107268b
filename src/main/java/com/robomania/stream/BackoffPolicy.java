package com.robomania.stream;

import java.time.Duration;

/**
 * Exponential reconnect policy. Each consecutive failure multiplies the delay, up to {@code
 * maxDelay}; the stream gives up on the {@code maxAttempts}-th consecutive failure.
 */
public record BackoffPolicy(
    Duration baseDelay, double multiplier, Duration maxDelay, int maxAttempts) {

  public static final double DEFAULT_MULTIPLIER = 2.0;

  public BackoffPolicy {
    if (baseDelay.isNegative() || baseDelay.isZero()) {
      throw new IllegalArgumentException("Base delay must be positive");
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("Multiplier must be at least 1");
    }
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("Max attempts must be at least 1");
    }
  }

  public static BackoffPolicy exponential(
      final Duration baseDelay, final Duration maxDelay, final int maxAttempts) {
    return new BackoffPolicy(baseDelay, DEFAULT_MULTIPLIER, maxDelay, maxAttempts);
  }

  public Duration next(final Duration current) {
    final long nextMillis = (long) (current.toMillis() * multiplier);
    final Duration next = Duration.ofMillis(nextMillis);
    return next.compareTo(maxDelay) > 0 ? maxDelay : next;
  }
}
