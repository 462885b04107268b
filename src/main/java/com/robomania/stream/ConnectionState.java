package com.robomania.stream;

import java.time.Duration;
import java.util.Optional;

/** Connection bookkeeping for one event stream. */
public final class ConnectionState {
  private final BackoffPolicy policy;
  private ConnectionStatus status = ConnectionStatus.DISCONNECTED;
  private int retryCount;
  private Duration retryDelay;

  public ConnectionState(final BackoffPolicy policy) {
    this.policy = policy;
    this.retryDelay = policy.baseDelay();
  }

  public void markConnecting() {
    status = ConnectionStatus.CONNECTING;
  }

  public void markConnected() {
    status = ConnectionStatus.CONNECTED;
    retryCount = 0;
    retryDelay = policy.baseDelay();
  }

  /**
   * Records a failed handshake or a lost connection.
   *
   * @return the delay before the next attempt, or empty once the attempt budget is spent
   */
  public Optional<Duration> recordFailure() {
    retryCount++;
    if (retryCount >= policy.maxAttempts()) {
      status = ConnectionStatus.GIVING_UP;
      return Optional.empty();
    }

    status = ConnectionStatus.DISCONNECTED;
    retryDelay = policy.next(retryDelay);
    return Optional.of(retryDelay);
  }

  public ConnectionStatus getStatus() {
    return status;
  }

  public int getRetryCount() {
    return retryCount;
  }

  public Duration getRetryDelay() {
    return retryDelay;
  }

  public int getMaxAttempts() {
    return policy.maxAttempts();
  }
}
