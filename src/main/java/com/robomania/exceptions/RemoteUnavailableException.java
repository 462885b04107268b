package com.robomania.exceptions;

public class RemoteUnavailableException extends RobomaniaException {
  private final int status;

  public RemoteUnavailableException(final String operation, final Throwable cause) {
    super("Roboweb request failed: " + operation, cause);
    this.status = -1;
  }

  public RemoteUnavailableException(final String operation, final int status, final String body) {
    super("Roboweb request failed: " + operation + " - " + status + " (" + body + ")");
    this.status = status;
  }

  /** HTTP status of the failed call, or -1 when no response was received. */
  public int getStatus() {
    return status;
  }
}
