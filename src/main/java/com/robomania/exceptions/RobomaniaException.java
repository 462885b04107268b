package com.robomania.exceptions;

public class RobomaniaException extends Exception {
  public RobomaniaException(final String message) {
    super(message);
  }

  public RobomaniaException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
