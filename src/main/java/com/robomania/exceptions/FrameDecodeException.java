package com.robomania.exceptions;

public class FrameDecodeException extends RobomaniaException {
  public FrameDecodeException(final String message) {
    super("Invalid event frame: " + message);
  }

  public FrameDecodeException(final String message, final Throwable cause) {
    super("Invalid event frame: " + message, cause);
  }
}
