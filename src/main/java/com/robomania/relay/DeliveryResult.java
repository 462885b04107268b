package com.robomania.relay;

/** Outcome of one relay attempt. {@code error} is null when delivered. */
public record DeliveryResult(String recipient, boolean delivered, String error) {

  public static DeliveryResult delivered(final String recipient) {
    return new DeliveryResult(recipient, true, null);
  }

  public static DeliveryResult failed(final String recipient, final String error) {
    return new DeliveryResult(recipient, false, error);
  }
}
