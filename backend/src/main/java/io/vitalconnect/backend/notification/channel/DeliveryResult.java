package io.vitalconnect.backend.notification.channel;

/** Outcome of one send attempt. */
public record DeliveryResult(boolean success, String errorMessage) {

  public static DeliveryResult sent() {
    return new DeliveryResult(true, null);
  }

  public static DeliveryResult failure(String errorMessage) {
    return new DeliveryResult(false, errorMessage);
  }
}
