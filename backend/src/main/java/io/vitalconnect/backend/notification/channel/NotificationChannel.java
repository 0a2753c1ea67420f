package io.vitalconnect.backend.notification.channel;

import io.vitalconnect.backend.notification.NotificationChannelType;
import io.vitalconnect.backend.notification.OccurrenceAlert;

/**
 * One outbound alert mechanism (email, SMS, push). Spring collects every implementation into the
 * {@link NotificationDispatcher}.
 */
public interface NotificationChannel {

  NotificationChannelType channelType();

  /** Whether the channel has the credentials or infrastructure it needs to send. */
  boolean isEnabled();

  /**
   * Sends the alert to one target (an address, a phone number or a device token). Failures are
   * reported in the result, not thrown.
   */
  DeliveryResult deliver(OccurrenceAlert alert, String target);
}
