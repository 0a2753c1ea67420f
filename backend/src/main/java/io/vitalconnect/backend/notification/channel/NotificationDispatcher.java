package io.vitalconnect.backend.notification.channel;

import io.vitalconnect.backend.notification.NotificationChannelType;
import io.vitalconnect.backend.notification.NotificationPreference;
import io.vitalconnect.backend.notification.NotificationPreferenceRepository;
import io.vitalconnect.backend.notification.NotificationRecord;
import io.vitalconnect.backend.notification.NotificationRecordRepository;
import io.vitalconnect.backend.notification.OccurrenceAlert;
import io.vitalconnect.backend.notification.PushSubscription;
import io.vitalconnect.backend.notification.PushSubscriptionRepository;
import io.vitalconnect.backend.shift.OnDutyOperator;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes an alert to each channel an operator has enabled. Channels self-register via constructor
 * injection (Spring collects all {@link NotificationChannel} beans).
 *
 * <p>Every attempt is a {@link NotificationRecord}: saved PENDING before the send, then moved to
 * SENT or FAILED with the error text. A channel without credentials yields a FAILED record rather
 * than being skipped silently.
 */
@Component
public class NotificationDispatcher {

  private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);
  static final String NOT_CONFIGURED = "channel not configured";

  private final Map<NotificationChannelType, NotificationChannel> channels;
  private final NotificationPreferenceRepository preferenceRepository;
  private final PushSubscriptionRepository pushSubscriptionRepository;
  private final NotificationRecordRepository recordRepository;
  private final Clock clock;

  public NotificationDispatcher(
      List<NotificationChannel> channelBeans,
      NotificationPreferenceRepository preferenceRepository,
      PushSubscriptionRepository pushSubscriptionRepository,
      NotificationRecordRepository recordRepository,
      Clock clock) {
    this.channels = new EnumMap<>(NotificationChannelType.class);
    channelBeans.forEach(channel -> channels.put(channel.channelType(), channel));
    this.preferenceRepository = preferenceRepository;
    this.pushSubscriptionRepository = pushSubscriptionRepository;
    this.recordRepository = recordRepository;
    this.clock = clock;
  }

  /** Sends the alert to one operator on every enabled channel and returns the records written. */
  public List<NotificationRecord> dispatch(OccurrenceAlert alert, OnDutyOperator operator) {
    var preference = preferenceRepository.findByUserId(operator.userId()).orElse(null);
    var records = new ArrayList<NotificationRecord>();

    if (emailEnabled(preference) && operator.email() != null && !operator.email().isBlank()) {
      records.add(send(NotificationChannelType.EMAIL, alert, operator, operator.email()));
    }
    if (smsEnabled(preference) && operator.hasMobilePhone()) {
      records.add(send(NotificationChannelType.SMS, alert, operator, operator.mobilePhone()));
    }
    if (pushEnabled(preference)) {
      List<PushSubscription> devices = pushSubscriptionRepository.findByUserId(operator.userId());
      for (PushSubscription device : devices) {
        records.add(send(NotificationChannelType.PUSH, alert, operator, device.getToken()));
      }
    }
    log.debug(
        "Dispatched occurrence {} to operator {}: {} attempts",
        alert.occurrenceId(),
        operator.userId(),
        records.size());
    return records;
  }

  // Without a stored preference: email and push on; SMS follows from having a phone.
  private static boolean emailEnabled(NotificationPreference preference) {
    return preference == null || preference.isEmailEnabled();
  }

  private static boolean smsEnabled(NotificationPreference preference) {
    return preference == null || preference.isSmsEnabled();
  }

  private static boolean pushEnabled(NotificationPreference preference) {
    return preference == null || preference.isPushEnabled();
  }

  private NotificationRecord send(
      NotificationChannelType type,
      OccurrenceAlert alert,
      OnDutyOperator operator,
      String target) {
    var record =
        recordRepository.save(
            new NotificationRecord(
                alert.occurrenceId(), operator.userId(), type, target, clock.instant()));

    DeliveryResult result;
    var channel = channels.get(type);
    if (channel == null || !channel.isEnabled()) {
      result = DeliveryResult.failure(NOT_CONFIGURED);
    } else {
      try {
        result = channel.deliver(alert, target);
      } catch (RuntimeException e) {
        log.warn(
            "Channel {} threw while delivering occurrence {}", type, alert.occurrenceId(), e);
        result = DeliveryResult.failure(e.getMessage() != null ? e.getMessage() : e.toString());
      }
    }

    if (result.success()) {
      record.markSent(clock.instant());
    } else {
      record.markFailed(result.errorMessage(), clock.instant());
      log.info(
          "Alert for occurrence {} via {} to user {} failed: {}",
          alert.occurrenceId(),
          type,
          operator.userId(),
          result.errorMessage());
    }
    return recordRepository.save(record);
  }
}
