package io.vitalconnect.backend.notification;

import io.vitalconnect.backend.event.OccurrenceCreatedEvent;
import io.vitalconnect.backend.event.OccurrenceOutcomeRegisteredEvent;
import io.vitalconnect.backend.event.OccurrenceStatusChangedEvent;
import io.vitalconnect.backend.notification.live.LiveEventFactory;
import io.vitalconnect.backend.notification.live.NotificationHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards occurrence events to the live hub and, for new occurrences, to the alert channels. All
 * handlers run AFTER_COMMIT, so operators only hear about committed changes and a notification
 * failure never rolls back the occurrence.
 */
@Component
public class NotificationEventHandler {

  private static final Logger log = LoggerFactory.getLogger(NotificationEventHandler.class);

  private final NotificationHub hub;
  private final LiveEventFactory liveEventFactory;
  private final AlertDispatchService alertDispatchService;

  public NotificationEventHandler(
      NotificationHub hub,
      LiveEventFactory liveEventFactory,
      AlertDispatchService alertDispatchService) {
    this.hub = hub;
    this.liveEventFactory = liveEventFactory;
    this.alertDispatchService = alertDispatchService;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onOccurrenceCreated(OccurrenceCreatedEvent event) {
    try {
      hub.publish(liveEventFactory.newOccurrence(event));
    } catch (RuntimeException e) {
      log.warn("Failed to publish new occurrence {} to live hub", event.occurrenceId(), e);
    }
    alertDispatchService.submit(event);
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onStatusChanged(OccurrenceStatusChangedEvent event) {
    try {
      hub.publish(liveEventFactory.occurrenceUpdated(event));
    } catch (RuntimeException e) {
      log.warn("Failed to publish status change of {} to live hub", event.occurrenceId(), e);
    }
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onOutcomeRegistered(OccurrenceOutcomeRegisteredEvent event) {
    try {
      hub.publish(liveEventFactory.outcomeRegistered(event));
    } catch (RuntimeException e) {
      log.warn("Failed to publish outcome of {} to live hub", event.occurrenceId(), e);
    }
  }
}
