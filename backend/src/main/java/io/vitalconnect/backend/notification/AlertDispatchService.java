package io.vitalconnect.backend.notification;

import io.vitalconnect.backend.event.OccurrenceCreatedEvent;
import io.vitalconnect.backend.hospital.HospitalDirectory;
import io.vitalconnect.backend.notification.channel.NotificationDispatcher;
import io.vitalconnect.backend.occurrence.OccurrenceService;
import io.vitalconnect.backend.shift.OnDutyOperator;
import io.vitalconnect.backend.shift.OnDutyRoster;
import io.vitalconnect.backend.urgency.UrgencyClassifier;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Sends email, SMS and push alerts for new occurrences to the operators on duty. Work runs on a
 * bounded pool so a slow mail server or SMS gateway never holds up ingestion or the live hub; when
 * the queue is full the alert is refused and logged.
 */
@Service
public class AlertDispatchService {

  private static final Logger log = LoggerFactory.getLogger(AlertDispatchService.class);
  static final String DASHBOARD_TARGET = "live-hub";

  private final NotificationDispatcher dispatcher;
  private final OnDutyRoster roster;
  private final NotificationRecordRepository recordRepository;
  private final OccurrenceService occurrenceService;
  private final HospitalDirectory hospitalDirectory;
  private final UrgencyClassifier urgencyClassifier;
  private final NotificationProperties properties;
  private final Clock clock;
  private final ThreadPoolExecutor executor;

  public AlertDispatchService(
      NotificationDispatcher dispatcher,
      OnDutyRoster roster,
      NotificationRecordRepository recordRepository,
      OccurrenceService occurrenceService,
      HospitalDirectory hospitalDirectory,
      UrgencyClassifier urgencyClassifier,
      NotificationProperties properties,
      Clock clock) {
    this.dispatcher = dispatcher;
    this.roster = roster;
    this.recordRepository = recordRepository;
    this.occurrenceService = occurrenceService;
    this.hospitalDirectory = hospitalDirectory;
    this.urgencyClassifier = urgencyClassifier;
    this.properties = properties;
    this.clock = clock;
    var counter = new AtomicInteger();
    this.executor =
        new ThreadPoolExecutor(
            properties.dispatchThreads(),
            properties.dispatchThreads(),
            60,
            TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(properties.dispatchQueueCapacity()),
            r -> {
              var thread = new Thread(r, "alert-dispatch-" + counter.incrementAndGet());
              thread.setDaemon(true);
              return thread;
            });
  }

  /** Queues the alerts for a new occurrence. Never blocks the caller. */
  public void submit(OccurrenceCreatedEvent event) {
    try {
      executor.execute(() -> dispatchNow(event));
    } catch (RejectedExecutionException e) {
      log.warn(
          "Alert queue full, occurrence {} was not dispatched to channels", event.occurrenceId());
    }
  }

  /**
   * Records the dashboard broadcast, alerts every on-duty operator and stamps the occurrence as
   * notified. Single channel failures are already captured as FAILED records by the dispatcher; a
   * failure while alerting one operator does not keep the others from being alerted.
   */
  void dispatchNow(OccurrenceCreatedEvent event) {
    recordDashboardBroadcast(event);

    List<OnDutyOperator> recipients;
    try {
      recipients = roster.onDutyOperators(event.hospitalId(), event.deathAt());
    } catch (DataAccessException e) {
      log.error("Could not resolve on-duty operators for occurrence {}", event.occurrenceId(), e);
      return;
    }
    if (recipients.isEmpty()) {
      log.warn(
          "No operator on duty or manager for hospital {}, occurrence {} only on dashboard",
          event.hospitalId(),
          event.occurrenceId());
    }

    OccurrenceAlert alert = alertFor(event);
    int attempts = 0;
    int failedRecipients = 0;
    for (OnDutyOperator recipient : recipients) {
      try {
        attempts += dispatcher.dispatch(alert, recipient).size();
      } catch (RuntimeException e) {
        failedRecipients++;
        log.error(
            "Alerting operator {} about occurrence {} failed",
            recipient.userId(),
            event.occurrenceId(),
            e);
      }
    }

    try {
      occurrenceService.markNotified(event.occurrenceId());
    } catch (DataAccessException e) {
      log.error("Could not mark occurrence {} as notified", event.occurrenceId(), e);
    }
    log.info(
        "Occurrence {} alerted to {} operators ({} channel attempts, {} operators failed)",
        event.occurrenceId(),
        recipients.size() - failedRecipients,
        attempts,
        failedRecipients);
  }

  private void recordDashboardBroadcast(OccurrenceCreatedEvent event) {
    var dashboard =
        new NotificationRecord(
            event.occurrenceId(),
            null,
            NotificationChannelType.DASHBOARD,
            DASHBOARD_TARGET,
            event.occurredAt());
    dashboard.markSent(clock.instant());
    try {
      recordRepository.save(dashboard);
    } catch (DataAccessException e) {
      log.error("Could not record dashboard broadcast for occurrence {}", event.occurrenceId(), e);
    }
  }

  OccurrenceAlert alertFor(OccurrenceCreatedEvent event) {
    Instant now = clock.instant();
    return new OccurrenceAlert(
        event.occurrenceId(),
        event.hospitalId(),
        hospitalDirectory.nameOf(event.hospitalId()),
        event.sector(),
        event.maskedPatientName(),
        event.priorityScore(),
        event.deathAt(),
        event.windowExpiresAt(),
        urgencyClassifier.classify(event.windowExpiresAt(), now),
        urgencyClassifier.remainingMinutes(event.windowExpiresAt(), now),
        urgencyClassifier.formatRemaining(event.windowExpiresAt(), now),
        properties.appBaseUrl() + "/dashboard/occurrences?id=" + event.occurrenceId());
  }

  @PreDestroy
  public void shutdown() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
