package io.vitalconnect.backend.ingestion;

import io.vitalconnect.backend.audit.AuditEventBuilder;
import io.vitalconnect.backend.audit.AuditService;
import io.vitalconnect.backend.occurrence.Occurrence;
import io.vitalconnect.backend.occurrence.OccurrenceHistory;
import io.vitalconnect.backend.occurrence.OccurrenceHistoryRecorder;
import io.vitalconnect.backend.occurrence.OccurrenceService;
import io.vitalconnect.backend.occurrence.PatientNameMasker;
import io.vitalconnect.backend.triage.RuleSetProvider;
import io.vitalconnect.backend.triage.TriageEngine;
import io.vitalconnect.backend.triage.TriageMetrics;
import io.vitalconnect.backend.triage.TriageVerdict;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

/**
 * Consumes the death-report stream: parse, skip events that already have an occurrence, triage,
 * create the occurrence, then acknowledge. Runs on a single background thread started once the
 * application is ready.
 *
 * <p>Every entry is acknowledged once handled, except entries whose occurrence could not be
 * stored: those stay in the consumer's pending list and are replayed on the next start, when the
 * pending list is drained before new entries are read. Redelivery is harmless because creation is
 * deduplicated on the source event id.
 */
@Component
public class EventIngestor {

  private static final Logger log = LoggerFactory.getLogger(EventIngestor.class);

  enum Result {
    ACCEPTED,
    REJECTED,
    DUPLICATE,
    INVALID,
    FAILED
  }

  private final DeathEventStream stream;
  private final DeathEventParser parser;
  private final RuleSetProvider ruleSetProvider;
  private final TriageEngine triageEngine;
  private final TriageMetrics triageMetrics;
  private final OccurrenceService occurrenceService;
  private final OccurrenceHistoryRecorder historyRecorder;
  private final AuditService auditService;
  private final IngestionProperties properties;
  private final RetryTemplate storeRetry;
  private final Clock clock;

  private final AtomicBoolean running = new AtomicBoolean();
  private final AtomicLong totalProcessed = new AtomicLong();
  private final AtomicLong totalRejected = new AtomicLong();
  private final AtomicLong totalDuplicates = new AtomicLong();
  private final AtomicLong totalInvalid = new AtomicLong();
  private final AtomicLong totalFailed = new AtomicLong();
  private final AtomicLong errorCount = new AtomicLong();

  private final ReentrantLock statusLock = new ReentrantLock();
  private Instant startedAt;
  private Instant lastProcessedAt;
  private LocalDate countingDate;
  private long detectedToday;

  private Duration errorBackoff;
  private ExecutorService executor;

  public EventIngestor(
      DeathEventStream stream,
      DeathEventParser parser,
      RuleSetProvider ruleSetProvider,
      TriageEngine triageEngine,
      TriageMetrics triageMetrics,
      OccurrenceService occurrenceService,
      OccurrenceHistoryRecorder historyRecorder,
      AuditService auditService,
      IngestionProperties properties,
      @Qualifier("storeRetryTemplate") RetryTemplate storeRetry,
      Clock clock) {
    this.stream = stream;
    this.parser = parser;
    this.ruleSetProvider = ruleSetProvider;
    this.triageEngine = triageEngine;
    this.triageMetrics = triageMetrics;
    this.occurrenceService = occurrenceService;
    this.historyRecorder = historyRecorder;
    this.auditService = auditService;
    this.properties = properties;
    this.storeRetry = storeRetry;
    this.clock = clock;
    this.errorBackoff = properties.errorBackoffInitial();
  }

  /**
   * Creates the consumer group synchronously, so an unreachable stream fails startup, then starts
   * the consumption thread.
   */
  @EventListener(ApplicationReadyEvent.class)
  public void start() {
    if (!properties.enabled()) {
      log.info("Event ingestion disabled");
      return;
    }
    if (!running.compareAndSet(false, true)) {
      return;
    }
    stream.ensureConsumerGroup();
    statusLock.lock();
    try {
      startedAt = clock.instant();
    } finally {
      statusLock.unlock();
    }
    triageMetrics.markRunning(true);
    executor =
        Executors.newSingleThreadExecutor(
            r -> {
              var thread = new Thread(r, "event-ingestor");
              thread.setDaemon(true);
              return thread;
            });
    executor.submit(this::run);
    log.info(
        "Event ingestor started: stream={} group={} consumer={}",
        properties.streamKey(),
        properties.consumerGroup(),
        properties.consumerName());
  }

  @PreDestroy
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    triageMetrics.markRunning(false);
    if (executor != null) {
      executor.shutdownNow();
      try {
        if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
          log.warn("Event ingestor did not stop within 10s");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    log.info("Event ingestor stopped");
  }

  private void run() {
    try {
      drainPending();
      while (running.get() && !Thread.currentThread().isInterrupted()) {
        Duration pause = pollOnce();
        if (!pause.isZero()) {
          Thread.sleep(pause.toMillis());
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (RuntimeException e) {
      log.error("Event ingestor loop terminated unexpectedly", e);
      errorCount.incrementAndGet();
    } finally {
      running.set(false);
      triageMetrics.markRunning(false);
    }
  }

  /** Replays entries this consumer received earlier but never acknowledged. */
  void drainPending() {
    String afterId = "0";
    int replayed = 0;
    while (true) {
      List<StreamEntry> batch;
      try {
        batch = stream.readPending(afterId, properties.batchSize());
      } catch (DataAccessException e) {
        errorCount.incrementAndGet();
        log.warn("Failed to read pending entries, skipping replay: {}", e.getMessage());
        return;
      }
      if (batch.isEmpty()) {
        break;
      }
      for (StreamEntry entry : batch) {
        process(entry);
        afterId = entry.id();
        replayed++;
      }
    }
    if (replayed > 0) {
      log.info("Replayed {} pending stream entries", replayed);
    }
  }

  /**
   * Reads and handles one batch of new entries. Returns how long the loop should pause before the
   * next read: zero after a non-empty batch, the idle backoff after an empty one, and a doubling
   * backoff (capped) after consecutive read failures.
   */
  Duration pollOnce() {
    List<StreamEntry> batch;
    try {
      batch = stream.readNew(properties.batchSize(), properties.blockTimeout());
    } catch (DataAccessException e) {
      errorCount.incrementAndGet();
      Duration pause = errorBackoff;
      Duration doubled = errorBackoff.multipliedBy(2);
      errorBackoff =
          doubled.compareTo(properties.errorBackoffMax()) > 0
              ? properties.errorBackoffMax()
              : doubled;
      log.warn(
          "Failed to read death stream, retrying in {}ms: {}", pause.toMillis(), e.getMessage());
      return pause;
    }
    errorBackoff = properties.errorBackoffInitial();
    if (batch.isEmpty()) {
      return properties.idleBackoff();
    }
    for (StreamEntry entry : batch) {
      process(entry);
    }
    return Duration.ZERO;
  }

  /** Handles one entry and acknowledges it unless the occurrence could not be stored. */
  Result process(StreamEntry entry) {
    Result result;
    try {
      result = handle(entry);
    } catch (RuntimeException e) {
      errorCount.incrementAndGet();
      triageMetrics.recordError();
      log.error("Unexpected error processing stream entry {}", entry.id(), e);
      result = Result.FAILED;
    }
    totalProcessed.incrementAndGet();
    markProcessed();
    switch (result) {
      case REJECTED -> totalRejected.incrementAndGet();
      case DUPLICATE -> totalDuplicates.incrementAndGet();
      case INVALID -> totalInvalid.incrementAndGet();
      case FAILED -> totalFailed.incrementAndGet();
      case ACCEPTED -> incrementDetectedToday();
    }
    if (result != Result.FAILED) {
      acknowledge(entry);
    }
    return result;
  }

  private Result handle(StreamEntry entry) {
    RawDeathEvent event;
    try {
      event = parser.parse(entry);
    } catch (InvalidDeathEventException e) {
      log.warn("Discarding invalid stream entry {}: {}", entry.id(), e.getMessage());
      return Result.INVALID;
    }

    try {
      if (storeRetry.execute(context -> occurrenceService.existsForEvent(event.eventId()))) {
        log.debug("Event {} already has an occurrence", event.eventId());
        return Result.DUPLICATE;
      }
    } catch (DataAccessException e) {
      return giveUp(event, e);
    }

    var ruleSet = ruleSetProvider.get(event.tenantId());
    TriageVerdict verdict = triageEngine.evaluate(event, ruleSet);
    triageMetrics.recordVerdict(verdict);
    if (!verdict.eligible()) {
      log.info(
          "Event {} rejected for hospital {}: {}",
          event.eventId(),
          event.hospitalId(),
          verdict.rejectionReason());
      return Result.REJECTED;
    }
    return store(event, verdict, triageEngine.windowHours(ruleSet));
  }

  private Result store(RawDeathEvent event, TriageVerdict verdict, int windowHours) {
    Occurrence occurrence;
    try {
      occurrence =
          storeRetry.execute(
              context -> occurrenceService.createFromTriage(event, verdict, windowHours));
    } catch (DataIntegrityViolationException e) {
      log.info("Event {} was stored concurrently, treating as duplicate", event.eventId());
      return Result.DUPLICATE;
    } catch (DataAccessException e) {
      return giveUp(event, e);
    }
    afterCreate(event, verdict, occurrence);
    return Result.ACCEPTED;
  }

  private Result giveUp(RawDeathEvent event, DataAccessException cause) {
    errorCount.incrementAndGet();
    triageMetrics.recordError();
    log.error(
        "Giving up on event {}; entry stays pending for replay: {}",
        event.eventId(),
        cause.getMessage());
    return Result.FAILED;
  }

  private void afterCreate(RawDeathEvent event, TriageVerdict verdict, Occurrence occurrence) {
    historyRecorder.append(
        OccurrenceHistory.created(occurrence.getId(), occurrence.getCreatedAt()));
    auditService.log(
        AuditEventBuilder.forOccurrence("created", occurrence.getId())
            .fromIngestion()
            .detail("sourceEventId", event.eventId())
            .detail("hospitalId", event.hospitalId().toString())
            .detail("score", verdict.score())
            .detail("patient", PatientNameMasker.mask(event.patientName(), event.identityUnknown()))
            .detail("origin", event.origin().name())
            .build());
  }

  private void acknowledge(StreamEntry entry) {
    try {
      stream.acknowledge(entry.id());
    } catch (DataAccessException e) {
      errorCount.incrementAndGet();
      log.warn("Failed to acknowledge stream entry {}: {}", entry.id(), e.getMessage());
    }
  }

  private void markProcessed() {
    statusLock.lock();
    try {
      lastProcessedAt = clock.instant();
    } finally {
      statusLock.unlock();
    }
  }

  private void incrementDetectedToday() {
    statusLock.lock();
    try {
      rollDate();
      detectedToday++;
    } finally {
      statusLock.unlock();
    }
  }

  /** Caller holds {@link #statusLock}. */
  private void rollDate() {
    LocalDate today = LocalDate.ofInstant(clock.instant(), properties.zoneId());
    if (!today.equals(countingDate)) {
      countingDate = today;
      detectedToday = 0;
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  public IngestorStatus status() {
    statusLock.lock();
    try {
      rollDate();
      return new IngestorStatus(
          running.get(),
          startedAt,
          lastProcessedAt,
          detectedToday,
          totalProcessed.get(),
          totalRejected.get(),
          totalDuplicates.get(),
          totalInvalid.get(),
          totalFailed.get(),
          errorCount.get());
    } finally {
      statusLock.unlock();
    }
  }
}
