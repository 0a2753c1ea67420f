package io.vitalconnect.backend.triage;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/** Counters for triage outcomes, updated by the ingestion loop. */
@Component
public class TriageMetrics {

  private final AtomicBoolean running = new AtomicBoolean();
  private final AtomicLong processed = new AtomicLong();
  private final AtomicLong eligible = new AtomicLong();
  private final AtomicLong ineligible = new AtomicLong();
  private final AtomicLong errors = new AtomicLong();

  public void markRunning(boolean value) {
    running.set(value);
  }

  public void recordVerdict(TriageVerdict verdict) {
    processed.incrementAndGet();
    if (verdict.eligible()) {
      eligible.incrementAndGet();
    } else {
      ineligible.incrementAndGet();
    }
  }

  public void recordError() {
    errors.incrementAndGet();
  }

  public TriageStats snapshot() {
    return new TriageStats(
        running.get(), processed.get(), eligible.get(), ineligible.get(), errors.get());
  }
}
