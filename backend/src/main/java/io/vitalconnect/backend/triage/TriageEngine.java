package io.vitalconnect.backend.triage;

import io.vitalconnect.backend.ingestion.RawDeathEvent;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Decides eligibility and priority of a death report. Evaluation is a pure function of the event
 * and the rule set: no clock and no I/O, all time comparisons use the event's own timestamps.
 *
 * <p>Rules run in {@link CompiledRule#EVALUATION_ORDER}. The first matching {@code reject} rule
 * ends evaluation with a rejection. For eligible reports the score is the sector score, plus the
 * bonuses of matching {@code prioritize} rules, plus a window-pressure bonus, clamped to [0, 100].
 */
@Component
public class TriageEngine {

  static final int MAX_SCORE = 100;

  private final int defaultWindowHours;

  @Autowired
  public TriageEngine(TriageProperties properties) {
    this(properties.defaultWindowHours());
  }

  TriageEngine(int defaultWindowHours) {
    this.defaultWindowHours = defaultWindowHours;
  }

  public TriageVerdict evaluate(RawDeathEvent event, RuleSet ruleSet) {
    var alerts = new ArrayList<String>();
    var applied = new ArrayList<String>();
    int bonus = 0;

    for (CompiledRule rule : ruleSet.rules()) {
      Optional<String> match = rule.condition().match(event);
      if (match.isEmpty()) {
        continue;
      }
      applied.add(rule.name());
      switch (rule.action()) {
        case REJECT -> {
          return TriageVerdict.rejected(rule, match.get(), alerts, applied);
        }
        case ALERT -> alerts.add(rule.name());
        case PRIORITIZE -> bonus += rule.bonus();
      }
    }

    int score = sectorScore(event, ruleSet, applied) + bonus + windowPressureBonus(event, ruleSet);
    return TriageVerdict.eligible(clamp(score), alerts, applied);
  }

  /** Capture window applied to events: the shortest time-window rule, else the default. */
  public int windowHours(RuleSet ruleSet) {
    return ruleSet.windowHours().orElse(defaultWindowHours);
  }

  private int sectorScore(RawDeathEvent event, RuleSet ruleSet, ArrayList<String> applied) {
    if (event.sector() == null || event.sector().isBlank()) {
      return TriageDefaults.SCORE_WITHOUT_SECTOR;
    }
    var table = ruleSet.sectorScores();
    if (table.isPresent()) {
      ruleSet.rules().stream()
          .filter(r -> r.condition() == table.get())
          .findFirst()
          .ifPresent(r -> applied.add(r.name()));
      return table.get().scoreFor(event.sector());
    }
    return TriageDefaults.SECTOR_SCORES.scoreFor(event.sector());
  }

  /**
   * +20 with at most 1h of window left at detection, +10 within 2h, +5 within 3h. A window that had
   * already closed at detection earns nothing.
   */
  private int windowPressureBonus(RawDeathEvent event, RuleSet ruleSet) {
    Duration left =
        Duration.between(
            event.detectedAt().toInstant(), event.windowExpiresAt(windowHours(ruleSet)));
    if (left.isNegative() || left.isZero()) {
      return 0;
    }
    long remaining = left.toMinutes();
    if (remaining <= 60) {
      return 20;
    }
    if (remaining <= 120) {
      return 10;
    }
    if (remaining <= 180) {
      return 5;
    }
    return 0;
  }

  private static int clamp(int score) {
    return Math.max(0, Math.min(MAX_SCORE, score));
  }
}
