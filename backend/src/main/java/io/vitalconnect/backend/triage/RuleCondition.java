package io.vitalconnect.backend.triage;

import io.vitalconnect.backend.ingestion.RawDeathEvent;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Decoded condition of a triage rule. Each variant knows how to test itself against a death
 * report; the rule's action decides what a match means for the verdict.
 */
public sealed interface RuleCondition {

  RuleType type();

  /** Reason text when the event matches this condition, empty otherwise. */
  Optional<String> match(RawDeathEvent event);

  /** Patients older than {@code maxYears} match. Unknown age never matches. */
  record MaxAge(int maxYears) implements RuleCondition {

    @Override
    public RuleType type() {
      return RuleType.MAX_AGE;
    }

    @Override
    public Optional<String> match(RawDeathEvent event) {
      OptionalInt age = event.ageAtDeath();
      if (age.isPresent() && age.getAsInt() > maxYears) {
        return Optional.of("age " + age.getAsInt() + " exceeds maximum of " + maxYears);
      }
      return Optional.empty();
    }
  }

  /**
   * Causes of death containing any of the listed entries match. Comparison ignores case and
   * accents; the first listed entry that matches names the reason.
   */
  record ExcludedCauses(List<String> causes) implements RuleCondition {

    public ExcludedCauses {
      causes = List.copyOf(causes);
    }

    @Override
    public RuleType type() {
      return RuleType.EXCLUDED_CAUSES;
    }

    @Override
    public Optional<String> match(RawDeathEvent event) {
      String cause = TextNormalizer.fold(event.causeOfDeath());
      for (String excluded : causes) {
        String folded = TextNormalizer.fold(excluded);
        if (!folded.isEmpty() && cause.contains(folded)) {
          return Optional.of("cause of death matches excluded cause '" + excluded + "'");
        }
      }
      return Optional.empty();
    }
  }

  /** Reports detected at or after {@code deathAt + hours} match. */
  record TimeWindowHours(int hours) implements RuleCondition {

    @Override
    public RuleType type() {
      return RuleType.TIME_WINDOW_HOURS;
    }

    @Override
    public Optional<String> match(RawDeathEvent event) {
      Instant expiresAt = event.windowExpiresAt(hours);
      if (!event.detectedAt().toInstant().isBefore(expiresAt)) {
        return Optional.of("detected outside the " + hours + "h capture window");
      }
      return Optional.empty();
    }
  }

  /** Unidentified patients match when {@code reject} is set. */
  record UnknownIdentityReject(boolean reject) implements RuleCondition {

    @Override
    public RuleType type() {
      return RuleType.UNKNOWN_IDENTITY_REJECT;
    }

    @Override
    public Optional<String> match(RawDeathEvent event) {
      if (reject && event.identityUnknown()) {
        return Optional.of("patient identity unknown");
      }
      return Optional.empty();
    }
  }

  /**
   * Score table by sector. Never matches; it only contributes the base score of eligible events.
   */
  record SectorPriorityScore(Map<String, Integer> scores, int defaultScore)
      implements RuleCondition {

    public SectorPriorityScore {
      scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    @Override
    public RuleType type() {
      return RuleType.SECTOR_PRIORITY_SCORE;
    }

    @Override
    public Optional<String> match(RawDeathEvent event) {
      return Optional.empty();
    }

    /** Exact lookup on the trimmed sector first, then a case and accent insensitive one. */
    public int scoreFor(String sector) {
      if (sector == null || sector.isBlank()) {
        return defaultScore;
      }
      Integer exact = scores.get(sector.trim());
      if (exact != null) {
        return exact;
      }
      String folded = TextNormalizer.fold(sector);
      return scores.entrySet().stream()
          .filter(e -> TextNormalizer.fold(e.getKey()).equals(folded))
          .map(Map.Entry::getValue)
          .findFirst()
          .orElse(defaultScore);
    }
  }
}
