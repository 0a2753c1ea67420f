package io.vitalconnect.backend.triage;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * Immutable, evaluation-ordered snapshot of a tenant's active triage rules. A reload builds a new
 * instance; readers never observe a partially updated set.
 *
 * @param tenantId owning tenant; null for the global rule set
 * @param rules rules in {@link CompiledRule#EVALUATION_ORDER}
 * @param fallback true when the set holds the built-in defaults because loading failed
 */
public record RuleSet(UUID tenantId, List<CompiledRule> rules, Instant loadedAt, boolean fallback) {

  public RuleSet {
    rules = rules.stream().sorted(CompiledRule.EVALUATION_ORDER).toList();
  }

  public static RuleSet of(UUID tenantId, List<CompiledRule> rules, Instant loadedAt) {
    return new RuleSet(tenantId, rules, loadedAt, false);
  }

  /** Shortest capture window among the time-window rules. */
  public OptionalInt windowHours() {
    return rules.stream()
        .map(CompiledRule::condition)
        .filter(RuleCondition.TimeWindowHours.class::isInstance)
        .mapToInt(c -> ((RuleCondition.TimeWindowHours) c).hours())
        .min();
  }

  /** First sector score table in evaluation order, if the set has one. */
  public Optional<RuleCondition.SectorPriorityScore> sectorScores() {
    return rules.stream()
        .map(CompiledRule::condition)
        .filter(RuleCondition.SectorPriorityScore.class::isInstance)
        .map(RuleCondition.SectorPriorityScore.class::cast)
        .findFirst();
  }

  public int size() {
    return rules.size();
  }
}
