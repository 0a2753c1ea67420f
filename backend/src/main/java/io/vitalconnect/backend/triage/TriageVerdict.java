package io.vitalconnect.backend.triage;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of evaluating one death report against a rule set.
 *
 * @param eligible whether the report becomes an occurrence
 * @param score priority score in [0, 100]; 0 when not eligible
 * @param rejectionReason rule name and reason of the rejecting rule; null when eligible
 * @param rejectingRuleId id of the rejecting rule; null when eligible
 * @param alerts names of matched rules whose action is {@link RuleAction#ALERT}
 * @param rulesApplied names of the rules that matched, in evaluation order
 */
public record TriageVerdict(
    boolean eligible,
    int score,
    String rejectionReason,
    UUID rejectingRuleId,
    List<String> alerts,
    List<String> rulesApplied) {

  public TriageVerdict {
    alerts = List.copyOf(alerts);
    rulesApplied = List.copyOf(rulesApplied);
  }

  static TriageVerdict eligible(int score, List<String> alerts, List<String> rulesApplied) {
    return new TriageVerdict(true, score, null, null, alerts, rulesApplied);
  }

  static TriageVerdict rejected(
      CompiledRule rule, String reason, List<String> alerts, List<String> rulesApplied) {
    return new TriageVerdict(
        false, 0, rule.name() + ": " + reason, rule.id(), alerts, rulesApplied);
  }
}
