package io.vitalconnect.backend.triage;

import java.util.Comparator;
import java.util.Objects;
import java.util.UUID;

/**
 * A triage rule ready for evaluation: its condition decoded once, at load time.
 *
 * @param bonus score added when a {@link RuleAction#PRIORITIZE} rule matches
 */
public record CompiledRule(
    UUID id, String name, int priority, RuleAction action, RuleCondition condition, int bonus) {

  /** Ascending priority, then name, then id: a total order over any set of rules. */
  public static final Comparator<CompiledRule> EVALUATION_ORDER =
      Comparator.comparingInt(CompiledRule::priority)
          .thenComparing(CompiledRule::name)
          .thenComparing(CompiledRule::id);

  public CompiledRule {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(condition, "condition");
  }
}
