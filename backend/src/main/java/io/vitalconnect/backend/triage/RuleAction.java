package io.vitalconnect.backend.triage;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** What a matching rule does to the verdict. */
public enum RuleAction {
  REJECT("reject", "rejeitar"),
  PRIORITIZE("prioritize", "priorizar"),
  ALERT("alert", "alertar");

  private final String code;
  private final String alias;

  RuleAction(String code, String alias) {
    this.code = code;
    this.alias = alias;
  }

  public String code() {
    return code;
  }

  public static Optional<RuleAction> fromCode(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(a -> a.code.equals(normalized) || a.alias.equals(normalized))
        .findFirst();
  }
}
