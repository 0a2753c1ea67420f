package io.vitalconnect.backend.triage;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Kinds of triage rule, with the wire codes accepted in rule documents. Hyphens and underscores
 * are interchangeable ("max-age" reads as "max_age").
 */
public enum RuleType {
  MAX_AGE("max_age", "idade_maxima"),
  EXCLUDED_CAUSES("excluded_causes", "causas_excludentes"),
  TIME_WINDOW_HOURS("time_window_hours", "janela_horas"),
  UNKNOWN_IDENTITY_REJECT("unknown_identity_reject", "identificacao_desconhecida"),
  SECTOR_PRIORITY_SCORE("sector_priority_score", "setor_priorizacao");

  private final String code;
  private final Set<String> aliases;

  RuleType(String code, String... aliases) {
    this.code = code;
    this.aliases = Set.of(aliases);
  }

  public String code() {
    return code;
  }

  public static Optional<RuleType> fromCode(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    return Arrays.stream(values())
        .filter(t -> t.code.equals(normalized) || t.aliases.contains(normalized))
        .findFirst();
  }
}
