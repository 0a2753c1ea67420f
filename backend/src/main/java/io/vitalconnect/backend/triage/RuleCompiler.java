package io.vitalconnect.backend.triage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decodes rule documents of the form {@code {"type": ..., "value": ..., "action": ...}} into
 * {@link CompiledRule}s. The Portuguese keys {@code tipo}, {@code valor} and {@code acao} are
 * accepted too. Rules that cannot be decoded are skipped with a warning.
 */
@Component
public class RuleCompiler {

  private static final Logger log = LoggerFactory.getLogger(RuleCompiler.class);

  public List<CompiledRule> compileAll(Collection<TriageRule> rules) {
    var compiled = new ArrayList<CompiledRule>(rules.size());
    for (TriageRule rule : rules) {
      if (!rule.isActive()) {
        continue;
      }
      compile(rule).ifPresent(compiled::add);
    }
    return compiled;
  }

  public Optional<CompiledRule> compile(TriageRule rule) {
    try {
      return Optional.of(decode(rule));
    } catch (IllegalArgumentException e) {
      log.warn("Skipping triage rule {} ({}): {}", rule.getId(), rule.getName(), e.getMessage());
      return Optional.empty();
    }
  }

  private CompiledRule decode(TriageRule rule) {
    Map<String, Object> doc = rule.getDefinition();
    if (doc == null || doc.isEmpty()) {
      throw new IllegalArgumentException("empty rule document");
    }
    String typeCode = stringValue(first(doc, "type", "tipo"));
    RuleType type =
        RuleType.fromCode(typeCode)
            .orElseThrow(() -> new IllegalArgumentException("unknown rule type " + typeCode));
    Object value = first(doc, "value", "valor");
    Object actionValue = first(doc, "action", "acao");
    RuleAction action;
    if (actionValue == null) {
      action =
          type == RuleType.SECTOR_PRIORITY_SCORE ? RuleAction.PRIORITIZE : RuleAction.REJECT;
    } else {
      String actionCode = stringValue(actionValue);
      action =
          RuleAction.fromCode(actionCode)
              .orElseThrow(() -> new IllegalArgumentException("unknown action " + actionCode));
    }
    int bonus = doc.containsKey("bonus") ? intValue(doc.get("bonus"), "bonus") : 0;

    RuleCondition condition =
        switch (type) {
          case MAX_AGE -> new RuleCondition.MaxAge(intValue(value, "value"));
          case EXCLUDED_CAUSES -> new RuleCondition.ExcludedCauses(stringList(value));
          case TIME_WINDOW_HOURS -> {
            int hours = intValue(value, "value");
            if (hours <= 0) {
              throw new IllegalArgumentException("window hours must be positive, got " + hours);
            }
            yield new RuleCondition.TimeWindowHours(hours);
          }
          case UNKNOWN_IDENTITY_REJECT -> new RuleCondition.UnknownIdentityReject(boolValue(value));
          case SECTOR_PRIORITY_SCORE -> sectorScores(value, doc.get("default"));
        };
    return new CompiledRule(
        rule.getId(), rule.getName(), rule.getPriority(), action, condition, bonus);
  }

  private static RuleCondition.SectorPriorityScore sectorScores(Object value, Object fallback) {
    if (!(value instanceof Map<?, ?> table)) {
      throw new IllegalArgumentException("sector score table must be an object");
    }
    var scores = new LinkedHashMap<String, Integer>();
    Integer defaultScore = fallback != null ? intValue(fallback, "default") : null;
    for (var entry : table.entrySet()) {
      String sector = String.valueOf(entry.getKey());
      int score = intValue(entry.getValue(), sector);
      String folded = TextNormalizer.fold(sector);
      if (defaultScore == null
          && (folded.equals("outros") || folded.equals("others") || folded.equals("default"))) {
        defaultScore = score;
      } else {
        scores.put(sector, score);
      }
    }
    return new RuleCondition.SectorPriorityScore(
        scores, defaultScore != null ? defaultScore : TriageDefaults.DEFAULT_SECTOR_SCORE);
  }

  private static Object first(Map<String, Object> doc, String key, String alias) {
    Object value = doc.get(key);
    return value != null ? value : doc.get(alias);
  }

  private static String stringValue(Object value) {
    if (value == null) {
      throw new IllegalArgumentException("missing rule type or action");
    }
    return value.toString();
  }

  private static int intValue(Object value, String field) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String text) {
      try {
        return Integer.parseInt(text.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("'" + field + "' is not a number: " + text);
      }
    }
    throw new IllegalArgumentException("'" + field + "' must be a number");
  }

  private static boolean boolValue(Object value) {
    if (value instanceof Boolean flag) {
      return flag;
    }
    if (value instanceof String text) {
      return Boolean.parseBoolean(text.trim());
    }
    throw new IllegalArgumentException("'value' must be a boolean");
  }

  private static List<String> stringList(Object value) {
    if (value instanceof Collection<?> items) {
      return items.stream().map(String::valueOf).toList();
    }
    if (value instanceof String text) {
      return Arrays.stream(text.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }
    throw new IllegalArgumentException("'value' must be a list of causes");
  }
}
