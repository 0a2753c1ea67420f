package io.vitalconnect.backend.triage;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Built-in rules and sector scores used when a tenant's rules cannot be loaded. */
public final class TriageDefaults {

  public static final int DEFAULT_MAX_AGE = 80;
  public static final int DEFAULT_WINDOW_HOURS = 6;
  public static final int DEFAULT_SECTOR_SCORE = 40;
  public static final int SCORE_WITHOUT_SECTOR = 50;

  /** Keys are compared after case and accent folding. */
  public static final RuleCondition.SectorPriorityScore SECTOR_SCORES =
      new RuleCondition.SectorPriorityScore(
          Map.of(
              "UTI", 100,
              "ICU", 100,
              "Emergencia", 80,
              "Emergency", 80,
              "Centro Cirurgico", 70,
              "Operating Room", 70,
              "Enfermaria", 50,
              "Ward", 50),
          DEFAULT_SECTOR_SCORE);

  private static final UUID MAX_AGE_RULE_ID =
      UUID.fromString("00000000-0000-0000-0000-000000000001");
  private static final UUID WINDOW_RULE_ID =
      UUID.fromString("00000000-0000-0000-0000-000000000002");
  private static final UUID UNKNOWN_IDENTITY_RULE_ID =
      UUID.fromString("00000000-0000-0000-0000-000000000003");

  private TriageDefaults() {}

  public static RuleSet ruleSet(UUID tenantId, Instant loadedAt) {
    return new RuleSet(
        tenantId,
        List.of(
            new CompiledRule(
                MAX_AGE_RULE_ID,
                "Default maximum age",
                10,
                RuleAction.REJECT,
                new RuleCondition.MaxAge(DEFAULT_MAX_AGE),
                0),
            new CompiledRule(
                WINDOW_RULE_ID,
                "Default capture window",
                20,
                RuleAction.REJECT,
                new RuleCondition.TimeWindowHours(DEFAULT_WINDOW_HOURS),
                0),
            new CompiledRule(
                UNKNOWN_IDENTITY_RULE_ID,
                "Default unknown identity",
                30,
                RuleAction.REJECT,
                new RuleCondition.UnknownIdentityReject(true),
                0)),
        loadedAt,
        true);
  }
}
