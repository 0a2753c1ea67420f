package io.vitalconnect.backend.occurrence;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

public enum OccurrenceStatus {
  PENDING("PENDENTE"),
  IN_PROGRESS("EM_ANDAMENTO"),
  ACCEPTED("ACEITA"),
  REFUSED("RECUSADA"),
  CONCLUDED("CONCLUIDA"),
  CANCELED("CANCELADA");

  private static final Map<OccurrenceStatus, Set<OccurrenceStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          PENDING, Set.of(IN_PROGRESS, CANCELED),
          IN_PROGRESS, Set.of(ACCEPTED, REFUSED, CANCELED),
          ACCEPTED, Set.of(CONCLUDED, CANCELED),
          REFUSED, Set.of(CONCLUDED, CANCELED),
          CONCLUDED, Set.of(),
          CANCELED, Set.of());

  private final String dbValue;

  OccurrenceStatus(String dbValue) {
    this.dbValue = dbValue;
  }

  /** Value of the {@code occurrence_status} database enum. */
  public String dbValue() {
    return dbValue;
  }

  public Set<OccurrenceStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.get(this);
  }

  /** Allowed targets in declaration order, for error payloads. */
  public List<String> allowedTargetNames() {
    return Arrays.stream(values()).filter(allowedTransitions()::contains).map(Enum::name).toList();
  }

  public boolean canTransitionTo(OccurrenceStatus target) {
    return allowedTransitions().contains(target);
  }

  public boolean isTerminal() {
    return this == CONCLUDED || this == CANCELED;
  }

  /** Outcomes may only be registered once a decision was taken. */
  public boolean acceptsOutcome() {
    return this == ACCEPTED || this == REFUSED;
  }

  /** History label written when an occurrence enters this status. */
  public String historyAction() {
    return switch (this) {
      case PENDING -> "Occurrence created automatically";
      case IN_PROGRESS -> "Occurrence assumed";
      case ACCEPTED -> "Family accepted donation";
      case REFUSED -> "Donation refused";
      case CONCLUDED -> "Occurrence concluded";
      case CANCELED -> "Occurrence canceled";
    };
  }

  public static OccurrenceStatus fromDbValue(String value) {
    for (OccurrenceStatus status : values()) {
      if (status.dbValue.equals(value) || status.name().equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown occurrence status: " + value);
  }
}
