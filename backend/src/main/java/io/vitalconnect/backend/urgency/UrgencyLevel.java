package io.vitalconnect.backend.urgency;

/** Display urgency of an occurrence, ordered by {@link #severity()}. */
public enum UrgencyLevel {
  NONE(0),
  GREEN(1),
  YELLOW(2),
  RED(3);

  private final int severity;

  UrgencyLevel(int severity) {
    this.severity = severity;
  }

  public int severity() {
    return severity;
  }

  public boolean isMoreSevereThan(UrgencyLevel other) {
    return severity > other.severity;
  }

  /** Lower-case wire code used in live payloads ("red", "yellow", ...). */
  public String code() {
    return name().toLowerCase();
  }
}
