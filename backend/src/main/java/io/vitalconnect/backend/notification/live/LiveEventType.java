package io.vitalconnect.backend.notification.live;

public enum LiveEventType {
  CONNECTED("connected"),
  NEW_OCCURRENCE("new-occurrence"),
  OCCURRENCE_UPDATED("occurrence-updated"),
  OUTCOME_REGISTERED("outcome-registered"),
  HEARTBEAT("heartbeat");

  private final String wireName;

  LiveEventType(String wireName) {
    this.wireName = wireName;
  }

  /** SSE event name. */
  public String wireName() {
    return wireName;
  }
}
