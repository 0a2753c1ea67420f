package io.vitalconnect.backend.notification;

public enum NotificationStatus {
  PENDING("pendente"),
  SENT("enviado"),
  FAILED("falha");

  private final String dbValue;

  NotificationStatus(String dbValue) {
    this.dbValue = dbValue;
  }

  public String dbValue() {
    return dbValue;
  }

  public boolean isTerminal() {
    return this != PENDING;
  }

  public static NotificationStatus fromDbValue(String value) {
    for (NotificationStatus status : values()) {
      if (status.dbValue.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown notification status: " + value);
  }
}
