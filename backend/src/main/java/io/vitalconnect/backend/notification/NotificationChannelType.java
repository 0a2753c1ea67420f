package io.vitalconnect.backend.notification;

public enum NotificationChannelType {
  DASHBOARD("dashboard"),
  EMAIL("email"),
  SMS("sms"),
  PUSH("push");

  private final String dbValue;

  NotificationChannelType(String dbValue) {
    this.dbValue = dbValue;
  }

  public String dbValue() {
    return dbValue;
  }

  public static NotificationChannelType fromDbValue(String value) {
    for (NotificationChannelType type : values()) {
      if (type.dbValue.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown notification channel: " + value);
  }
}
