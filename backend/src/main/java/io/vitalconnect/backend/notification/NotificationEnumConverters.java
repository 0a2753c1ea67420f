package io.vitalconnect.backend.notification;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Maps notification enums to their lower-case database codes. */
public final class NotificationEnumConverters {

  private NotificationEnumConverters() {}

  @Converter
  public static class ChannelConverter
      implements AttributeConverter<NotificationChannelType, String> {

    @Override
    public String convertToDatabaseColumn(NotificationChannelType channel) {
      return channel != null ? channel.dbValue() : null;
    }

    @Override
    public NotificationChannelType convertToEntityAttribute(String value) {
      return value != null ? NotificationChannelType.fromDbValue(value) : null;
    }
  }

  @Converter
  public static class StatusConverter implements AttributeConverter<NotificationStatus, String> {

    @Override
    public String convertToDatabaseColumn(NotificationStatus status) {
      return status != null ? status.dbValue() : null;
    }

    @Override
    public NotificationStatus convertToEntityAttribute(String value) {
      return value != null ? NotificationStatus.fromDbValue(value) : null;
    }
  }
}
