package io.vitalconnect.backend.occurrence;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class OccurrenceStatusConverter implements AttributeConverter<OccurrenceStatus, String> {

  @Override
  public String convertToDatabaseColumn(OccurrenceStatus status) {
    return status != null ? status.dbValue() : null;
  }

  @Override
  public OccurrenceStatus convertToEntityAttribute(String value) {
    return value != null ? OccurrenceStatus.fromDbValue(value) : null;
  }
}
