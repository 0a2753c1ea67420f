package io.vitalconnect.backend.occurrence;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class OutcomeTypeConverter implements AttributeConverter<OutcomeType, String> {

  @Override
  public String convertToDatabaseColumn(OutcomeType outcome) {
    return outcome != null ? outcome.dbValue() : null;
  }

  @Override
  public OutcomeType convertToEntityAttribute(String value) {
    return value != null ? OutcomeType.fromDbValue(value) : null;
  }
}
