package io.vitalconnect.backend.occurrence;

public enum OutcomeType {
  DONATION_SUCCESSFUL("sucesso_captacao", "Successful donation"),
  FAMILY_REFUSED("familia_recusou", "Family refused"),
  MEDICAL_CONTRAINDICATION("contraindicacao_medica", "Medical contraindication"),
  WINDOW_EXPIRED("tempo_excedido", "Capture window expired"),
  OTHER("outro", "Other");

  private final String dbValue;
  private final String label;

  OutcomeType(String dbValue, String label) {
    this.dbValue = dbValue;
    this.label = label;
  }

  public String dbValue() {
    return dbValue;
  }

  public String label() {
    return label;
  }

  public static OutcomeType fromDbValue(String value) {
    for (OutcomeType type : values()) {
      if (type.dbValue.equals(value) || type.name().equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown outcome type: " + value);
  }
}
