package io.vitalconnect.backend.occurrence;

/**
 * Reduces a patient name to what list views may show: the first name, followed by the initial of
 * every other name part ("Maria da Silva" becomes "Maria d. S.").
 */
public final class PatientNameMasker {

  public static final String UNIDENTIFIED = "Nao identificado";

  private PatientNameMasker() {}

  public static String mask(String fullName, boolean identityUnknown) {
    if (identityUnknown || fullName == null || fullName.isBlank()) {
      return UNIDENTIFIED;
    }
    String[] parts = fullName.trim().split("\\s+");
    var masked = new StringBuilder(parts[0]);
    for (int i = 1; i < parts.length; i++) {
      masked.append(' ').appendCodePoint(parts[i].codePointAt(0)).append('.');
    }
    return masked.toString();
  }
}
