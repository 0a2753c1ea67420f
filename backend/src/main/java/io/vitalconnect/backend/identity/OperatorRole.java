package io.vitalconnect.backend.identity;

import java.util.Locale;

public enum OperatorRole {
  OPERATOR("operador"),
  MANAGER("gestor"),
  ADMIN("admin");

  private final String code;

  OperatorRole(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /** Accepts the stored code ("gestor") or the enum name, case-insensitively. */
  public static OperatorRole fromCode(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Role is required");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (OperatorRole role : values()) {
      if (role.code.equals(normalized) || role.name().toLowerCase(Locale.ROOT).equals(normalized)) {
        return role;
      }
    }
    throw new IllegalArgumentException("Unknown role: " + value);
  }
}
