package io.vitalconnect.backend.ingestion;

import java.util.Locale;

/** Where a death report came from. */
public enum EventOrigin {
  MANUAL,
  SIMULATED,
  EXTERNAL_FEED;

  /** Lenient decoding of the stream's origin tag; unknown or missing tags mean an external feed. */
  public static EventOrigin fromCode(String code) {
    if (code == null || code.isBlank()) {
      return EXTERNAL_FEED;
    }
    return switch (code.trim().toLowerCase(Locale.ROOT)) {
      case "manual" -> MANUAL;
      case "simulated", "simulado", "simulator", "listener" -> SIMULATED;
      default -> EXTERNAL_FEED;
    };
  }
}
