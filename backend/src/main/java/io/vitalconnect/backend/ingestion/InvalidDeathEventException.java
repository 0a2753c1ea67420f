package io.vitalconnect.backend.ingestion;

/** A stream entry that cannot be turned into a {@link RawDeathEvent}. */
public class InvalidDeathEventException extends RuntimeException {

  public InvalidDeathEventException(String message) {
    super(message);
  }

  public InvalidDeathEventException(String message, Throwable cause) {
    super(message, cause);
  }
}
