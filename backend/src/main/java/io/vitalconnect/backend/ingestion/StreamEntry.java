package io.vitalconnect.backend.ingestion;

import java.util.Map;

/** One entry read from the death-report stream: its stream id and flat field map. */
public record StreamEntry(String id, Map<String, String> fields) {

  public StreamEntry {
    fields = Map.copyOf(fields);
  }
}
