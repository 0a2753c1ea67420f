package io.vitalconnect.backend.ingestion;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Turns a stream entry into a {@link RawDeathEvent}. Entries are flat field maps; an entry whose
 * {@code data} field holds a JSON document is flattened first. Both the detector's Portuguese keys
 * ({@code obito_id}, {@code data_obito}, ...) and English keys are accepted.
 *
 * <p>Hospital id, death time and cause of death are required. Timestamps either carry an offset
 * (or {@code Z}) or are local date-times in the configured zone.
 */
@Component
public class DeathEventParser {

  private static final String DATA_FIELD = "data";

  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final ZoneId zone;

  @Autowired
  public DeathEventParser(ObjectMapper objectMapper, Clock clock, IngestionProperties properties) {
    this(objectMapper, clock, properties.zoneId());
  }

  DeathEventParser(ObjectMapper objectMapper, Clock clock, ZoneId zone) {
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.zone = zone;
  }

  public RawDeathEvent parse(StreamEntry entry) {
    Map<String, Object> fields = flatten(entry);

    String hospital = text(fields, "hospital_id", "hospitalId");
    if (hospital == null) {
      throw new InvalidDeathEventException("missing hospital_id");
    }
    String deathAt = text(fields, "data_obito", "death_at");
    if (deathAt == null) {
      throw new InvalidDeathEventException("missing data_obito");
    }
    String cause = text(fields, "causa_mortis", "cause_of_death");
    if (cause == null) {
      throw new InvalidDeathEventException("missing causa_mortis");
    }
    String eventId = text(fields, "obito_id", "event_id");
    String detectedAt = text(fields, "timestamp_deteccao", "detected_at");
    String tenant = text(fields, "tenant_id", "tenantId");
    String birthDate = text(fields, "data_nascimento", "birth_date");
    String age = text(fields, "idade", "age");

    return new RawDeathEvent(
        eventId != null ? eventId : entry.id(),
        tenant != null ? uuid(tenant, "tenant_id") : null,
        uuid(hospital, "hospital_id"),
        text(fields, "nome_paciente", "patient_name"),
        birthDate != null ? date(birthDate) : null,
        age != null ? integer(age, "idade") : null,
        timestamp(deathAt, "data_obito"),
        detectedAt != null
            ? timestamp(detectedAt, "timestamp_deteccao")
            : OffsetDateTime.now(clock),
        cause,
        text(fields, "setor", "sector"),
        text(fields, "leito", "bed"),
        text(fields, "prontuario", "medical_record"),
        flag(text(fields, "identificacao_desconhecida", "identity_unknown")),
        EventOrigin.fromCode(text(fields, "origem", "origin")));
  }

  private Map<String, Object> flatten(StreamEntry entry) {
    Map<String, Object> fields = new LinkedHashMap<>(entry.fields());
    String data = entry.fields().get(DATA_FIELD);
    if (data != null && !data.isBlank()) {
      try {
        Map<String, Object> document = objectMapper.readValue(data, new TypeReference<>() {});
        fields.remove(DATA_FIELD);
        fields.putAll(document);
      } catch (JacksonException e) {
        throw new InvalidDeathEventException("data field is not a JSON object", e);
      }
    }
    return fields;
  }

  private static String text(Map<String, Object> fields, String key, String alias) {
    Object value = fields.get(key);
    if (value == null) {
      value = fields.get(alias);
    }
    if (value == null) {
      return null;
    }
    String text = String.valueOf(value).trim();
    return text.isEmpty() || text.equals("null") ? null : text;
  }

  private static UUID uuid(String value, String field) {
    try {
      return UUID.fromString(value);
    } catch (IllegalArgumentException e) {
      throw new InvalidDeathEventException(field + " is not a UUID: " + value, e);
    }
  }

  private static Integer integer(String value, String field) {
    try {
      return Integer.valueOf(value);
    } catch (NumberFormatException e) {
      throw new InvalidDeathEventException(field + " is not a number: " + value, e);
    }
  }

  private static boolean flag(String value) {
    if (value == null) {
      return false;
    }
    String normalized = value.toLowerCase(Locale.ROOT);
    return normalized.equals("true") || normalized.equals("1") || normalized.equals("sim");
  }

  private static LocalDate date(String value) {
    try {
      return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
    } catch (DateTimeException e) {
      throw new InvalidDeathEventException("invalid birth date: " + value, e);
    }
  }

  private OffsetDateTime timestamp(String value, String field) {
    try {
      TemporalAccessor parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(
              value, OffsetDateTime::from, LocalDateTime::from);
      if (parsed instanceof OffsetDateTime offsetDateTime) {
        return offsetDateTime;
      }
      return ((LocalDateTime) parsed).atZone(zone).toOffsetDateTime();
    } catch (DateTimeException e) {
      throw new InvalidDeathEventException(field + " is not a timestamp: " + value, e);
    }
  }
}
