package io.vitalconnect.backend.audit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Fluent construction of {@link AuditEventRecord}s. Most callers audit an occurrence, so {@link
 * #forOccurrence(String, UUID)} presets the entity fields:
 *
 * <pre>{@code
 * auditService.log(
 *     AuditEventBuilder.forOccurrence("status_changed", occurrenceId)
 *         .actorId(actorId)
 *         .detail("from", "PENDING")
 *         .detail("to", "IN_PROGRESS")
 *         .build());
 * }</pre>
 *
 * Where the record originated (operator request, ingestion loop, scheduler) is derived from the
 * bound request unless {@link #source(String)} names it.
 */
public class AuditEventBuilder {

  static final String OCCURRENCE = "occurrence";
  static final String SOURCE_API = "API";
  static final String SOURCE_INTERNAL = "INTERNAL";
  static final String SOURCE_INGESTION = "INGESTION";

  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID actorId;
  private String source;
  private final Map<String, Object> details = new LinkedHashMap<>();

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  /** Presets {@code entityType} to "occurrence" and {@code eventType} to "occurrence.{action}". */
  public static AuditEventBuilder forOccurrence(String action, UUID occurrenceId) {
    return builder()
        .eventType(OCCURRENCE + "." + action)
        .entityType(OCCURRENCE)
        .entityId(occurrenceId);
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    return this;
  }

  /** Marks the record as written by the stream ingestion loop. */
  public AuditEventBuilder fromIngestion() {
    return source(SOURCE_INGESTION);
  }

  public AuditEventBuilder detail(String key, Object value) {
    details.put(key, value);
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> entries) {
    details.putAll(entries);
    return this;
  }

  public AuditEventRecord build() {
    if (eventType == null || entityType == null || entityId == null) {
      throw new IllegalStateException("eventType, entityType and entityId are required");
    }
    var origin = Origin.current();
    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        actorId,
        actorId != null ? "USER" : "SYSTEM",
        source != null ? source : origin.source(),
        origin.remoteAddress(),
        details.isEmpty() ? null : Collections.unmodifiableMap(new LinkedHashMap<>(details)));
  }

  /** Request-derived defaults: API with the caller's address inside a request, INTERNAL outside. */
  private record Origin(String source, String remoteAddress) {

    static Origin current() {
      if (RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attrs) {
        return new Origin(SOURCE_API, attrs.getRequest().getRemoteAddr());
      }
      return new Origin(SOURCE_INTERNAL, null);
    }
  }
}
