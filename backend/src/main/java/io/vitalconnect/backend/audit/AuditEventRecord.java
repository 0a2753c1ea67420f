package io.vitalconnect.backend.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Value passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}, which fills source and request metadata when they are not set explicitly.
 *
 * @param eventType free-form event type following the {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "occurrence")
 * @param entityId ID of the affected entity
 * @param actorId user ID of the acting operator; null for system-initiated events
 * @param actorType USER or SYSTEM
 * @param source origin of the action: API, INGESTION or INTERNAL
 * @param ipAddress client IP; null for non-HTTP sources
 * @param details key field changes; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    UUID actorId,
    String actorType,
    String source,
    String ipAddress,
    Map<String, Object> details) {}
