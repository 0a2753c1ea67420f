package io.vitalconnect.backend.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record OccurrenceOutcomeRegisteredEvent(
    String eventType,
    UUID occurrenceId,
    UUID hospitalId,
    UUID tenantId,
    UUID actorId,
    Instant occurredAt,
    Map<String, Object> details,
    String outcome,
    String status,
    Instant windowExpiresAt)
    implements DomainEvent {}
