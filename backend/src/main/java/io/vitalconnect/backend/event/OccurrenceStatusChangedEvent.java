package io.vitalconnect.backend.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record OccurrenceStatusChangedEvent(
    String eventType,
    UUID occurrenceId,
    UUID hospitalId,
    UUID tenantId,
    UUID actorId,
    Instant occurredAt,
    Map<String, Object> details,
    String oldStatus,
    String newStatus,
    String sector,
    String maskedPatientName,
    int priorityScore,
    Instant deathAt,
    Instant windowExpiresAt)
    implements DomainEvent {}
