package io.vitalconnect.backend.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Base interface for occurrence events published via Spring's ApplicationEventPublisher. All
 * implementations are records holding plain values only, never JPA entities, so they stay valid
 * after the publishing transaction commits.
 *
 * <p>Events carry enough context for the live hub to build its payload without touching the
 * database.
 */
public sealed interface DomainEvent
    permits OccurrenceCreatedEvent, OccurrenceStatusChangedEvent, OccurrenceOutcomeRegisteredEvent {

  String eventType();

  UUID occurrenceId();

  UUID hospitalId();

  UUID tenantId();

  /** Acting user; null for system-initiated events. */
  UUID actorId();

  Instant occurredAt();

  Map<String, Object> details();
}
