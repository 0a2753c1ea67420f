package io.vitalconnect.backend.notification.live;

import io.vitalconnect.backend.identity.OperatorRole;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * A message pushed to live operator sessions.
 *
 * @param hospitalId hospital the event belongs to; null for session-level events (connected,
 *     heartbeat)
 * @param targetRoles roles that should receive the event; empty means every role
 */
public record LiveEvent(
    LiveEventType type,
    UUID hospitalId,
    Set<OperatorRole> targetRoles,
    Map<String, Object> payload,
    Instant createdAt) {

  public LiveEvent {
    targetRoles = targetRoles != null ? Set.copyOf(targetRoles) : Set.of();
    payload = payload != null ? Map.copyOf(payload) : Map.of();
  }

  public static LiveEvent forHospital(
      LiveEventType type, UUID hospitalId, Map<String, Object> payload, Instant createdAt) {
    return new LiveEvent(type, hospitalId, Set.of(), payload, createdAt);
  }

  public static LiveEvent session(LiveEventType type, Map<String, Object> payload, Instant at) {
    return new LiveEvent(type, null, Set.of(), payload, at);
  }
}
