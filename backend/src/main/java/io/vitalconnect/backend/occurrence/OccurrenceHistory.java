package io.vitalconnect.backend.occurrence;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/** One row of an occurrence's append-only handling trail. */
@Entity
@Immutable
@Table(name = "occurrence_history")
public class OccurrenceHistory {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "occurrence_id", nullable = false)
  private UUID occurrenceId;

  @Column(name = "user_id")
  private UUID actorId;

  @Column(name = "acao", nullable = false, length = 100)
  private String action;

  @Convert(converter = OccurrenceStatusConverter.class)
  @Column(name = "status_anterior", columnDefinition = "occurrence_status")
  private OccurrenceStatus previousStatus;

  @Convert(converter = OccurrenceStatusConverter.class)
  @Column(name = "status_novo", columnDefinition = "occurrence_status")
  private OccurrenceStatus newStatus;

  @Column(name = "observacoes", columnDefinition = "TEXT")
  private String notes;

  @Convert(converter = OutcomeTypeConverter.class)
  @Column(name = "desfecho", columnDefinition = "outcome_type")
  private OutcomeType outcome;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected OccurrenceHistory() {}

  private OccurrenceHistory(
      UUID occurrenceId,
      UUID actorId,
      String action,
      OccurrenceStatus previousStatus,
      OccurrenceStatus newStatus,
      String notes,
      OutcomeType outcome,
      Instant createdAt) {
    this.occurrenceId = occurrenceId;
    this.actorId = actorId;
    this.action = action;
    this.previousStatus = previousStatus;
    this.newStatus = newStatus;
    this.notes = notes;
    this.outcome = outcome;
    this.createdAt = createdAt;
  }

  public static OccurrenceHistory created(UUID occurrenceId, Instant at) {
    return new OccurrenceHistory(
        occurrenceId,
        null,
        OccurrenceStatus.PENDING.historyAction(),
        null,
        OccurrenceStatus.PENDING,
        null,
        null,
        at);
  }

  public static OccurrenceHistory transition(
      UUID occurrenceId,
      UUID actorId,
      OccurrenceStatus from,
      OccurrenceStatus to,
      String notes,
      Instant at) {
    return new OccurrenceHistory(
        occurrenceId, actorId, to.historyAction(), from, to, notes, null, at);
  }

  public static OccurrenceHistory outcome(
      UUID occurrenceId,
      UUID actorId,
      OccurrenceStatus status,
      OutcomeType outcome,
      String notes,
      Instant at) {
    return new OccurrenceHistory(
        occurrenceId,
        actorId,
        "Outcome registered: " + outcome.label(),
        status,
        status,
        notes,
        outcome,
        at);
  }

  public UUID getId() {
    return id;
  }

  public UUID getOccurrenceId() {
    return occurrenceId;
  }

  public UUID getActorId() {
    return actorId;
  }

  public String getAction() {
    return action;
  }

  public OccurrenceStatus getPreviousStatus() {
    return previousStatus;
  }

  public OccurrenceStatus getNewStatus() {
    return newStatus;
  }

  public String getNotes() {
    return notes;
  }

  public OutcomeType getOutcome() {
    return outcome;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
