package io.vitalconnect.backend.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * One delivery attempt of an occurrence alert on one channel. A record starts PENDING and moves
 * once to SENT or FAILED; a retry is a new record.
 */
@Entity
@Table(name = "notifications")
public class NotificationRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "occurrence_id", nullable = false, updatable = false)
  private UUID occurrenceId;

  @Column(name = "user_id", updatable = false)
  private UUID userId;

  @Convert(converter = NotificationEnumConverters.ChannelConverter.class)
  @Column(
      name = "canal",
      nullable = false,
      updatable = false,
      columnDefinition = "notification_channel")
  private NotificationChannelType channel;

  @Convert(converter = NotificationEnumConverters.StatusConverter.class)
  @Column(name = "status_envio", nullable = false, length = 50)
  private NotificationStatus status;

  @Column(name = "destino")
  private String target;

  @Column(name = "erro_mensagem", columnDefinition = "TEXT")
  private String errorMessage;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "enviado_em")
  private Instant completedAt;

  protected NotificationRecord() {}

  public NotificationRecord(
      UUID occurrenceId,
      UUID userId,
      NotificationChannelType channel,
      String target,
      Instant createdAt) {
    this.occurrenceId = occurrenceId;
    this.userId = userId;
    this.channel = channel;
    this.target = target;
    this.status = NotificationStatus.PENDING;
    this.createdAt = createdAt;
  }

  public void markSent(Instant at) {
    requirePending();
    this.status = NotificationStatus.SENT;
    this.completedAt = at;
  }

  public void markFailed(String error, Instant at) {
    requirePending();
    this.status = NotificationStatus.FAILED;
    this.errorMessage = error;
    this.completedAt = at;
  }

  private void requirePending() {
    if (status.isTerminal()) {
      throw new IllegalStateException(
          "Notification " + id + " is already " + status + " and cannot change");
    }
  }

  public UUID getId() {
    return id;
  }

  public UUID getOccurrenceId() {
    return occurrenceId;
  }

  public UUID getUserId() {
    return userId;
  }

  public NotificationChannelType getChannel() {
    return channel;
  }

  public NotificationStatus getStatus() {
    return status;
  }

  public String getTarget() {
    return target;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }
}
