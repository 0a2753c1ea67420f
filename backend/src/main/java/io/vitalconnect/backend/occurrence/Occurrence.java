package io.vitalconnect.backend.occurrence;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * An eligible death report under human handling. Status and outcome change only through {@link
 * OccurrenceLifecycleService}; the capture window is fixed at creation.
 */
@Entity
@Table(name = "occurrences")
public class Occurrence {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id")
  private UUID tenantId;

  @Column(name = "source_event_id", nullable = false, updatable = false, unique = true)
  private String sourceEventId;

  @Column(name = "hospital_id", nullable = false, updatable = false)
  private UUID hospitalId;

  @Convert(converter = OccurrenceStatusConverter.class)
  @Column(name = "status", nullable = false, columnDefinition = "occurrence_status")
  private OccurrenceStatus status;

  @Column(name = "score_priorizacao", nullable = false)
  private int priorityScore;

  @Column(name = "nome_paciente_mascarado", nullable = false)
  private String maskedPatientName;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "dados_completos", nullable = false, columnDefinition = "jsonb")
  private Map<String, Object> patientPayload;

  @Column(name = "setor", length = 100)
  private String sector;

  @Column(name = "data_obito", nullable = false, updatable = false)
  private Instant deathAt;

  @Column(name = "janela_expira_em", nullable = false, updatable = false)
  private Instant windowExpiresAt;

  @Convert(converter = OutcomeTypeConverter.class)
  @Column(name = "desfecho", columnDefinition = "outcome_type")
  private OutcomeType outcome;

  @Column(name = "desfecho_registrado_em")
  private Instant outcomeRegisteredAt;

  @Column(name = "notificado_em")
  private Instant notifiedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Occurrence() {}

  public Occurrence(
      UUID tenantId,
      String sourceEventId,
      UUID hospitalId,
      int priorityScore,
      String maskedPatientName,
      Map<String, Object> patientPayload,
      String sector,
      Instant deathAt,
      Instant windowExpiresAt,
      Instant createdAt) {
    this.tenantId = tenantId;
    this.sourceEventId = sourceEventId;
    this.hospitalId = hospitalId;
    this.status = OccurrenceStatus.PENDING;
    this.priorityScore = priorityScore;
    this.maskedPatientName = maskedPatientName;
    this.patientPayload = patientPayload;
    this.sector = sector;
    this.deathAt = deathAt;
    this.windowExpiresAt = windowExpiresAt;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  void changeStatus(OccurrenceStatus target, Instant at) {
    this.status = target;
    this.updatedAt = at;
  }

  void recordOutcome(OutcomeType outcome, Instant at) {
    this.outcome = outcome;
    this.outcomeRegisteredAt = at;
    this.updatedAt = at;
  }

  /** Stamps the first alert dispatch. Returns false when the occurrence was already notified. */
  public boolean markNotified(Instant at) {
    if (notifiedAt != null) {
      return false;
    }
    this.notifiedAt = at;
    this.updatedAt = at;
    return true;
  }

  public boolean hasOutcome() {
    return outcome != null;
  }

  public UUID getId() {
    return id;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public String getSourceEventId() {
    return sourceEventId;
  }

  public UUID getHospitalId() {
    return hospitalId;
  }

  public OccurrenceStatus getStatus() {
    return status;
  }

  public int getPriorityScore() {
    return priorityScore;
  }

  public String getMaskedPatientName() {
    return maskedPatientName;
  }

  public Map<String, Object> getPatientPayload() {
    return patientPayload;
  }

  public String getSector() {
    return sector;
  }

  public Instant getDeathAt() {
    return deathAt;
  }

  public Instant getWindowExpiresAt() {
    return windowExpiresAt;
  }

  public OutcomeType getOutcome() {
    return outcome;
  }

  public Instant getOutcomeRegisteredAt() {
    return outcomeRegisteredAt;
  }

  public Instant getNotifiedAt() {
    return notifiedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
