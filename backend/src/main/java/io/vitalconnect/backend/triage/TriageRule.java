package io.vitalconnect.backend.triage;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Read-only view of a tenant's triage rule. Rules are administered elsewhere; the pipeline only
 * loads and compiles them.
 */
@Entity
@Immutable
@Table(name = "triagem_rules")
public class TriageRule {

  @Id private UUID id;

  @Column(name = "tenant_id")
  private UUID tenantId;

  @Column(name = "nome", nullable = false)
  private String name;

  @Column(name = "descricao", columnDefinition = "TEXT")
  private String description;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "regras", nullable = false, columnDefinition = "jsonb")
  private Map<String, Object> definition;

  @Column(name = "ativo", nullable = false)
  private boolean active;

  @Column(name = "prioridade", nullable = false)
  private int priority;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TriageRule() {}

  public TriageRule(
      UUID id,
      UUID tenantId,
      String name,
      Map<String, Object> definition,
      boolean active,
      int priority) {
    this.id = id;
    this.tenantId = tenantId;
    this.name = name;
    this.definition = definition;
    this.active = active;
    this.priority = priority;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public Map<String, Object> getDefinition() {
    return definition;
  }

  public boolean isActive() {
    return active;
  }

  public int getPriority() {
    return priority;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
