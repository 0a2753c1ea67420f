package io.vitalconnect.backend.hospital;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/** Read-only view of a registered hospital. */
@Entity
@Immutable
@Table(name = "hospitals")
public class Hospital {

  @Id private UUID id;

  @Column(name = "nome", nullable = false)
  private String name;

  @Column(name = "ativo", nullable = false)
  private boolean active;

  protected Hospital() {}

  public Hospital(UUID id, String name, boolean active) {
    this.id = id;
    this.name = name;
    this.active = active;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public boolean isActive() {
    return active;
  }
}
