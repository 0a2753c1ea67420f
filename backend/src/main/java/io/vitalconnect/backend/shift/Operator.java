package io.vitalconnect.backend.shift;

import io.vitalconnect.backend.identity.OperatorRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/** Read-only view of a platform user who can receive alerts. */
@Entity
@Immutable
@Table(name = "users")
public class Operator {

  @Id private UUID id;

  @Column(name = "email", nullable = false)
  private String email;

  @Column(name = "nome", nullable = false)
  private String name;

  @Column(name = "role", nullable = false)
  private String role;

  @Column(name = "ativo", nullable = false)
  private boolean active;

  @Column(name = "mobile_phone")
  private String mobilePhone;

  protected Operator() {}

  public Operator(
      UUID id, String email, String name, OperatorRole role, boolean active, String mobilePhone) {
    this.id = id;
    this.email = email;
    this.name = name;
    this.role = role.code();
    this.active = active;
    this.mobilePhone = mobilePhone;
  }

  public UUID getId() {
    return id;
  }

  public String getEmail() {
    return email;
  }

  public String getName() {
    return name;
  }

  public OperatorRole getRole() {
    return OperatorRole.fromCode(role);
  }

  public boolean isActive() {
    return active;
  }

  public String getMobilePhone() {
    return mobilePhone;
  }
}
