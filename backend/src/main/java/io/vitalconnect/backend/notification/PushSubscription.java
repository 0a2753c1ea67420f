package io.vitalconnect.backend.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/** A device token registered for push alerts. */
@Entity
@Immutable
@Table(name = "push_subscriptions")
public class PushSubscription {

  @Id private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "token", nullable = false, columnDefinition = "TEXT")
  private String token;

  @Column(name = "platform", nullable = false, length = 20)
  private String platform;

  protected PushSubscription() {}

  public PushSubscription(UUID id, UUID userId, String token, String platform) {
    this.id = id;
    this.userId = userId;
    this.token = token;
    this.platform = platform;
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getToken() {
    return token;
  }

  public String getPlatform() {
    return platform;
  }
}
