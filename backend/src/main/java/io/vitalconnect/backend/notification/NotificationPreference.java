package io.vitalconnect.backend.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;

/** Per-user channel opt-ins. The dashboard channel cannot be turned off for alerts. */
@Entity
@Table(name = "user_notification_preferences")
public class NotificationPreference {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, unique = true)
  private UUID userId;

  @Column(name = "sms_enabled", nullable = false)
  private boolean smsEnabled;

  @Column(name = "email_enabled", nullable = false)
  private boolean emailEnabled;

  @Column(name = "push_enabled", nullable = false)
  private boolean pushEnabled;

  @Column(name = "dashboard_enabled", nullable = false)
  private boolean dashboardEnabled;

  protected NotificationPreference() {}

  public NotificationPreference(
      UUID userId, boolean smsEnabled, boolean emailEnabled, boolean pushEnabled) {
    this.userId = userId;
    this.smsEnabled = smsEnabled;
    this.emailEnabled = emailEnabled;
    this.pushEnabled = pushEnabled;
    this.dashboardEnabled = true;
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public boolean isSmsEnabled() {
    return smsEnabled;
  }

  public boolean isEmailEnabled() {
    return emailEnabled;
  }

  public boolean isPushEnabled() {
    return pushEnabled;
  }

  public boolean isDashboardEnabled() {
    return dashboardEnabled;
  }
}
