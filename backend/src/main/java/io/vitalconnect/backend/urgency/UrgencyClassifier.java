package io.vitalconnect.backend.urgency;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import org.springframework.stereotype.Component;

/**
 * Maps the time left in a capture window to an {@link UrgencyLevel}. Remaining time is truncated to
 * whole minutes: under 120 minutes is RED, under 240 is YELLOW, anything else is GREEN. A window
 * that already expired is RED.
 *
 * <p>Levels are never stored; callers classify at the moment they build a payload.
 */
@Component
public class UrgencyClassifier {

  static final long RED_THRESHOLD_MINUTES = 120;
  static final long YELLOW_THRESHOLD_MINUTES = 240;

  private final Clock clock;

  public UrgencyClassifier(Clock clock) {
    this.clock = clock;
  }

  public UrgencyLevel classify(Instant windowExpiresAt, Instant now) {
    long remaining = remainingMinutes(windowExpiresAt, now);
    if (remaining < RED_THRESHOLD_MINUTES) {
      return UrgencyLevel.RED;
    }
    if (remaining < YELLOW_THRESHOLD_MINUTES) {
      return UrgencyLevel.YELLOW;
    }
    return UrgencyLevel.GREEN;
  }

  public UrgencyLevel classify(Instant windowExpiresAt) {
    return classify(windowExpiresAt, clock.instant());
  }

  /** Most severe level across the given windows; {@link UrgencyLevel#NONE} when there are none. */
  public UrgencyLevel aggregate(Collection<Instant> windowExpiries, Instant now) {
    var result = UrgencyLevel.NONE;
    for (Instant expiresAt : windowExpiries) {
      var level = classify(expiresAt, now);
      if (level.isMoreSevereThan(result)) {
        result = level;
      }
    }
    return result;
  }

  public UrgencyLevel aggregate(Collection<Instant> windowExpiries) {
    return aggregate(windowExpiries, clock.instant());
  }

  public long remainingMinutes(Instant windowExpiresAt, Instant now) {
    return Duration.between(now, windowExpiresAt).toMinutes();
  }

  /** Human-readable remaining time: "5h 12min", "3h", "45min" or "expired". */
  public String formatRemaining(Instant windowExpiresAt, Instant now) {
    if (!now.isBefore(windowExpiresAt)) {
      return "expired";
    }
    long minutes = remainingMinutes(windowExpiresAt, now);
    long hours = minutes / 60;
    long rest = minutes % 60;
    if (hours == 0) {
      return rest + "min";
    }
    return rest == 0 ? hours + "h" : hours + "h " + rest + "min";
  }

  public String formatRemaining(Instant windowExpiresAt) {
    return formatRemaining(windowExpiresAt, clock.instant());
  }
}
