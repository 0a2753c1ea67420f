package io.vitalconnect.backend.shift;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Who should be alerted about a hospital's occurrence. */
public interface OnDutyRoster {

  /**
   * Operators on shift at the hospital at {@code at}; the hospital's active managers when nobody
   * is on shift. Empty only when the hospital has neither.
   */
  List<OnDutyOperator> onDutyOperators(UUID hospitalId, Instant at);
}
