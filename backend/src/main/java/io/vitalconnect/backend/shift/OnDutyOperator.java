package io.vitalconnect.backend.shift;

import io.vitalconnect.backend.identity.OperatorRole;
import java.util.UUID;

/** Alert recipient resolved for a hospital at a point in time. */
public record OnDutyOperator(
    UUID userId, String name, String email, String mobilePhone, OperatorRole role) {

  public static OnDutyOperator from(Operator operator) {
    return new OnDutyOperator(
        operator.getId(),
        operator.getName(),
        operator.getEmail(),
        operator.getMobilePhone(),
        operator.getRole());
  }

  public boolean hasMobilePhone() {
    return mobilePhone != null && !mobilePhone.isBlank();
  }
}
