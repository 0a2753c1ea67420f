package io.vitalconnect.backend.identity;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * An authenticated operator as seen by the pipeline.
 *
 * @param hospitalIds hospitals the operator may see; empty for an admin means every hospital
 */
public record OperatorIdentity(UUID userId, OperatorRole role, Set<UUID> hospitalIds) {

  public OperatorIdentity {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(role, "role");
    hospitalIds = hospitalIds != null ? Set.copyOf(hospitalIds) : Set.of();
  }

  public boolean canSeeHospital(UUID hospitalId) {
    if (role == OperatorRole.ADMIN && hospitalIds.isEmpty()) {
      return true;
    }
    return hospitalIds.contains(hospitalId);
  }
}
