package io.vitalconnect.backend.identity;

import io.vitalconnect.backend.exception.UnauthenticatedException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

/** Resolves the already-authenticated caller of a request. */
public interface OperatorIdentityResolver {

  Optional<OperatorIdentity> resolve(HttpServletRequest request);

  default OperatorIdentity require(HttpServletRequest request) {
    return resolve(request)
        .orElseThrow(() -> new UnauthenticatedException("No operator identity on the request"));
  }
}
