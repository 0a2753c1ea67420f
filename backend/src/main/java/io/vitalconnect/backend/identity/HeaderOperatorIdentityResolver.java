package io.vitalconnect.backend.identity;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Trusts the identity headers set by the authenticating gateway: {@code X-User-Id}, {@code
 * X-User-Role} and a comma-separated {@code X-Hospital-Ids}.
 */
@Component
public class HeaderOperatorIdentityResolver implements OperatorIdentityResolver {

  static final String USER_ID_HEADER = "X-User-Id";
  static final String ROLE_HEADER = "X-User-Role";
  static final String HOSPITALS_HEADER = "X-Hospital-Ids";

  private static final Logger log = LoggerFactory.getLogger(HeaderOperatorIdentityResolver.class);

  @Override
  public Optional<OperatorIdentity> resolve(HttpServletRequest request) {
    String userId = request.getHeader(USER_ID_HEADER);
    String role = request.getHeader(ROLE_HEADER);
    if (userId == null || userId.isBlank() || role == null || role.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(
          new OperatorIdentity(
              UUID.fromString(userId.trim()),
              OperatorRole.fromCode(role),
              parseHospitals(request.getHeader(HOSPITALS_HEADER))));
    } catch (IllegalArgumentException e) {
      log.warn("Ignoring malformed identity headers: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private static Set<UUID> parseHospitals(String header) {
    if (header == null || header.isBlank()) {
      return Set.of();
    }
    return Arrays.stream(header.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .map(UUID::fromString)
        .collect(Collectors.toSet());
  }
}
