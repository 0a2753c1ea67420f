package io.vitalconnect.backend.identity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.vitalconnect.backend.exception.UnauthenticatedException;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class HeaderOperatorIdentityResolverTest {

  private static final UUID USER = UUID.fromString("8d0b7c1e-52a4-4a6f-b0f4-5c2f3c9d1e01");
  private static final UUID HOSPITAL_A = UUID.fromString("2f1d7c7e-6a55-4c1e-9a5b-0d3c9b1e7a10");
  private static final UUID HOSPITAL_B = UUID.fromString("6b3e9a20-0c4f-4d7e-8f51-2a9d7e3b4c22");

  private final HeaderOperatorIdentityResolver resolver = new HeaderOperatorIdentityResolver();

  @Test
  void resolvesOperatorFromHeaders() {
    var request = new MockHttpServletRequest();
    request.addHeader("X-User-Id", USER.toString());
    request.addHeader("X-User-Role", "operador");
    request.addHeader("X-Hospital-Ids", HOSPITAL_A + ", " + HOSPITAL_B);

    var identity = resolver.resolve(request).orElseThrow();

    assertThat(identity.userId()).isEqualTo(USER);
    assertThat(identity.role()).isEqualTo(OperatorRole.OPERATOR);
    assertThat(identity.hospitalIds()).containsExactlyInAnyOrder(HOSPITAL_A, HOSPITAL_B);
    assertThat(identity.canSeeHospital(HOSPITAL_A)).isTrue();
    assertThat(identity.canSeeHospital(UUID.randomUUID())).isFalse();
  }

  @Test
  void adminWithoutHospitalsSeesEverything() {
    var request = new MockHttpServletRequest();
    request.addHeader("X-User-Id", USER.toString());
    request.addHeader("X-User-Role", "ADMIN");

    var identity = resolver.resolve(request).orElseThrow();

    assertThat(identity.role()).isEqualTo(OperatorRole.ADMIN);
    assertThat(identity.canSeeHospital(UUID.randomUUID())).isTrue();
  }

  @Test
  void managerWithoutHospitalsSeesNothing() {
    var identity = new OperatorIdentity(USER, OperatorRole.MANAGER, null);

    assertThat(identity.canSeeHospital(HOSPITAL_A)).isFalse();
  }

  @Test
  void malformedHeadersYieldNoIdentity() {
    var request = new MockHttpServletRequest();
    request.addHeader("X-User-Id", "not-a-uuid");
    request.addHeader("X-User-Role", "operador");

    assertThat(resolver.resolve(request)).isEmpty();
  }

  @Test
  void unknownRoleYieldsNoIdentity() {
    var request = new MockHttpServletRequest();
    request.addHeader("X-User-Id", USER.toString());
    request.addHeader("X-User-Role", "visitante");

    assertThat(resolver.resolve(request)).isEmpty();
  }

  @Test
  void requireThrowsWhenHeadersAreMissing() {
    assertThatThrownBy(() -> resolver.require(new MockHttpServletRequest()))
        .isInstanceOf(UnauthenticatedException.class);
  }
}
