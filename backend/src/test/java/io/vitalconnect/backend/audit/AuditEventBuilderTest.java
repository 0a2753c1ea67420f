package io.vitalconnect.backend.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

class AuditEventBuilderTest {

  @AfterEach
  void tearDown() {
    RequestContextHolder.resetRequestAttributes();
  }

  @Test
  void outsideRequestDefaultsToSystemAndInternal() {
    var entityId = UUID.randomUUID();

    var record =
        AuditEventBuilder.builder()
            .eventType("occurrence.created")
            .entityType("occurrence")
            .entityId(entityId)
            .details(Map.of("score", 100))
            .build();

    assertThat(record.entityId()).isEqualTo(entityId);
    assertThat(record.actorType()).isEqualTo("SYSTEM");
    assertThat(record.source()).isEqualTo("INTERNAL");
    assertThat(record.ipAddress()).isNull();
  }

  @Test
  void insideRequestCapturesApiSourceAndAddress() {
    var request = new MockHttpServletRequest();
    request.setRemoteAddr("10.0.0.7");
    RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));

    var record =
        AuditEventBuilder.builder()
            .eventType("occurrence.status_changed")
            .entityType("occurrence")
            .entityId(UUID.randomUUID())
            .actorId(UUID.randomUUID())
            .build();

    assertThat(record.actorType()).isEqualTo("USER");
    assertThat(record.source()).isEqualTo("API");
    assertThat(record.ipAddress()).isEqualTo("10.0.0.7");
  }

  @Test
  void explicitSourceWins() {
    var record =
        AuditEventBuilder.builder()
            .eventType("occurrence.created")
            .entityType("occurrence")
            .entityId(UUID.randomUUID())
            .source("INGESTION")
            .build();

    assertThat(record.source()).isEqualTo("INGESTION");
  }

  @Test
  void occurrenceFactoryPresetsEntityAndKeepsDetailOrder() {
    var occurrenceId = UUID.randomUUID();

    var record =
        AuditEventBuilder.forOccurrence("status_changed", occurrenceId)
            .fromIngestion()
            .detail("from", "PENDING")
            .detail("to", "IN_PROGRESS")
            .build();

    assertThat(record.eventType()).isEqualTo("occurrence.status_changed");
    assertThat(record.entityType()).isEqualTo("occurrence");
    assertThat(record.entityId()).isEqualTo(occurrenceId);
    assertThat(record.source()).isEqualTo("INGESTION");
    assertThat(record.details())
        .containsExactly(entry("from", "PENDING"), entry("to", "IN_PROGRESS"));
  }

  @Test
  void noDetailsBuildsNullDetails() {
    assertThat(AuditEventBuilder.forOccurrence("created", UUID.randomUUID()).build().details())
        .isNull();
  }

  @Test
  void missingEntityIdIsRejected() {
    assertThatThrownBy(
            () -> AuditEventBuilder.builder().eventType("x").entityType("occurrence").build())
        .isInstanceOf(IllegalStateException.class);
  }
}
