package io.vitalconnect.backend.occurrence;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.vitalconnect.backend.exception.GlobalExceptionHandler;
import io.vitalconnect.backend.exception.InvalidTransitionException;
import io.vitalconnect.backend.exception.OutcomeNotAllowedException;
import io.vitalconnect.backend.exception.ResourceNotFoundException;
import io.vitalconnect.backend.identity.HeaderOperatorIdentityResolver;
import io.vitalconnect.backend.urgency.UrgencyClassifier;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class OccurrenceControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
  private static final UUID ID = UUID.fromString("0b6f4e1a-3c2d-4e5f-8a9b-1c2d3e4f5a6b");
  private static final UUID USER = UUID.fromString("8d0b7c1e-52a4-4a6f-b0f4-5c2f3c9d1e01");

  private OccurrenceService occurrenceService;
  private OccurrenceLifecycleService lifecycleService;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    occurrenceService = mock(OccurrenceService.class);
    lifecycleService = mock(OccurrenceLifecycleService.class);
    var clock = Clock.fixed(NOW, ZoneOffset.UTC);
    var controller =
        new OccurrenceController(
            occurrenceService,
            lifecycleService,
            new UrgencyClassifier(clock),
            new HeaderOperatorIdentityResolver(),
            clock);
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  private static Occurrence occurrence(OccurrenceStatus status) {
    var occurrence = mock(Occurrence.class);
    when(occurrence.getId()).thenReturn(ID);
    when(occurrence.getStatus()).thenReturn(status);
    when(occurrence.getPriorityScore()).thenReturn(100);
    when(occurrence.getWindowExpiresAt()).thenReturn(NOW.plusSeconds(90 * 60));
    return occurrence;
  }

  @Test
  void getOccurrenceIncludesUrgencyAndAllowedTransitions() throws Exception {
    var occurrence = occurrence(OccurrenceStatus.PENDING);
    when(occurrenceService.getOccurrence(ID)).thenReturn(occurrence);

    mockMvc
        .perform(get("/api/occurrences/{id}", ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("PENDING"))
        .andExpect(jsonPath("$.urgency").value("RED"))
        .andExpect(jsonPath("$.remainingTime").value("1h 30min"))
        .andExpect(jsonPath("$.allowedTransitions[0]").value("IN_PROGRESS"))
        .andExpect(jsonPath("$.allowedTransitions[1]").value("CANCELED"));
  }

  @Test
  void getOccurrenceUnknownIdReturns404() throws Exception {
    when(occurrenceService.getOccurrence(ID))
        .thenThrow(ResourceNotFoundException.occurrence(ID));

    mockMvc
        .perform(get("/api/occurrences/{id}", ID))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("Occurrence not found"))
        .andExpect(jsonPath("$.resourceId").value(ID.toString()));
  }

  @Test
  void changeStatusRequiresIdentityHeaders() throws Exception {
    mockMvc
        .perform(
            patch("/api/occurrences/{id}/status", ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"IN_PROGRESS\"}"))
        .andExpect(status().isUnauthorized());

    verify(lifecycleService, never()).transition(any(), any(), any(), any());
  }

  @Test
  void changeStatusAppliesTransitionForOperator() throws Exception {
    var occurrence = occurrence(OccurrenceStatus.IN_PROGRESS);
    when(lifecycleService.transition(ID, OccurrenceStatus.IN_PROGRESS, USER, "assumindo"))
        .thenReturn(occurrence);

    mockMvc
        .perform(
            patch("/api/occurrences/{id}/status", ID)
                .header("X-User-Id", USER.toString())
                .header("X-User-Role", "operador")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"IN_PROGRESS\", \"notes\": \"assumindo\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("IN_PROGRESS"));
  }

  @Test
  void changeStatusInvalidTransitionReturns400() throws Exception {
    when(lifecycleService.transition(eq(ID), eq(OccurrenceStatus.CONCLUDED), eq(USER), isNull()))
        .thenThrow(
            new InvalidTransitionException("PENDING", "CONCLUDED", List.of("IN_PROGRESS")));

    mockMvc
        .perform(
            patch("/api/occurrences/{id}/status", ID)
                .header("X-User-Id", USER.toString())
                .header("X-User-Role", "operador")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"CONCLUDED\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid status transition"))
        .andExpect(jsonPath("$.detail").value("Cannot change status from PENDING to CONCLUDED"));
  }

  @Test
  void changeStatusWithoutStatusIsRejected() throws Exception {
    mockMvc
        .perform(
            patch("/api/occurrences/{id}/status", ID)
                .header("X-User-Id", USER.toString())
                .header("X-User-Role", "operador")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"notes\": \"sem status\"}"))
        .andExpect(status().isBadRequest());

    verify(lifecycleService, never()).transition(any(), any(), any(), any());
  }

  @Test
  void registerOutcomeBeforeDecisionReturnsError() throws Exception {
    when(lifecycleService.registerOutcome(any(), any(), any(), any()))
        .thenThrow(new OutcomeNotAllowedException("PENDING"));

    mockMvc
        .perform(
            post("/api/occurrences/{id}/outcome", ID)
                .header("X-User-Id", USER.toString())
                .header("X-User-Role", "gestor")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"outcome\": \"DONATION_SUCCESSFUL\"}"))
        .andExpect(status().isBadRequest());
  }
}
