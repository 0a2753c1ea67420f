package io.vitalconnect.backend.health;

import io.vitalconnect.backend.ingestion.EventIngestor;
import io.vitalconnect.backend.ingestion.IngestorStatus;
import io.vitalconnect.backend.notification.live.HubStatus;
import io.vitalconnect.backend.notification.live.NotificationHub;
import io.vitalconnect.backend.triage.TriageMetrics;
import io.vitalconnect.backend.triage.TriageStats;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Read-only snapshot of the ingestion, triage and live notification stages. */
@RestController
@RequestMapping("/api/health")
public class PipelineHealthController {

  private final EventIngestor ingestor;
  private final TriageMetrics triageMetrics;
  private final NotificationHub hub;

  public PipelineHealthController(
      EventIngestor ingestor, TriageMetrics triageMetrics, NotificationHub hub) {
    this.ingestor = ingestor;
    this.triageMetrics = triageMetrics;
    this.hub = hub;
  }

  @GetMapping("/pipeline")
  public ResponseEntity<PipelineHealthResponse> pipeline() {
    return ResponseEntity.ok(
        new PipelineHealthResponse(ingestor.status(), triageMetrics.snapshot(), hub.status()));
  }

  // --- DTOs ---

  public record PipelineHealthResponse(
      IngestorStatus ingestor, TriageStats triage, HubStatus hub) {}
}
