package io.vitalconnect.backend.ingestion;

import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Death-report stream consumption settings.
 *
 * @param enabled whether the ingestion loop starts with the application
 * @param streamKey Redis stream holding detected deaths
 * @param consumerGroup consumer group shared by all ingestor instances
 * @param consumerName this instance's consumer name inside the group
 * @param batchSize maximum entries per read
 * @param blockTimeout how long a read waits for new entries
 * @param idleBackoff pause after an empty read
 * @param errorBackoffInitial first pause after a failed read; doubles on each consecutive failure
 * @param errorBackoffMax upper bound of the failed-read pause
 * @param storeMaxAttempts attempts to persist an occurrence before the entry is left pending
 * @param storeRetryBackoff pause before the second store attempt, doubling on each further one;
 *     zero retries immediately
 * @param zone zone whose local date drives the detected-today counter
 */
@ConfigurationProperties(prefix = "vitalconnect.ingestion")
public record IngestionProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("obitos:detectados") String streamKey,
    @DefaultValue("triagem-motor") String consumerGroup,
    @DefaultValue("triagem-consumer-1") String consumerName,
    @DefaultValue("10") int batchSize,
    @DefaultValue("5s") Duration blockTimeout,
    @DefaultValue("500ms") Duration idleBackoff,
    @DefaultValue("1s") Duration errorBackoffInitial,
    @DefaultValue("30s") Duration errorBackoffMax,
    @DefaultValue("3") int storeMaxAttempts,
    @DefaultValue("200ms") Duration storeRetryBackoff,
    @DefaultValue("America/Sao_Paulo") String zone) {

  public ZoneId zoneId() {
    return ZoneId.of(zone);
  }
}
