package io.vitalconnect.backend.ingestion;

import java.time.Instant;

/**
 * Point-in-time view of the ingestion loop.
 *
 * @param detectedToday occurrences created since local midnight in the configured zone
 * @param totalProcessed stream entries handled, whatever their outcome
 * @param totalFailed entries left unacknowledged because the occurrence could not be stored
 * @param errorCount failed stream reads and unexpected processing errors
 */
public record IngestorStatus(
    boolean running,
    Instant startedAt,
    Instant lastProcessedAt,
    long detectedToday,
    long totalProcessed,
    long totalRejected,
    long totalDuplicates,
    long totalInvalid,
    long totalFailed,
    long errorCount) {}
