package io.vitalconnect.backend.triage;

/** Point-in-time triage counters. */
public record TriageStats(
    boolean running,
    long totalProcessed,
    long totalEligible,
    long totalIneligible,
    long errorCount) {}
