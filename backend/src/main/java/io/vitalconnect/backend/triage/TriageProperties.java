package io.vitalconnect.backend.triage;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Triage configuration.
 *
 * @param defaultWindowHours capture window used when no time-window rule applies
 * @param ruleCacheTtl how long a compiled rule set is served before it is reloaded
 * @param ruleCacheMaxTenants upper bound on cached rule sets
 */
@ConfigurationProperties(prefix = "vitalconnect.triage")
public record TriageProperties(
    @DefaultValue("6") int defaultWindowHours,
    @DefaultValue("5m") Duration ruleCacheTtl,
    @DefaultValue("1000") long ruleCacheMaxTenants) {}
