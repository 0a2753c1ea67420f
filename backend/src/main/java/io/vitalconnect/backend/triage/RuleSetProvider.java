package io.vitalconnect.backend.triage;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Serves the compiled {@link RuleSet} of a tenant, cached per tenant with Caffeine. An entry
 * expires after the configured TTL and the next lookup builds a fresh immutable set, so readers
 * either see the old set or the new one.
 *
 * <p>When the rules cannot be read, the built-in defaults are served (and cached for one TTL).
 */
@Service
public class RuleSetProvider {

  private static final Logger log = LoggerFactory.getLogger(RuleSetProvider.class);

  private final TriageRuleRepository ruleRepository;
  private final RuleCompiler ruleCompiler;
  private final Clock clock;
  private final LoadingCache<TenantKey, RuleSet> cache;

  @Autowired
  public RuleSetProvider(
      TriageRuleRepository ruleRepository,
      RuleCompiler ruleCompiler,
      TriageProperties properties,
      Clock clock) {
    this(ruleRepository, ruleCompiler, properties, clock, Ticker.systemTicker());
  }

  /** Package-private constructor for testing with a controllable ticker. */
  RuleSetProvider(
      TriageRuleRepository ruleRepository,
      RuleCompiler ruleCompiler,
      TriageProperties properties,
      Clock clock,
      Ticker ticker) {
    this.ruleRepository = ruleRepository;
    this.ruleCompiler = ruleCompiler;
    this.clock = clock;
    this.cache =
        Caffeine.newBuilder()
            .expireAfterWrite(properties.ruleCacheTtl())
            .maximumSize(properties.ruleCacheMaxTenants())
            .ticker(ticker)
            .build(this::load);
  }

  /** Rule set for the tenant; {@code null} selects the global rules. */
  public RuleSet get(UUID tenantId) {
    return cache.get(new TenantKey(tenantId));
  }

  public void invalidate(UUID tenantId) {
    cache.invalidate(new TenantKey(tenantId));
    log.info("Invalidated triage rule set for tenant {}", tenantId);
  }

  public void invalidateAll() {
    cache.invalidateAll();
  }

  private RuleSet load(TenantKey key) {
    try {
      List<TriageRule> rows =
          key.tenantId() != null
              ? ruleRepository.findActiveByTenantId(key.tenantId())
              : ruleRepository.findActiveGlobal();
      var ruleSet = RuleSet.of(key.tenantId(), ruleCompiler.compileAll(rows), clock.instant());
      log.debug(
          "Loaded {} triage rules for tenant {} ({} rows)",
          ruleSet.size(),
          key.tenantId(),
          rows.size());
      return ruleSet;
    } catch (DataAccessException e) {
      log.warn(
          "Failed to load triage rules for tenant {}, using defaults: {}",
          key.tenantId(),
          e.getMessage());
      return TriageDefaults.ruleSet(key.tenantId(), clock.instant());
    }
  }

  private record TenantKey(UUID tenantId) {}
}
