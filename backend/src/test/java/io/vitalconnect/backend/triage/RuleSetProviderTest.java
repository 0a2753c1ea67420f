package io.vitalconnect.backend.triage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

class RuleSetProviderTest {

  private static final UUID TENANT = UUID.randomUUID();

  private final AtomicLong nanos = new AtomicLong();
  private final Ticker ticker = nanos::get;
  private TriageRuleRepository repository;
  private RuleSetProvider provider;

  @BeforeEach
  void setUp() {
    repository = mock(TriageRuleRepository.class);
    var properties = new TriageProperties(6, Duration.ofMinutes(5), 100);
    provider =
        new RuleSetProvider(
            repository,
            new RuleCompiler(),
            properties,
            Clock.fixed(Instant.parse("2026-03-10T12:00:00Z"), ZoneOffset.UTC),
            ticker);
  }

  private static TriageRule maxAge(int years) {
    return new TriageRule(
        UUID.randomUUID(), TENANT, "Age", Map.of("tipo", "idade_maxima", "valor", years), true, 1);
  }

  @Test
  void servesCachedRuleSetUntilTtlExpires() {
    when(repository.findActiveByTenantId(TENANT))
        .thenReturn(List.of(maxAge(80)))
        .thenReturn(List.of(maxAge(70)));

    var first = provider.get(TENANT);
    nanos.addAndGet(Duration.ofMinutes(4).toNanos());
    var cached = provider.get(TENANT);
    nanos.addAndGet(Duration.ofMinutes(2).toNanos());
    var reloaded = provider.get(TENANT);

    assertThat(cached).isSameAs(first);
    assertThat(first.rules().get(0).condition()).isEqualTo(new RuleCondition.MaxAge(80));
    assertThat(reloaded.rules().get(0).condition()).isEqualTo(new RuleCondition.MaxAge(70));
    verify(repository, times(2)).findActiveByTenantId(TENANT);
  }

  @Test
  void invalidateForcesReload() {
    when(repository.findActiveByTenantId(TENANT)).thenReturn(List.of(maxAge(80)));

    provider.get(TENANT);
    provider.invalidate(TENANT);
    provider.get(TENANT);

    verify(repository, times(2)).findActiveByTenantId(TENANT);
  }

  @Test
  void nullTenantLoadsGlobalRules() {
    when(repository.findActiveGlobal()).thenReturn(List.of());

    var ruleSet = provider.get(null);

    assertThat(ruleSet.tenantId()).isNull();
    assertThat(ruleSet.size()).isZero();
    assertThat(ruleSet.fallback()).isFalse();
  }

  @Test
  void fallsBackToDefaultsWhenRulesCannotBeLoaded() {
    when(repository.findActiveByTenantId(TENANT))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    var ruleSet = provider.get(TENANT);

    assertThat(ruleSet.fallback()).isTrue();
    assertThat(ruleSet.tenantId()).isEqualTo(TENANT);
    assertThat(ruleSet.windowHours()).hasValue(TriageDefaults.DEFAULT_WINDOW_HOURS);
  }
}
