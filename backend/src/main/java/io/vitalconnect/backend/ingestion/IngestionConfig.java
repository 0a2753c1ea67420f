package io.vitalconnect.backend.ingestion;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.NoBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

@Configuration
public class IngestionConfig {

  private static final Logger log = LoggerFactory.getLogger(IngestionConfig.class);

  /**
   * Retries occurrence lookups and inserts on transient data-access failures. Unique-key
   * violations are never retried: they mean another consumer stored the same event first.
   */
  @Bean
  public RetryTemplate storeRetryTemplate(IngestionProperties properties) {
    var retryable =
        Map.<Class<? extends Throwable>, Boolean>of(
            DataAccessException.class, true, DataIntegrityViolationException.class, false);
    var template = new RetryTemplate();
    template.setRetryPolicy(
        new SimpleRetryPolicy(Math.max(1, properties.storeMaxAttempts()), retryable, true));

    long initialMillis = properties.storeRetryBackoff().toMillis();
    if (initialMillis > 0) {
      var backOff = new ExponentialBackOffPolicy();
      backOff.setInitialInterval(initialMillis);
      backOff.setMultiplier(2);
      template.setBackOffPolicy(backOff);
    } else {
      template.setBackOffPolicy(new NoBackOffPolicy());
    }
    template.registerListener(new AttemptLogger(Math.max(1, properties.storeMaxAttempts())));
    return template;
  }

  private record AttemptLogger(int maxAttempts) implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(
        RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
      log.warn(
          "Store attempt {}/{} failed: {}",
          context.getRetryCount(),
          maxAttempts,
          throwable.getMessage());
    }
  }
}
