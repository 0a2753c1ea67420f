package io.vitalconnect.backend.occurrence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Appends history rows in their own transaction. A failed append is logged and reported through
 * the return value; it never undoes the status change it describes.
 */
@Component
public class OccurrenceHistoryRecorder {

  private static final Logger log = LoggerFactory.getLogger(OccurrenceHistoryRecorder.class);

  private final OccurrenceHistoryRepository historyRepository;
  private final TransactionTemplate txTemplate;

  public OccurrenceHistoryRecorder(
      OccurrenceHistoryRepository historyRepository, PlatformTransactionManager txManager) {
    this.historyRepository = historyRepository;
    this.txTemplate = new TransactionTemplate(txManager);
    this.txTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  public boolean append(OccurrenceHistory entry) {
    try {
      txTemplate.executeWithoutResult(tx -> historyRepository.save(entry));
      return true;
    } catch (RuntimeException e) {
      log.warn(
          "Failed to append history for occurrence={} action='{}': {}",
          entry.getOccurrenceId(),
          entry.getAction(),
          e.getMessage());
      return false;
    }
  }
}
