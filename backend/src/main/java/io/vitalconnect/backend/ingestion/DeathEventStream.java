package io.vitalconnect.backend.ingestion;

import java.time.Duration;
import java.util.List;

/** Consumer-group view of the stream carrying detected deaths. */
public interface DeathEventStream {

  /** Creates the consumer group (and the stream) when missing; an existing group is fine. */
  void ensureConsumerGroup();

  /**
   * Entries already delivered to this consumer but never acknowledged, with ids greater than
   * {@code afterId} ("0" for all of them).
   */
  List<StreamEntry> readPending(String afterId, int count);

  /** New entries for this consumer, waiting up to {@code block} when none is available. */
  List<StreamEntry> readNew(int count, Duration block);

  void acknowledge(String entryId);
}
