package io.vitalconnect.backend.notification.live;

import io.vitalconnect.backend.identity.OperatorIdentity;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One connected operator. Events wait in a bounded FIFO queue; when it is full the oldest pending
 * event is dropped to make room, so the broadcaster never blocks on a slow client.
 */
public class OperatorSession {

  private final UUID id = UUID.randomUUID();
  private final OperatorIdentity identity;
  private final LiveEventSink sink;
  private final BlockingQueue<LiveEvent> queue;
  private final Instant createdAt;
  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicLong dropped = new AtomicLong();

  public OperatorSession(
      OperatorIdentity identity, LiveEventSink sink, int capacity, Instant createdAt) {
    this.identity = identity;
    this.sink = sink;
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.createdAt = createdAt;
  }

  /**
   * Whether this session should receive the event: session-level events always, hospital events
   * only inside the operator's scope, and only for the targeted roles when the event names any.
   */
  public boolean accepts(LiveEvent event) {
    if (!event.targetRoles().isEmpty() && !event.targetRoles().contains(identity.role())) {
      return false;
    }
    return event.hospitalId() == null || identity.canSeeHospital(event.hospitalId());
  }

  /** Enqueues the event. Returns the number of older events dropped to make room (0 or more). */
  public int offer(LiveEvent event) {
    int droppedNow = 0;
    while (!queue.offer(event)) {
      if (queue.poll() != null) {
        droppedNow++;
      }
    }
    if (droppedNow > 0) {
      dropped.addAndGet(droppedNow);
    }
    return droppedNow;
  }

  LiveEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
    return queue.poll(timeout, unit);
  }

  /** Pending events in delivery order, without removing them. */
  public List<LiveEvent> pendingEvents() {
    return new ArrayList<>(queue);
  }

  /** Closes the transport. Only the first call has an effect; returns whether it was that call. */
  public boolean close() {
    if (!closed.compareAndSet(false, true)) {
      return false;
    }
    queue.clear();
    sink.complete();
    return true;
  }

  public boolean isClosed() {
    return closed.get();
  }

  LiveEventSink sink() {
    return sink;
  }

  public UUID getId() {
    return id;
  }

  public OperatorIdentity getIdentity() {
    return identity;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public long getDroppedCount() {
    return dropped.get();
  }
}
