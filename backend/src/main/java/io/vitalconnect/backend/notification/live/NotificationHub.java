package io.vitalconnect.backend.notification.live;

import io.vitalconnect.backend.identity.OperatorIdentity;
import io.vitalconnect.backend.notification.NotificationProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fans live events out to connected operator sessions.
 *
 * <p>Threading: {@link #publish} only enqueues, a single broadcast thread moves each event into the
 * queue of every session in scope, and one streaming task per session writes its queue to the
 * transport, sending a heartbeat when idle. Every blocking wait is bounded by the poll interval and
 * re-checks the closed flags, so shutdown and disconnects take effect within one interval.
 *
 * <p>Registry: the session map is concurrent for readers; registration and removal take {@code
 * registryLock}, and the broadcaster iterates a snapshot.
 */
@Component
public class NotificationHub {

  private static final Logger log = LoggerFactory.getLogger(NotificationHub.class);

  private final NotificationProperties properties;
  private final Clock clock;

  private final Map<UUID, OperatorSession> sessions = new ConcurrentHashMap<>();
  private final ReentrantLock registryLock = new ReentrantLock();
  private final BlockingQueue<LiveEvent> events = new LinkedBlockingQueue<>();
  private final AtomicBoolean running = new AtomicBoolean();
  private final AtomicLong totalConnections = new AtomicLong();
  private final AtomicLong totalBroadcasts = new AtomicLong();
  private final AtomicLong droppedEvents = new AtomicLong();

  private ExecutorService broadcaster;
  private ExecutorService streamers;

  public NotificationHub(NotificationProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
  }

  @PostConstruct
  public void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    broadcaster = Executors.newSingleThreadExecutor(daemonThreads("live-hub-broadcast"));
    streamers = Executors.newCachedThreadPool(daemonThreads("live-hub-session"));
    broadcaster.submit(this::broadcastLoop);
    for (OperatorSession session : List.copyOf(sessions.values())) {
      streamers.submit(() -> stream(session));
    }
    log.info("Notification hub started");
  }

  @PreDestroy
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    for (OperatorSession session : List.copyOf(sessions.values())) {
      unregister(session);
    }
    broadcaster.shutdownNow();
    streamers.shutdownNow();
    log.info("Notification hub stopped");
  }

  /**
   * Registers a session, queues its {@code connected} event and starts streaming to it once the hub
   * is running.
   */
  public OperatorSession register(OperatorIdentity identity, LiveEventSink sink) {
    var session =
        new OperatorSession(identity, sink, properties.sessionBufferSize(), clock.instant());
    registryLock.lock();
    try {
      sessions.put(session.getId(), session);
    } finally {
      registryLock.unlock();
    }
    totalConnections.incrementAndGet();
    session.offer(
        LiveEvent.session(
            LiveEventType.CONNECTED,
            Map.of(
                "sessionId", session.getId().toString(),
                "userId", identity.userId().toString(),
                "role", identity.role().code()),
            clock.instant()));
    if (running.get()) {
      streamers.submit(() -> stream(session));
    }
    log.info(
        "Live session {} registered for user {} ({} hospitals)",
        session.getId(),
        identity.userId(),
        identity.hospitalIds().size());
    return session;
  }

  /** Removes the session and closes its transport. Safe to call repeatedly. */
  public void unregister(OperatorSession session) {
    registryLock.lock();
    try {
      sessions.remove(session.getId());
    } finally {
      registryLock.unlock();
    }
    if (session.close()) {
      log.info("Live session {} closed", session.getId());
    }
  }

  /** Queues an event for broadcast. Never blocks. */
  public void publish(LiveEvent event) {
    events.offer(event);
  }

  /** Moves the event into the queue of every open session in scope. */
  void broadcast(LiveEvent event) {
    int delivered = 0;
    for (OperatorSession session : List.copyOf(sessions.values())) {
      if (session.isClosed() || !session.accepts(event)) {
        continue;
      }
      int dropped = session.offer(event);
      if (dropped > 0) {
        droppedEvents.addAndGet(dropped);
        log.debug("Session {} is lagging, dropped {} oldest events", session.getId(), dropped);
      }
      delivered++;
    }
    totalBroadcasts.incrementAndGet();
    log.debug("Broadcast {} to {} sessions", event.type().wireName(), delivered);
  }

  private void broadcastLoop() {
    long pollMillis = properties.pollInterval().toMillis();
    while (running.get()) {
      try {
        LiveEvent event = events.poll(pollMillis, TimeUnit.MILLISECONDS);
        if (event != null) {
          broadcast(event);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      } catch (RuntimeException e) {
        log.error("Broadcast failed", e);
      }
    }
  }

  private void stream(OperatorSession session) {
    long pollMillis = properties.pollInterval().toMillis();
    Duration heartbeat = properties.heartbeatInterval();
    Instant lastSent = clock.instant();
    try {
      while (running.get() && !session.isClosed()) {
        LiveEvent event = session.poll(pollMillis, TimeUnit.MILLISECONDS);
        Instant now = clock.instant();
        if (event == null) {
          if (Duration.between(lastSent, now).compareTo(heartbeat) < 0) {
            continue;
          }
          event =
              LiveEvent.session(
                  LiveEventType.HEARTBEAT, Map.of("timestamp", now.toString()), now);
        }
        session.sink().send(event);
        lastSent = now;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (IOException | IllegalStateException e) {
      log.debug("Live session {} transport failed: {}", session.getId(), e.getMessage());
    } finally {
      unregister(session);
    }
  }

  public int sessionCount() {
    return sessions.size();
  }

  public HubStatus status() {
    return new HubStatus(
        running.get(),
        sessions.size(),
        totalConnections.get(),
        totalBroadcasts.get(),
        droppedEvents.get());
  }

  private static ThreadFactory daemonThreads(String prefix) {
    var counter = new AtomicInteger();
    return r -> {
      var thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
