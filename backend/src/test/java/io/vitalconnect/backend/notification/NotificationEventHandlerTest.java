package io.vitalconnect.backend.notification;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.vitalconnect.backend.event.OccurrenceCreatedEvent;
import io.vitalconnect.backend.notification.live.LiveEvent;
import io.vitalconnect.backend.notification.live.LiveEventFactory;
import io.vitalconnect.backend.notification.live.LiveEventType;
import io.vitalconnect.backend.notification.live.NotificationHub;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NotificationEventHandlerTest {

  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

  private NotificationHub hub;
  private LiveEventFactory factory;
  private AlertDispatchService alertDispatchService;
  private NotificationEventHandler handler;

  @BeforeEach
  void setUp() {
    hub = mock(NotificationHub.class);
    factory = mock(LiveEventFactory.class);
    alertDispatchService = mock(AlertDispatchService.class);
    handler = new NotificationEventHandler(hub, factory, alertDispatchService);
  }

  private static OccurrenceCreatedEvent created() {
    return new OccurrenceCreatedEvent(
        "occurrence.created",
        NotificationFixtures.OCCURRENCE,
        NotificationFixtures.HOSPITAL,
        null,
        null,
        NOW,
        Map.of(),
        "PENDING",
        "UTI",
        "Maria S.",
        100,
        NOW,
        NOW.plusSeconds(6 * 3600));
  }

  @Test
  void newOccurrenceIsBroadcastAndDispatched() {
    var live =
        LiveEvent.forHospital(
            LiveEventType.NEW_OCCURRENCE, NotificationFixtures.HOSPITAL, Map.of(), NOW);
    var event = created();
    when(factory.newOccurrence(event)).thenReturn(live);

    handler.onOccurrenceCreated(event);

    verify(hub).publish(live);
    verify(alertDispatchService).submit(event);
  }

  @Test
  void liveFailureDoesNotStopChannelAlerts() {
    var event = created();
    when(factory.newOccurrence(any())).thenThrow(new IllegalStateException("directory down"));

    handler.onOccurrenceCreated(event);

    verify(alertDispatchService).submit(event);
  }
}
