package io.vitalconnect.backend.notification.live;

import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** {@link LiveEventSink} writing server-sent events to a Spring MVC {@link SseEmitter}. */
public class SseEmitterSink implements LiveEventSink {

  private static final Logger log = LoggerFactory.getLogger(SseEmitterSink.class);

  private final SseEmitter emitter;

  public SseEmitterSink(SseEmitter emitter) {
    this.emitter = emitter;
  }

  @Override
  public void send(LiveEvent event) throws IOException {
    emitter.send(
        SseEmitter.event()
            .name(event.type().wireName())
            .id(String.valueOf(event.createdAt().toEpochMilli()))
            .data(event.payload(), MediaType.APPLICATION_JSON));
  }

  @Override
  public void complete() {
    try {
      emitter.complete();
    } catch (IllegalStateException e) {
      log.debug("SSE emitter already finished: {}", e.getMessage());
    }
  }
}
