package io.vitalconnect.backend.notification.live;

import io.vitalconnect.backend.identity.OperatorIdentityResolver;
import io.vitalconnect.backend.notification.NotificationProperties;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/notifications")
public class NotificationStreamController {

  private final NotificationHub hub;
  private final OperatorIdentityResolver identityResolver;
  private final NotificationProperties properties;

  public NotificationStreamController(
      NotificationHub hub,
      OperatorIdentityResolver identityResolver,
      NotificationProperties properties) {
    this.hub = hub;
    this.identityResolver = identityResolver;
    this.properties = properties;
  }

  @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter stream(HttpServletRequest request) {
    var identity = identityResolver.require(request);
    var emitter = new SseEmitter(properties.streamTimeout().toMillis());
    var session = hub.register(identity, new SseEmitterSink(emitter));
    emitter.onCompletion(() -> hub.unregister(session));
    emitter.onTimeout(() -> hub.unregister(session));
    emitter.onError(error -> hub.unregister(session));
    return emitter;
  }
}
