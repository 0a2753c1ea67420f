package io.vitalconnect.backend.notification.live;

import java.io.IOException;

/** Transport of one live session. */
public interface LiveEventSink {

  void send(LiveEvent event) throws IOException;

  /** Ends the transport. Called at most once per session. */
  void complete();
}
