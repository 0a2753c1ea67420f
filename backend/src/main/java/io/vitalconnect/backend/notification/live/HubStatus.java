package io.vitalconnect.backend.notification.live;

/** Point-in-time view of the live hub. */
public record HubStatus(
    boolean running,
    int registeredSessions,
    long totalConnections,
    long totalBroadcasts,
    long droppedEvents) {}
