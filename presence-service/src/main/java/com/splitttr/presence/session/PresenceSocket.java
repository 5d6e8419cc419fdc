package com.splitttr.presence.session;

// One realtime connection as seen by the coordinator.
public interface PresenceSocket {

    String id();

    void send(String text);

    void close(int code, String reason);
}
