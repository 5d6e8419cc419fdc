package com.splitttr.presence.ws;

import com.splitttr.presence.session.PresenceSocket;
import io.quarkus.websockets.next.CloseReason;
import io.quarkus.websockets.next.WebSocketConnection;

// PresenceSocket over a websockets-next connection.
record ConnectionSocket(WebSocketConnection connection) implements PresenceSocket {

    @Override
    public String id() {
        return connection.id();
    }

    @Override
    public void send(String text) {
        connection.sendTextAndAwait(text);
    }

    @Override
    public void close(int code, String reason) {
        if (connection.isClosed()) return;
        connection.closeAndAwait(new CloseReason(code, reason));
    }
}
