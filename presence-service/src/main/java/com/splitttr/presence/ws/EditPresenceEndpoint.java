package com.splitttr.presence.ws;

import com.splitttr.presence.service.AuthService;
import com.splitttr.presence.session.PresenceCoordinator;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.quarkus.websockets.next.OnClose;
import io.quarkus.websockets.next.OnOpen;
import io.quarkus.websockets.next.OnTextMessage;
import io.quarkus.websockets.next.WebSocket;
import io.quarkus.websockets.next.WebSocketConnection;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Map;

// Realtime presence channel: /ws/edit-presence?page=&branch=&session_id=&mode=
@WebSocket(path = "/ws/edit-presence")
public class EditPresenceEndpoint {

    @Inject
    PresenceCoordinator coordinator;

    @Inject
    AuthService auth;

    @OnOpen
    public void onOpen(WebSocketConnection connection) {
        Map<String, List<String>> params = new QueryStringDecoder(connection.handshakeRequest().query(), false)
            .parameters();
        coordinator.open(new ConnectionSocket(connection),
            auth.currentCaller().orElse(null),
            first(params, "page"),
            first(params, "branch"),
            first(params, "session_id"),
            first(params, "mode"));
    }

    @OnTextMessage
    public void onMessage(String message, WebSocketConnection connection) {
        coordinator.onMessage(new ConnectionSocket(connection), message);
    }

    @OnClose
    public void onClose(WebSocketConnection connection) {
        coordinator.onClose(new ConnectionSocket(connection));
    }

    private static String first(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
