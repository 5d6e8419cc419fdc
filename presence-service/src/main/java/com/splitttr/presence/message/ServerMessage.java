package com.splitttr.presence.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

// ServerMessage.
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerMessage(
    String type,
    List<Editor> editors,
    String reason
) {
    public record Editor(String username, @JsonProperty("client_id") String clientId) {}

    // Current roster of the room.
    public static ServerMessage presence(List<Editor> editors) {
        return new ServerMessage("presence", editors, null);
    }

    // Sent right before the server closes the connection.
    public static ServerMessage goodbye(String reason) {
        return new ServerMessage("goodbye", null, reason);
    }
}
