package com.splitttr.presence.session;

// A socket that joined a room, with the lease it joined under.
public record PresenceConnection(
    PresenceSocket socket,
    String userId,
    String username,
    String sessionId,
    PresenceRoom.Key room
) {}
