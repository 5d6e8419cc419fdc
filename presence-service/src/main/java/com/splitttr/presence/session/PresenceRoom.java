package com.splitttr.presence.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Connections observing one page/branch. Not thread-safe: the coordinator guards every room
 * with its lock.
 */
public class PresenceRoom {

    private static final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule());

    public record Key(String page, String branch) {}

    private final Key key;
    private final LinkedHashMap<String, PresenceConnection> connections = new LinkedHashMap<>();
    private ScheduledFuture<?> housekeeping;

    public PresenceRoom(Key key) {
        this.key = key;
    }

    public Key key() {
        return key;
    }

    public void add(PresenceConnection connection) {
        connections.put(connection.socket().id(), connection);
    }

    public boolean remove(String socketId) {
        return connections.remove(socketId) != null;
    }

    public boolean isEmpty() {
        return connections.isEmpty();
    }

    public int size() {
        return connections.size();
    }

    // Copy to send from outside the lock.
    public List<PresenceConnection> snapshot() {
        return List.copyOf(connections.values());
    }

    public boolean hasHousekeeping() {
        return housekeeping != null;
    }

    public void startHousekeeping(ScheduledFuture<?> task) {
        this.housekeeping = task;
    }

    public void stopHousekeeping() {
        if (housekeeping != null) {
            housekeeping.cancel(false);
            housekeeping = null;
        }
    }

    static ObjectMapper mapper() {
        return mapper;
    }

    static String toJson(Object message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize presence message", e);
        }
    }
}
