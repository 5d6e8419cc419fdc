package com.splitttr.presence.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.splitttr.presence.entity.EditSession;
import com.splitttr.presence.message.ClientMessage;
import com.splitttr.presence.message.ServerMessage;
import com.splitttr.presence.message.ServerMessage.Editor;
import com.splitttr.presence.service.AuthService.Caller;
import com.splitttr.presence.service.PresenceService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide registry of presence rooms, one per page/branch.
 *
 * <p>Room membership changes under a single lock; roster reads and sends happen outside it on
 * a snapshot. Each non-empty room has one housekeeping task that rebroadcasts the roster so
 * leases that expired silently drop out.
 */
@ApplicationScoped
public class PresenceCoordinator {

    private static final Logger LOG = Logger.getLogger(PresenceCoordinator.class);

    public static final int CLOSE_NORMAL = 1000;
    public static final int CLOSE_PROTOCOL_ERROR = 1002;
    public static final int CLOSE_UNAVAILABLE = 1011;
    public static final int CLOSE_UNAUTHENTICATED = 4401;
    public static final int CLOSE_DISABLED = 4404;
    public static final int CLOSE_INVALID_SESSION = 4409;

    @Inject PresenceService presence;

    @ConfigProperty(name = "presence.housekeeping-interval-seconds", defaultValue = "30")
    long housekeepingIntervalSeconds;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<PresenceRoom.Key, PresenceRoom> rooms = new HashMap<>();
    private final Map<String, PresenceConnection> connections = new HashMap<>();
    private ScheduledExecutorService scheduler;

    @PostConstruct
    void init() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "presence-housekeeping");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void shutdown() {
        scheduler.shutdownNow();
    }

    /**
     * Admits a socket into the room of its lease, or closes it with the code for the first check
     * that fails.
     */
    public void open(PresenceSocket socket, Caller caller, String page, String branch, String sessionId, String mode) {
        if (!presence.isEnabled()) {
            socket.close(CLOSE_DISABLED, "Presence disabled");
            return;
        }
        if (page == null || page.isBlank() || sessionId == null || sessionId.isBlank()) {
            socket.close(CLOSE_PROTOCOL_ERROR, "Missing required params");
            return;
        }
        if (caller == null) {
            socket.close(CLOSE_UNAUTHENTICATED, "Authentication required");
            return;
        }

        String b = PresenceService.normalizeBranch(branch);
        Optional<EditSession> lease;
        try {
            lease = presence.validateSession(sessionId, caller.userId(), page, b, mode);
        } catch (PresenceService.PresenceOfflineException e) {
            LOG.warnf("Presence storage unavailable while validating session %s: %s", sessionId, e.getMessage());
            socket.close(CLOSE_UNAVAILABLE, "Presence unavailable");
            return;
        }
        if (lease.isEmpty()) {
            socket.close(CLOSE_INVALID_SESSION, "Invalid or expired session");
            return;
        }

        PresenceRoom.Key key = new PresenceRoom.Key(page, b);
        PresenceConnection connection = new PresenceConnection(socket, caller.userId(), caller.username(), sessionId, key);
        lock.lock();
        try {
            PresenceRoom room = rooms.computeIfAbsent(key, PresenceRoom::new);
            room.add(connection);
            connections.put(socket.id(), connection);
            if (!room.hasHousekeeping()) {
                room.startHousekeeping(scheduler.scheduleAtFixedRate(() -> runHousekeeping(key),
                    housekeepingIntervalSeconds, housekeepingIntervalSeconds, TimeUnit.SECONDS));
            }
        } finally {
            lock.unlock();
        }
        LOG.infof("%s joined presence room %s/%s", caller.username(), page, b);
        broadcastRoster(page, b);
    }

    public void onMessage(PresenceSocket socket, String text) {
        PresenceConnection connection = connection(socket.id());
        if (connection == null) {
            LOG.debugf("Message from unknown presence socket %s ignored", socket.id());
            return;
        }
        ClientMessage message;
        try {
            message = PresenceRoom.mapper().readValue(text, ClientMessage.class);
        } catch (JsonProcessingException e) {
            LOG.warnf("Malformed presence message from %s ignored: %s", connection.username(), e.getOriginalMessage());
            return;
        }
        String type = message.type() == null ? "" : message.type();
        switch (type) {
            case ClientMessage.PING -> ping(connection);
            case ClientMessage.RELEASE -> release(connection);
            default -> LOG.debugf("Unknown presence message type '%s' ignored", type);
        }
    }

    // Disconnect of any kind. Sockets the server already closed are no longer registered.
    public void onClose(PresenceSocket socket) {
        PresenceConnection connection = detach(socket.id());
        if (connection == null) return;
        try {
            presence.release(connection.sessionId(), connection.userId());
        } catch (PresenceService.PresenceOfflineException e) {
            LOG.warnf("Could not release edit session %s on disconnect: %s", connection.sessionId(), e.getMessage());
        }
        broadcastRoster(connection.room().page(), connection.room().branch());
    }

    /**
     * Pushes the current roster to every socket in the room. Sockets that fail to receive it
     * are dropped from the room, their leases released, and the rest get the roster again. A
     * roster that cannot be read means no broadcast.
     */
    public void broadcastRoster(String page, String branch) {
        PresenceRoom.Key key = new PresenceRoom.Key(page, PresenceService.normalizeBranch(branch));
        List<PresenceConnection> targets;
        lock.lock();
        try {
            PresenceRoom room = rooms.get(key);
            if (room == null || room.isEmpty()) return;
            targets = room.snapshot();
        } finally {
            lock.unlock();
        }

        List<Editor> roster;
        try {
            roster = presence.getRoster(key.page(), key.branch());
        } catch (PresenceService.PresenceOfflineException e) {
            LOG.warnf("Roster for %s/%s unavailable, skipping broadcast: %s", key.page(), key.branch(), e.getMessage());
            return;
        }

        String json = PresenceRoom.toJson(ServerMessage.presence(roster));
        List<PresenceConnection> stale = new ArrayList<>();
        for (PresenceConnection target : targets) {
            try {
                target.socket().send(json);
            } catch (RuntimeException e) {
                LOG.warnf("Failed to send presence update to %s: %s", target.username(), e.getMessage());
                stale.add(target);
            }
        }
        boolean dropped = false;
        for (PresenceConnection connection : stale) {
            dropped |= dropStale(connection);
        }
        // the roster just sent still lists the dropped editors
        if (dropped) {
            broadcastRoster(key.page(), key.branch());
        }
    }

    // A socket that cannot be written to gives up its lease and is closed.
    private boolean dropStale(PresenceConnection connection) {
        if (detach(connection.socket().id()) == null) return false;
        boolean released = false;
        try {
            released = presence.release(connection.sessionId(), connection.userId());
        } catch (PresenceService.PresenceOfflineException e) {
            LOG.warnf("Could not release edit session %s of stale socket: %s", connection.sessionId(), e.getMessage());
        }
        try {
            connection.socket().close(CLOSE_UNAVAILABLE, "Presence update failed");
        } catch (RuntimeException e) {
            LOG.debugf("Closing stale presence socket of %s failed: %s", connection.username(), e.getMessage());
        }
        return released;
    }

    // One tick of a room's housekeeping task.
    void runHousekeeping(PresenceRoom.Key key) {
        boolean occupied;
        lock.lock();
        try {
            PresenceRoom room = rooms.get(key);
            occupied = room != null && !room.isEmpty();
        } finally {
            lock.unlock();
        }
        if (!occupied) return;
        try {
            broadcastRoster(key.page(), key.branch());
        } catch (RuntimeException e) {
            // an exception would stop the periodic task for good
            LOG.errorf(e, "Presence housekeeping failed for %s/%s", key.page(), key.branch());
        }
    }

    public int roomCount() {
        lock.lock();
        try {
            return rooms.size();
        } finally {
            lock.unlock();
        }
    }

    public int occupancy(String page, String branch) {
        lock.lock();
        try {
            PresenceRoom room = rooms.get(new PresenceRoom.Key(page, PresenceService.normalizeBranch(branch)));
            return room == null ? 0 : room.size();
        } finally {
            lock.unlock();
        }
    }

    private void ping(PresenceConnection connection) {
        PresenceService.HeartbeatResult result;
        try {
            result = presence.heartbeat(connection.sessionId(), connection.userId(),
                connection.room().page(), connection.room().branch());
        } catch (PresenceService.PresenceOfflineException e) {
            LOG.warnf("Heartbeat for %s not recorded: %s", connection.sessionId(), e.getMessage());
            return;
        }
        if (result.isGone()) {
            LOG.infof("Edit session %s is %s, closing socket", connection.sessionId(), result.status());
            detach(connection.socket().id());
            sendQuietly(connection, ServerMessage.goodbye("expired"));
            connection.socket().close(CLOSE_INVALID_SESSION, "Session expired");
            broadcastRoster(connection.room().page(), connection.room().branch());
        }
    }

    private void release(PresenceConnection connection) {
        try {
            presence.release(connection.sessionId(), connection.userId());
        } catch (PresenceService.PresenceOfflineException e) {
            LOG.warnf("Could not release edit session %s: %s", connection.sessionId(), e.getMessage());
        }
        detach(connection.socket().id());
        sendQuietly(connection, ServerMessage.goodbye("released"));
        connection.socket().close(CLOSE_NORMAL, "Released");
        broadcastRoster(connection.room().page(), connection.room().branch());
    }

    private void sendQuietly(PresenceConnection connection, ServerMessage message) {
        try {
            connection.socket().send(PresenceRoom.toJson(message));
        } catch (RuntimeException e) {
            LOG.warnf("Failed to send %s to %s: %s", message.type(), connection.username(), e.getMessage());
        }
    }

    private PresenceConnection connection(String socketId) {
        lock.lock();
        try {
            return connections.get(socketId);
        } finally {
            lock.unlock();
        }
    }

    // Removes the socket from its room; an emptied room loses its housekeeping task.
    private PresenceConnection detach(String socketId) {
        lock.lock();
        try {
            PresenceConnection connection = connections.remove(socketId);
            if (connection == null) return null;
            PresenceRoom room = rooms.get(connection.room());
            if (room != null) {
                room.remove(socketId);
                if (room.isEmpty()) {
                    room.stopHousekeeping();
                    rooms.remove(connection.room());
                    LOG.debugf("Presence room %s/%s closed", connection.room().page(), connection.room().branch());
                }
            }
            return connection;
        } finally {
            lock.unlock();
        }
    }
}
