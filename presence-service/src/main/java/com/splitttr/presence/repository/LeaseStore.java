package com.splitttr.presence.repository;

import com.splitttr.presence.entity.EditSession;
import org.bson.types.ObjectId;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent presence leases.
 */
public interface LeaseStore {

    // Leases of the page/branch with leaseExpiresAt <= now.
    long deleteExpired(String page, String branch, Instant now);

    Optional<EditSession> findLive(String userId, String clientId, String page, String branch, Instant now);

    void insert(EditSession session);

    Optional<EditSession> findSession(String sessionId, String userId);

    Optional<EditSession> findSession(String sessionId, String userId, String page, String branch);

    void extend(ObjectId id, Instant leaseExpiresAt, Instant heartbeatAt);

    boolean deleteLease(ObjectId id);

    boolean deleteSession(String sessionId, String userId);

    // Unexpired edit-mode leases, oldest first.
    List<EditSession> listEditors(String page, String branch, Instant now);
}
