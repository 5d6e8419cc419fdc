package com.splitttr.presence.repository;

import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.Updates;
import com.splitttr.presence.entity.EditSession;
import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import org.bson.types.ObjectId;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

// Database access for edit session leases.
@ApplicationScoped
public class EditSessionRepository implements PanacheMongoRepositoryBase<EditSession, ObjectId>, LeaseStore {

    @Override
    public long deleteExpired(String page, String branch, Instant now) {
        return mongoCollection().deleteMany(Filters.and(
            Filters.eq("page", page),
            Filters.eq("branch", branch),
            Filters.lte("leaseExpiresAt", now)
        )).getDeletedCount();
    }

    @Override
    public Optional<EditSession> findLive(String userId, String clientId, String page, String branch, Instant now) {
        return Optional.ofNullable(mongoCollection().find(Filters.and(
            Filters.eq("userId", userId),
            Filters.eq("clientId", clientId),
            Filters.eq("page", page),
            Filters.eq("branch", branch),
            Filters.gt("leaseExpiresAt", now)
        )).first());
    }

    @Override
    public void insert(EditSession session) {
        persist(session);
    }

    @Override
    public Optional<EditSession> findSession(String sessionId, String userId) {
        return find("sessionId = ?1 and userId = ?2", sessionId, userId).firstResultOptional();
    }

    @Override
    public Optional<EditSession> findSession(String sessionId, String userId, String page, String branch) {
        return find("sessionId = ?1 and userId = ?2 and page = ?3 and branch = ?4", sessionId, userId, page, branch)
            .firstResultOptional();
    }

    @Override
    public void extend(ObjectId id, Instant leaseExpiresAt, Instant heartbeatAt) {
        mongoCollection().updateOne(Filters.eq("_id", id), Updates.combine(
            Updates.set("leaseExpiresAt", leaseExpiresAt),
            Updates.set("lastHeartbeat", heartbeatAt)
        ));
    }

    @Override
    public boolean deleteLease(ObjectId id) {
        return delete("_id", id) > 0;
    }

    @Override
    public boolean deleteSession(String sessionId, String userId) {
        return delete("sessionId = ?1 and userId = ?2", sessionId, userId) > 0;
    }

    @Override
    public List<EditSession> listEditors(String page, String branch, Instant now) {
        return mongoCollection().find(Filters.and(
                Filters.eq("page", page),
                Filters.eq("branch", branch),
                Filters.eq("mode", "edit"),
                Filters.gt("leaseExpiresAt", now)
            ))
            .sort(Sorts.ascending("createdAt"))
            .into(new ArrayList<>());
    }
}
