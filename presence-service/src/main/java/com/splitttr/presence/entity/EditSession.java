package com.splitttr.presence.entity;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;
import org.bson.types.ObjectId;

import java.time.Instant;

// Lease claiming that a user is editing (or viewing) a page on a branch.
@MongoEntity(collection = "edit_sessions")
public class EditSession extends PanacheMongoEntityBase {

    @BsonId
    public ObjectId id;

    public String sessionId;
    public String clientId;
    public String userId;
    public String username;
    public String page;
    public String branch;
    public String mode;
    public Instant leaseExpiresAt;
    public Instant lastHeartbeat;
    public Instant createdAt;

    public boolean isExpiredAt(Instant now) {
        return leaseExpiresAt == null || !leaseExpiresAt.isAfter(now);
    }
}
