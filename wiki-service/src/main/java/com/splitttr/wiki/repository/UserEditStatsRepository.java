package com.splitttr.wiki.repository;

import com.splitttr.wiki.entity.UserEditStats;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.model.Updates;
import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

// Database access for user edit stats repository.
@ApplicationScoped
public class UserEditStatsRepository implements PanacheMongoRepositoryBase<UserEditStats, String> {

    public void increment(String username) {
        mongoCollection().updateOne(
            Filters.eq("_id", username),
            Updates.inc("totalEdits", 1L),
            new UpdateOptions().upsert(true));
    }

    public long totalFor(String username) {
        UserEditStats stats = findById(username);
        return stats == null ? 0L : stats.totalEdits;
    }
}
