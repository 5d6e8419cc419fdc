package com.splitttr.wiki.repository;

import com.splitttr.wiki.entity.PageEditCount;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.model.Updates;
import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import org.bson.types.ObjectId;

import java.util.List;

// Database access for page edit count repository.
@ApplicationScoped
public class PageEditCountRepository implements PanacheMongoRepositoryBase<PageEditCount, ObjectId> {

    public void increment(String username, String pageTitle) {
        mongoCollection().updateOne(
            Filters.and(Filters.eq("username", username), Filters.eq("pageTitle", pageTitle)),
            Updates.inc("edits", 1L),
            new UpdateOptions().upsert(true));
    }

    public long countFor(String username, String pageTitle) {
        PageEditCount row = find("username = ?1 and pageTitle = ?2", username, pageTitle).firstResult();
        return row == null ? 0L : row.edits;
    }

    public List<PageEditCount> listForPage(String pageTitle) {
        return list("pageTitle", pageTitle);
    }

    public long deleteFor(String username, String pageTitle) {
        return delete("username = ?1 and pageTitle = ?2", username, pageTitle);
    }
}
