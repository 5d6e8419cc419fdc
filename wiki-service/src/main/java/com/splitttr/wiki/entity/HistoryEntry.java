package com.splitttr.wiki.entity;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;
import org.bson.types.ObjectId;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable snapshot of a page as it was right before being overwritten.
 * {@code updatedAt} is the timestamp of the archived state, not of the archiving.
 */
@MongoEntity(collection = "history")
public class HistoryEntry extends PanacheMongoEntityBase {

    @BsonId
    public ObjectId id;

    public String title;
    public String branch;
    public String content;
    public String author;
    public String editSummary;

    public EditPermission editPermission;
    public Set<String> allowedUsers = new LinkedHashSet<>();

    public Instant createdAt;
    public Instant updatedAt;
    public Instant archivedAt;

    // Set on rows copied by a fork; points at the row they were copied from.
    public ObjectId sourceEntryId;

    public static HistoryEntry archive(Page page, Instant archivedAt) {
        HistoryEntry entry = new HistoryEntry();
        entry.title = page.title;
        entry.branch = page.branch;
        entry.content = page.content;
        entry.author = page.author;
        entry.editSummary = page.editSummary;
        entry.editPermission = page.editPermission;
        entry.allowedUsers = page.allowedUsers == null ? new LinkedHashSet<>() : new LinkedHashSet<>(page.allowedUsers);
        entry.createdAt = page.createdAt;
        entry.updatedAt = page.updatedAt;
        entry.archivedAt = archivedAt;
        return entry;
    }

    public HistoryEntry copyOnto(String targetBranch) {
        HistoryEntry copy = new HistoryEntry();
        copy.title = title;
        copy.branch = targetBranch;
        copy.content = content;
        copy.author = author;
        copy.editSummary = editSummary;
        copy.editPermission = editPermission;
        copy.allowedUsers = allowedUsers == null ? new LinkedHashSet<>() : new LinkedHashSet<>(allowedUsers);
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        copy.archivedAt = archivedAt;
        copy.sourceEntryId = id;
        return copy;
    }
}
