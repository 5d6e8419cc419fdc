package com.splitttr.wiki.entity;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;
import org.bson.types.ObjectId;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

// Live state of one page on one branch. Unique per (title, branch).
@MongoEntity(collection = "pages")
public class Page extends PanacheMongoEntityBase {

    @BsonId
    public ObjectId id;

    public String title;
    public String branch;
    public String content;
    public String author;
    public String editSummary;

    public EditPermission editPermission = EditPermission.EVERYBODY;
    public Set<String> allowedUsers = new LinkedHashSet<>();

    public Instant createdAt;
    public Instant updatedAt;

    // Full field copy tagged with another branch. The copy has no id yet.
    public Page copyOnto(String targetBranch, Instant now) {
        Page copy = new Page();
        copy.title = title;
        copy.branch = targetBranch;
        copy.content = content;
        copy.author = author;
        copy.editSummary = editSummary;
        copy.editPermission = editPermission;
        copy.allowedUsers = allowedUsers == null ? new LinkedHashSet<>() : new LinkedHashSet<>(allowedUsers);
        copy.createdAt = now;
        copy.updatedAt = now;
        return copy;
    }
}
