package com.splitttr.wiki.entity;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;
import org.bson.types.ObjectId;

import java.time.Instant;

// Registry row for a non-implicit branch of a page.
@MongoEntity(collection = "branches")
public class BranchRecord extends PanacheMongoEntityBase {

    @BsonId
    public ObjectId id;

    public String pageTitle;
    public String branchName;

    // null when the branch was started from scratch rather than forked
    public String createdFrom;

    public Instant createdAt;

    public static BranchRecord of(String pageTitle, String branchName, String createdFrom, Instant createdAt) {
        BranchRecord record = new BranchRecord();
        record.pageTitle = pageTitle;
        record.branchName = branchName;
        record.createdFrom = createdFrom;
        record.createdAt = createdAt;
        return record;
    }
}
