package com.splitttr.wiki.entity;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;
import org.bson.types.ObjectId;

// Edits one user made to one page title, across all branches.
@MongoEntity(collection = "page_edit_counts")
public class PageEditCount extends PanacheMongoEntityBase {

    @BsonId
    public ObjectId id;

    public String username;
    public String pageTitle;
    public long edits;
}
