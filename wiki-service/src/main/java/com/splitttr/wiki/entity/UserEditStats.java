package com.splitttr.wiki.entity;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;

@MongoEntity(collection = "user_edit_stats")
public class UserEditStats extends PanacheMongoEntityBase {

    @BsonId
    public String username;

    public long totalEdits;
}
