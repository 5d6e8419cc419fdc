package com.splitttr.presence.repository;

import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.concurrent.TimeUnit;

// Lease indexes. The TTL index lets MongoDB reap leases nobody saw expire.
@ApplicationScoped
public class MongoIndexes {

    private static final Logger LOG = Logger.getLogger(MongoIndexes.class);

    @Inject EditSessionRepository sessions;

    void onStart(@Observes StartupEvent event) {
        var collection = sessions.mongoCollection();
        collection.createIndex(Indexes.ascending("sessionId"), new IndexOptions().unique(true));
        collection.createIndex(Indexes.ascending("page", "branch", "leaseExpiresAt"));
        collection.createIndex(Indexes.ascending("leaseExpiresAt"), new IndexOptions().expireAfter(0L, TimeUnit.SECONDS));
        LOG.info("MongoDB indexes ensured for edit_sessions");
    }
}
