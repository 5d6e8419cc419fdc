package com.splitttr.wiki.repository;

import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

// Creates the indexes the stores rely on. createIndex is a no-op when the index exists.
@ApplicationScoped
public class MongoIndexes {

    private static final Logger LOG = Logger.getLogger(MongoIndexes.class);

    @Inject PageRepository pages;
    @Inject HistoryRepository history;
    @Inject BranchRepository branches;
    @Inject PageEditCountRepository pageCounts;

    void onStart(@Observes StartupEvent event) {
        pages.mongoCollection().createIndex(
            Indexes.ascending("title", "branch"), new IndexOptions().unique(true));
        pages.mongoCollection().createIndex(Indexes.descending("updatedAt"));
        history.mongoCollection().createIndex(
            Indexes.compoundIndex(Indexes.ascending("title", "branch"), Indexes.descending("updatedAt")));
        branches.mongoCollection().createIndex(
            Indexes.ascending("pageTitle", "branchName"), new IndexOptions().unique(true));
        pageCounts.mongoCollection().createIndex(
            Indexes.ascending("username", "pageTitle"), new IndexOptions().unique(true));
        LOG.info("MongoDB indexes ensured for pages, history, branches and page_edit_counts");
    }
}
