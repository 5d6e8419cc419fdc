package com.splitttr.wiki.repository;

import com.splitttr.wiki.entity.HistoryEntry;
import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import org.bson.types.ObjectId;

import java.util.List;
import java.util.Optional;

// Database access for history repository.
@ApplicationScoped
public class HistoryRepository implements PanacheMongoRepositoryBase<HistoryEntry, ObjectId>, HistoryStore {

    private static final Sort NEWEST_FIRST = Sort.descending("updatedAt").and("_id", Sort.Direction.Descending);

    @Override
    public void append(HistoryEntry entry) {
        persist(entry);
    }

    @Override
    public long countVersions(String title, String branch) {
        return count("title = ?1 and branch = ?2", title, branch);
    }

    @Override
    public Optional<HistoryEntry> findAt(String title, String branch, int offset) {
        if (offset < 0) return Optional.empty();
        // page(offset, 1) addresses single documents, so page index == skip count
        return find("title = ?1 and branch = ?2", NEWEST_FIRST, title, branch)
            .page(offset, 1)
            .firstResultOptional();
    }

    @Override
    public List<HistoryEntry> listNewestFirst(String title, String branch, int limit) {
        return find("title = ?1 and branch = ?2", NEWEST_FIRST, title, branch)
            .page(0, Math.max(1, limit))
            .list();
    }

    @Override
    public List<HistoryEntry> listAll(String title, String branch) {
        return list("title = ?1 and branch = ?2", NEWEST_FIRST, title, branch);
    }

    @Override
    public long renameTitle(String oldTitle, String newTitle) {
        return update("title", newTitle).where("title", oldTitle);
    }
}
