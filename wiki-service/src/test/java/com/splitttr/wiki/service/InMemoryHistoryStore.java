package com.splitttr.wiki.service;

import com.splitttr.wiki.entity.HistoryEntry;
import com.splitttr.wiki.repository.HistoryStore;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

class InMemoryHistoryStore implements HistoryStore {

    final List<HistoryEntry> rows = new ArrayList<>();

    // appends allowed before every further append throws; negative disables
    int appendsBeforeFailure = -1;

    @Override
    public void append(HistoryEntry entry) {
        if (appendsBeforeFailure == 0) {
            throw new IllegalStateException("history write failed");
        }
        if (appendsBeforeFailure > 0) appendsBeforeFailure--;
        entry.id = new ObjectId();
        rows.add(entry);
    }

    @Override
    public long countVersions(String title, String branch) {
        return rows.stream().filter(e -> e.title.equals(title) && e.branch.equals(branch)).count();
    }

    @Override
    public Optional<HistoryEntry> findAt(String title, String branch, int offset) {
        List<HistoryEntry> ordered = listAll(title, branch);
        return offset < ordered.size() ? Optional.of(ordered.get(offset)) : Optional.empty();
    }

    @Override
    public List<HistoryEntry> listNewestFirst(String title, String branch, int limit) {
        return listAll(title, branch).stream().limit(limit).toList();
    }

    @Override
    public List<HistoryEntry> listAll(String title, String branch) {
        List<HistoryEntry> matching = new ArrayList<>();
        for (HistoryEntry e : rows) {
            if (e.title.equals(title) && e.branch.equals(branch)) matching.add(0, e);
        }
        // stable: among equal timestamps the later append comes first
        matching.sort(Comparator.comparing((HistoryEntry e) -> e.updatedAt).reversed());
        return matching;
    }

    @Override
    public long renameTitle(String oldTitle, String newTitle) {
        long n = 0;
        for (HistoryEntry e : rows) {
            if (e.title.equals(oldTitle)) {
                e.title = newTitle;
                n++;
            }
        }
        return n;
    }
}
