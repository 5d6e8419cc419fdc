package com.splitttr.wiki.repository;

import com.splitttr.wiki.entity.HistoryEntry;

import java.util.List;
import java.util.Optional;

/**
 * Append-only history log. Every listing is ordered by {@code updatedAt} descending.
 */
public interface HistoryStore {

    void append(HistoryEntry entry);

    long countVersions(String title, String branch);

    // offset 0 is the most recent archived version
    Optional<HistoryEntry> findAt(String title, String branch, int offset);

    List<HistoryEntry> listNewestFirst(String title, String branch, int limit);

    List<HistoryEntry> listAll(String title, String branch);

    long renameTitle(String oldTitle, String newTitle);
}
