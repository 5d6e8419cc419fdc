package com.splitttr.wiki.repository;

/**
 * Per-user edit counters used by the edit permission tiers.
 */
public interface EditStatsStore {

    void recordEdit(String username, String pageTitle);

    long totalEdits(String username);

    long pageEdits(String username, String pageTitle);

    // Any counter already stored under newTitle is overwritten, not merged.
    void movePageCounts(String oldTitle, String newTitle);
}
