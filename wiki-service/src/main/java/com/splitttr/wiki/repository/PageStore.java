package com.splitttr.wiki.repository;

import com.splitttr.wiki.entity.Page;

import java.util.List;
import java.util.Optional;

/**
 * Content store: the live page of every (title, branch) pair.
 */
public interface PageStore {

    Optional<Page> findPage(String title, String branch);

    boolean existsAnyBranch(String title);

    List<Page> listByTitle(String title);

    // Newest first.
    List<Page> listByBranch(String branch, int limit);

    // Case-insensitive literal match on title or content within one branch.
    List<Page> search(String query, String branch, int limit);

    void insert(Page page);

    /**
     * Inserts both pages or neither. Used for the first save of a title, which creates
     * its main and talk pages together.
     */
    void insertPair(Page first, Page second);

    void replace(Page page);

    long deleteByTitle(String title);

    long deleteBranch(String title, String branch);

    long renameTitle(String oldTitle, String newTitle);
}
