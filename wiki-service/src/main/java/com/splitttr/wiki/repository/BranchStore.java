package com.splitttr.wiki.repository;

import com.splitttr.wiki.entity.BranchRecord;

import java.util.List;
import java.util.Optional;

/**
 * Branch registry. {@code main} and {@code talk} are implicit and never stored.
 */
public interface BranchStore {

    Optional<BranchRecord> findRecord(String pageTitle, String branchName);

    void insert(BranchRecord record);

    List<BranchRecord> listForPage(String pageTitle);

    List<String> listBranchNames();

    long deleteRecord(String pageTitle, String branchName);

    long deleteForPage(String pageTitle);

    long renamePage(String oldTitle, String newTitle);
}
