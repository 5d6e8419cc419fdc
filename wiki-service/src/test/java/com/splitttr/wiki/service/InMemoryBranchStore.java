package com.splitttr.wiki.service;

import com.splitttr.wiki.entity.BranchRecord;
import com.splitttr.wiki.repository.BranchStore;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

class InMemoryBranchStore implements BranchStore {

    final List<BranchRecord> rows = new ArrayList<>();

    @Override
    public Optional<BranchRecord> findRecord(String pageTitle, String branchName) {
        return rows.stream()
            .filter(r -> r.pageTitle.equals(pageTitle) && r.branchName.equals(branchName))
            .findFirst();
    }

    @Override
    public void insert(BranchRecord record) {
        if (findRecord(record.pageTitle, record.branchName).isPresent()) {
            throw new IllegalStateException("duplicate key (pageTitle, branchName)");
        }
        record.id = new ObjectId();
        rows.add(record);
    }

    @Override
    public List<BranchRecord> listForPage(String pageTitle) {
        return rows.stream().filter(r -> r.pageTitle.equals(pageTitle)).toList();
    }

    @Override
    public List<String> listBranchNames() {
        return rows.stream().map(r -> r.branchName).distinct().toList();
    }

    @Override
    public long deleteRecord(String pageTitle, String branchName) {
        int before = rows.size();
        rows.removeIf(r -> r.pageTitle.equals(pageTitle) && r.branchName.equals(branchName));
        return before - rows.size();
    }

    @Override
    public long deleteForPage(String pageTitle) {
        int before = rows.size();
        rows.removeIf(r -> r.pageTitle.equals(pageTitle));
        return before - rows.size();
    }

    @Override
    public long renamePage(String oldTitle, String newTitle) {
        long n = 0;
        for (BranchRecord r : rows) {
            if (r.pageTitle.equals(oldTitle)) {
                r.pageTitle = newTitle;
                n++;
            }
        }
        return n;
    }
}
