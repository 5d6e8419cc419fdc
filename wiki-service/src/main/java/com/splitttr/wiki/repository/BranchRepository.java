package com.splitttr.wiki.repository;

import com.splitttr.wiki.entity.BranchRecord;
import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

// Database access for branch repository.
@ApplicationScoped
public class BranchRepository implements PanacheMongoRepositoryBase<BranchRecord, ObjectId>, BranchStore {

    @Override
    public Optional<BranchRecord> findRecord(String pageTitle, String branchName) {
        return find("pageTitle = ?1 and branchName = ?2", pageTitle, branchName).firstResultOptional();
    }

    @Override
    public void insert(BranchRecord record) {
        persist(record);
    }

    @Override
    public List<BranchRecord> listForPage(String pageTitle) {
        return list("pageTitle", pageTitle);
    }

    @Override
    public List<String> listBranchNames() {
        return mongoCollection().distinct("branchName", String.class).into(new ArrayList<>());
    }

    @Override
    public long deleteRecord(String pageTitle, String branchName) {
        return delete("pageTitle = ?1 and branchName = ?2", pageTitle, branchName);
    }

    @Override
    public long deleteForPage(String pageTitle) {
        return delete("pageTitle", pageTitle);
    }

    @Override
    public long renamePage(String oldTitle, String newTitle) {
        return update("pageTitle", newTitle).where("pageTitle", oldTitle);
    }
}
