package com.splitttr.wiki.repository;

import com.mongodb.client.model.Filters;
import com.splitttr.wiki.entity.Page;
import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

// Database access for page repository.
@ApplicationScoped
public class PageRepository implements PanacheMongoRepositoryBase<Page, ObjectId>, PageStore {

    @Override
    public Optional<Page> findPage(String title, String branch) {
        return find("title = ?1 and branch = ?2", title, branch).firstResultOptional();
    }

    @Override
    public boolean existsAnyBranch(String title) {
        return count("title", title) > 0;
    }

    @Override
    public List<Page> listByTitle(String title) {
        return list("title", title);
    }

    @Override
    public List<Page> listByBranch(String branch, int limit) {
        return find("branch", Sort.descending("updatedAt"), branch)
            .page(0, Math.max(1, limit))
            .list();
    }

    @Override
    public List<Page> search(String query, String branch, int limit) {
        Pattern literal = Pattern.compile(Pattern.quote(query), Pattern.CASE_INSENSITIVE);
        return mongoCollection().find(Filters.and(
                Filters.eq("branch", branch),
                Filters.or(Filters.regex("title", literal), Filters.regex("content", literal))
            ))
            .limit(Math.max(1, limit))
            .into(new ArrayList<>());
    }

    @Override
    public void insert(Page page) {
        persist(page);
    }

    @Override
    @Transactional
    public void insertPair(Page first, Page second) {
        persist(first);
        persist(second);
    }

    @Override
    public void replace(Page page) {
        update(page);
    }

    @Override
    public long deleteByTitle(String title) {
        return delete("title", title);
    }

    @Override
    public long deleteBranch(String title, String branch) {
        return delete("title = ?1 and branch = ?2", title, branch);
    }

    @Override
    public long renameTitle(String oldTitle, String newTitle) {
        return update("title", newTitle).where("title", oldTitle);
    }
}
