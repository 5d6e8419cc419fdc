package com.splitttr.wiki.repository;

import com.splitttr.wiki.entity.PageEditCount;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

// Edit counters backed by the user_edit_stats and page_edit_counts collections.
@ApplicationScoped
public class MongoEditStatsStore implements EditStatsStore {

    @Inject UserEditStatsRepository users;
    @Inject PageEditCountRepository pageCounts;

    @Override
    public void recordEdit(String username, String pageTitle) {
        users.increment(username);
        pageCounts.increment(username, pageTitle);
    }

    @Override
    public long totalEdits(String username) {
        return users.totalFor(username);
    }

    @Override
    public long pageEdits(String username, String pageTitle) {
        return pageCounts.countFor(username, pageTitle);
    }

    @Override
    public void movePageCounts(String oldTitle, String newTitle) {
        for (PageEditCount row : pageCounts.listForPage(oldTitle)) {
            pageCounts.deleteFor(row.username, newTitle);
            row.pageTitle = newTitle;
            pageCounts.update(row);
        }
    }
}
