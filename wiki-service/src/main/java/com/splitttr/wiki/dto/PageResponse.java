package com.splitttr.wiki.dto;

import com.splitttr.wiki.entity.EditPermission;
import com.splitttr.wiki.entity.Page;

import java.time.Instant;
import java.util.Set;

// Data model for page response.
public record PageResponse(
    String title,
    String branch,
    String content,
    String author,
    String editSummary,
    EditPermission editPermission,
    Set<String> allowedUsers,
    Instant createdAt,
    Instant updatedAt
) {
    public static PageResponse from(Page page) {
        return new PageResponse(page.title, page.branch, page.content, page.author, page.editSummary,
            page.editPermission, page.allowedUsers == null ? Set.of() : Set.copyOf(page.allowedUsers),
            page.createdAt, page.updatedAt);
    }
}
