package com.splitttr.wiki.dto;

import com.splitttr.wiki.service.PageVersion;

import java.time.Instant;

// Data model for one row of the version list. Content is not included.
public record VersionResponse(
    int index,
    int displayNumber,
    String author,
    Instant updatedAt,
    String editSummary,
    boolean current
) {
    public static VersionResponse from(PageVersion v) {
        return new VersionResponse(v.index(), v.displayNumber(), v.author(), v.updatedAt(), v.editSummary(), v.current());
    }
}
