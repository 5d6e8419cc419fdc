package com.splitttr.wiki.service;

import java.time.Instant;

/**
 * One entry of a page's version list. {@code index} 0 is the live page, higher indexes walk
 * back through history; {@code displayNumber} counts up from 1 for the oldest version.
 */
public record PageVersion(
    int index,
    int displayNumber,
    String author,
    Instant updatedAt,
    String editSummary,
    String content,
    boolean current
) {
    public String label() {
        return "Version " + displayNumber;
    }
}
