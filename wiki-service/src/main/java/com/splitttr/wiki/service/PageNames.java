package com.splitttr.wiki.service;

import com.splitttr.wiki.entity.EditPermission;

import java.util.Locale;
import java.util.Set;

/**
 * Validation and normalization rules for titles, branch names, authors and summaries.
 */
public final class PageNames {

    public static final String MAIN = "main";
    public static final String TALK = "talk";
    public static final int MAX_SUMMARY_LENGTH = 250;

    private static final String FORBIDDEN_TITLE_CHARS = ":/\\?#";
    private static final Set<String> RESERVED_BRANCHES = Set.of("main", "master", "head", "origin", "talk");

    private PageNames() {
    }

    public static boolean isValidTitle(String title) {
        if (title == null || title.isBlank()) return false;
        if (!title.equals(title.strip())) return false;
        if (title.contains("..") || title.startsWith("/")) return false;
        for (int i = 0; i < title.length(); i++) {
            if (FORBIDDEN_TITLE_CHARS.indexOf(title.charAt(i)) >= 0) return false;
        }
        return true;
    }

    // Rules for a branch name a user is about to create.
    public static boolean isValidNewBranchName(String branch) {
        if (branch == null || branch.isBlank()) return false;
        if (branch.contains("..") || branch.contains("/") || branch.contains("\\")) return false;
        return !RESERVED_BRANCHES.contains(branch.strip().toLowerCase(Locale.ROOT));
    }

    // Rules for a branch name used to address an existing page.
    public static boolean isSafeBranchName(String branch) {
        return branch != null && !branch.isBlank()
            && !branch.contains("..") && !branch.contains("/") && !branch.contains("\\");
    }

    public static String normalizeBranch(String branch) {
        if (branch == null || branch.isBlank()) return MAIN;
        return branch.strip();
    }

    // main and talk exist for every page and are never registered.
    public static boolean isImplicitBranch(String branch) {
        return MAIN.equals(branch) || TALK.equals(branch);
    }

    public static String normalizeAuthor(String author) {
        if (author == null || author.isBlank()) return EditPermission.ANONYMOUS;
        return author.strip();
    }

    public static String normalizeSummary(String summary) {
        String value = summary == null ? "" : summary.strip();
        return value.length() > MAX_SUMMARY_LENGTH ? value.substring(0, MAX_SUMMARY_LENGTH) : value;
    }
}
