package com.splitttr.wiki.entity;

import java.util.Set;

// Who may overwrite a page.
public enum EditPermission {
    EVERYBODY,
    TEN_EDITS,
    FIFTY_EDITS,
    SELECT_USERS;

    public static final String ANONYMOUS = "Anonymous";

    public boolean canEdit(Set<String> allowedUsers, long userEditCount, String username) {
        if (this == EVERYBODY) return true;
        if (username == null || username.isBlank() || ANONYMOUS.equals(username)) return false;
        return switch (this) {
            case TEN_EDITS -> userEditCount >= 10;
            case FIFTY_EDITS -> userEditCount >= 50;
            case SELECT_USERS -> allowedUsers != null && allowedUsers.contains(username);
            default -> true;
        };
    }
}
