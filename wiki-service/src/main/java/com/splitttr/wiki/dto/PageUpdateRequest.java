package com.splitttr.wiki.dto;

import com.splitttr.wiki.entity.EditPermission;

import java.util.Set;

// Data model for page update request. A null permission keeps the current one.
public record PageUpdateRequest(
    String content,
    String branch,
    String editSummary,
    EditPermission editPermission,
    Set<String> allowedUsers
) {}
