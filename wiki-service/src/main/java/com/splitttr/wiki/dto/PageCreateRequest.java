package com.splitttr.wiki.dto;

// Data model for page create request.
public record PageCreateRequest(
    String title,
    String content,
    String branch,
    String editSummary
) {}
