package com.splitttr.wiki.dto;

// Data model for branch fork request. sourceBranch defaults to main.
public record ForkRequest(
    String branchName,
    String sourceBranch
) {}
