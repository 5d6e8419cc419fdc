package com.splitttr.wiki.dto;

public record RenameRequest(String newTitle) {}
