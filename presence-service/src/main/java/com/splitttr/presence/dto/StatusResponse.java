package com.splitttr.presence.dto;

public record StatusResponse(String status) {}
