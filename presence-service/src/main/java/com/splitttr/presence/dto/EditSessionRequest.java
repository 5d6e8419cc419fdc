package com.splitttr.presence.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

// Data model for edit session request.
public record EditSessionRequest(
    String branch,
    String mode,
    @JsonProperty("client_id") String clientId
) {}
