package com.splitttr.presence.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.splitttr.presence.message.ServerMessage.Editor;
import com.splitttr.presence.service.PresenceService.SessionGrant;

import java.time.Instant;
import java.util.List;

// Data model for edit session response.
public record EditSessionResponse(
    String status,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("lease_expires_at") Instant leaseExpiresAt,
    @JsonProperty("active_editors") List<Editor> activeEditors
) {
    public static EditSessionResponse from(SessionGrant grant) {
        return new EditSessionResponse("ok", grant.sessionId(), grant.leaseExpiresAt(), grant.roster());
    }
}
