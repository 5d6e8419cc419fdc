package com.splitttr.presence.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

// ClientMessage.
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClientMessage(
    String type            // "ping", "release"
) {
    public static final String PING = "ping";
    public static final String RELEASE = "release";
}
