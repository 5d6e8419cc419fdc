package com.splitttr.presence.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.NotAuthorizedException;
import org.eclipse.microprofile.jwt.JsonWebToken;

import java.util.Optional;

/**
 * Resolves the caller from the bearer JWT. Presence has no anonymous mode.
 */
@ApplicationScoped
public class AuthService {

    @Inject
    JsonWebToken jwt;

    public record Caller(String userId, String username) {}

    public Optional<Caller> currentCaller() {
        if (jwt == null) return Optional.empty();
        String userId = jwt.getSubject();
        if (userId == null || userId.isBlank()) return Optional.empty();
        String username = jwt.getClaim("preferred_username");
        if (username == null || username.isBlank()) {
            username = userId;
        }
        return Optional.of(new Caller(userId, username.trim()));
    }

    public Caller requireCaller() {
        return currentCaller().orElseThrow(() -> new NotAuthorizedException("Bearer"));
    }
}
