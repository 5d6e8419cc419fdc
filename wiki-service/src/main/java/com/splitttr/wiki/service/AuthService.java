package com.splitttr.wiki.service;

import com.splitttr.wiki.entity.EditPermission;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.NotAuthorizedException;
import org.eclipse.microprofile.jwt.JsonWebToken;

/**
 * Resolves the caller from the bearer JWT issued by the external auth service.
 * Requests without a token edit as {@code Anonymous}.
 */
@ApplicationScoped
public class AuthService {

    @Inject
    JsonWebToken jwt;

    /**
     * Username of the caller: the {@code preferred_username} claim, falling back to the subject.
     */
    public String currentUsername() {
        if (jwt == null) return EditPermission.ANONYMOUS;
        String username = jwt.getClaim("preferred_username");
        if (username == null || username.isBlank()) {
            username = jwt.getSubject();
        }
        if (username == null || username.isBlank()) {
            return EditPermission.ANONYMOUS;
        }
        return username.trim();
    }

    // For operations that must be attributable to a signed-in user.
    public String requireUsername() {
        String username = currentUsername();
        if (EditPermission.ANONYMOUS.equals(username)) {
            throw new NotAuthorizedException("Bearer");
        }
        return username;
    }
}
