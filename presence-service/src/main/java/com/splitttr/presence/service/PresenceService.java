package com.splitttr.presence.service;

import com.mongodb.MongoException;
import com.splitttr.presence.entity.EditSession;
import com.splitttr.presence.message.ServerMessage.Editor;
import com.splitttr.presence.repository.LeaseStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lease lifecycle for live edit presence: create, heartbeat, release and roster reads.
 *
 * <p>Leases are advisory. A lease whose expiry has passed is never reported, whether or not
 * it has been pruned yet.
 */
@ApplicationScoped
public class PresenceService {

    private static final Logger LOG = Logger.getLogger(PresenceService.class);

    public static final String MODE_EDIT = "edit";
    public static final String MODE_VIEW = "view";
    public static final String DEFAULT_BRANCH = "main";

    private static final String FORBIDDEN_PAGE_CHARS = ":/\\?#";

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Base64.Encoder SESSION_ID_ENCODER = Base64.getUrlEncoder().withoutPadding();

    @Inject LeaseStore leases;
    @Inject Clock clock;

    @ConfigProperty(name = "presence.enabled", defaultValue = "true")
    boolean enabled;

    @ConfigProperty(name = "presence.lease-seconds", defaultValue = "90")
    long leaseSeconds;

    @ConfigProperty(name = "presence.max-extension-ahead-seconds", defaultValue = "120")
    long maxExtensionAheadSeconds;

    @ConfigProperty(name = "presence.heartbeat-throttle-seconds", defaultValue = "5")
    long heartbeatThrottleSeconds;

    // sessionId -> time of the last successful extension
    private final ConcurrentHashMap<String, Instant> heartbeatGuard = new ConcurrentHashMap<>();

    public record SessionGrant(String sessionId, Instant leaseExpiresAt, List<Editor> roster) {}

    public enum HeartbeatStatus { EXTENDED, MISSING, EXPIRED, THROTTLED }

    public record HeartbeatResult(HeartbeatStatus status, Instant leaseExpiresAt) {
        public boolean isGone() {
            return status == HeartbeatStatus.MISSING || status == HeartbeatStatus.EXPIRED;
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Opens a lease for one client of a user on a page/branch. The same (user, client, page,
     * branch) may hold only one live lease at a time.
     */
    public SessionGrant createSession(String page, String branch, String mode, String clientId,
                                      String userId, String username) {
        if (page == null || page.isBlank()) {
            throw new BadRequestException("page is required");
        }
        if (!isValidPage(page)) {
            throw new BadRequestException("Invalid page title");
        }
        if (clientId == null || clientId.isBlank()) {
            throw new BadRequestException("client_id is required");
        }
        if (userId == null || userId.isBlank()) {
            throw new BadRequestException("user is required");
        }
        String b = normalizeBranch(branch);
        String m = normalizeMode(mode);
        String client = clientId.strip();
        Instant now = clock.instant();

        try {
            prune(page, b, now);
            if (leases.findLive(userId, client, page, b, now).isPresent()) {
                LOG.warnf("Duplicate edit session rejected: user %s client %s on %s/%s", userId, client, page, b);
                throw new DuplicateSessionException("Session already active for client");
            }

            EditSession session = new EditSession();
            session.sessionId = newSessionId();
            session.clientId = client;
            session.userId = userId;
            session.username = username == null || username.isBlank() ? userId : username;
            session.page = page;
            session.branch = b;
            session.mode = m;
            session.createdAt = now;
            session.lastHeartbeat = now;
            session.leaseExpiresAt = now.plusSeconds(leaseSeconds);
            leases.insert(session);

            LOG.infof("Edit session created: %s for %s on %s/%s (%s)", session.sessionId, session.username, page, b, m);
            return new SessionGrant(session.sessionId, session.leaseExpiresAt, readRoster(page, b, now));
        } catch (MongoException e) {
            throw new PresenceOfflineException("Database unavailable", e);
        }
    }

    /**
     * Extends a lease by the lease length, never past {@code now + max-extension-ahead}.
     * Calls within the throttle window of the last extension do not touch storage.
     */
    public HeartbeatResult heartbeat(String sessionId, String userId, String page, String branch) {
        Instant now = clock.instant();
        Instant last = heartbeatGuard.get(sessionId);
        if (last != null && now.isBefore(last.plusSeconds(heartbeatThrottleSeconds))) {
            return new HeartbeatResult(HeartbeatStatus.THROTTLED, null);
        }

        try {
            Optional<EditSession> found = leases.findSession(sessionId, userId, page, normalizeBranch(branch));
            if (found.isEmpty()) {
                heartbeatGuard.remove(sessionId);
                return new HeartbeatResult(HeartbeatStatus.MISSING, null);
            }
            EditSession session = found.get();
            if (session.isExpiredAt(now)) {
                leases.deleteLease(session.id);
                heartbeatGuard.remove(sessionId);
                LOG.infof("Edit session expired on heartbeat: %s", sessionId);
                return new HeartbeatResult(HeartbeatStatus.EXPIRED, null);
            }

            Instant base = session.leaseExpiresAt.isAfter(now) ? session.leaseExpiresAt : now;
            Instant target = base.plusSeconds(leaseSeconds);
            Instant cap = now.plusSeconds(maxExtensionAheadSeconds);
            Instant expiry = target.isAfter(cap) ? cap : target;

            leases.extend(session.id, expiry, now);
            heartbeatGuard.put(sessionId, now);
            return new HeartbeatResult(HeartbeatStatus.EXTENDED, expiry);
        } catch (MongoException e) {
            throw new PresenceOfflineException("Database unavailable", e);
        }
    }

    // Idempotent: false when nothing matched.
    public boolean release(String sessionId, String userId) {
        heartbeatGuard.remove(sessionId);
        try {
            boolean removed = leases.deleteSession(sessionId, userId);
            if (removed) {
                LOG.infof("Edit session released: %s", sessionId);
            }
            return removed;
        } catch (MongoException e) {
            throw new PresenceOfflineException("Database unavailable", e);
        }
    }

    /**
     * Unexpired edit-mode leases of a page/branch, oldest first. View leases are not listed.
     */
    public List<Editor> getRoster(String page, String branch) {
        String b = normalizeBranch(branch);
        Instant now = clock.instant();
        try {
            prune(page, b, now);
            return readRoster(page, b, now);
        } catch (MongoException e) {
            throw new PresenceOfflineException("Database unavailable", e);
        }
    }

    /**
     * The caller's live lease when it matches page, branch and mode exactly.
     */
    public Optional<EditSession> validateSession(String sessionId, String userId, String page,
                                                 String branch, String mode) {
        String m;
        try {
            m = normalizeMode(mode);
        } catch (BadRequestException e) {
            LOG.warnf("Edit session %s presented with unknown mode '%s'", sessionId, mode);
            return Optional.empty();
        }
        return findSession(sessionId, userId)
            .filter(s -> page.equals(s.page))
            .filter(s -> normalizeBranch(branch).equals(s.branch))
            .filter(s -> m.equals(s.mode));
    }

    // The caller's lease regardless of page or mode. Expired leases are deleted and not returned.
    public Optional<EditSession> findSession(String sessionId, String userId) {
        try {
            Optional<EditSession> found = leases.findSession(sessionId, userId);
            if (found.isPresent() && found.get().isExpiredAt(clock.instant())) {
                leases.deleteLease(found.get().id);
                return Optional.empty();
            }
            return found;
        } catch (MongoException e) {
            throw new PresenceOfflineException("Database unavailable", e);
        }
    }

    // Same title rules the wiki applies to page names.
    public static boolean isValidPage(String page) {
        if (page == null || page.isBlank() || !page.equals(page.strip())) return false;
        if (page.contains("..") || page.startsWith("/")) return false;
        for (int i = 0; i < page.length(); i++) {
            if (FORBIDDEN_PAGE_CHARS.indexOf(page.charAt(i)) >= 0) return false;
        }
        return true;
    }

    public static String normalizeBranch(String branch) {
        if (branch == null || branch.isBlank()) return DEFAULT_BRANCH;
        return branch.strip();
    }

    public static String normalizeMode(String mode) {
        if (mode == null || mode.isBlank()) return MODE_EDIT;
        String m = mode.strip().toLowerCase(Locale.ROOT);
        if (!MODE_EDIT.equals(m) && !MODE_VIEW.equals(m)) {
            throw new BadRequestException("mode must be 'edit' or 'view'");
        }
        return m;
    }

    // Roster reads stay accurate without the prune, so a failed prune only logs.
    private void prune(String page, String branch, Instant now) {
        try {
            long removed = leases.deleteExpired(page, branch, now);
            if (removed > 0) {
                LOG.debugf("Pruned %d expired edit sessions on %s/%s", removed, page, branch);
            }
        } catch (MongoException e) {
            LOG.warnf("Failed to prune expired edit sessions on %s/%s: %s", page, branch, e.getMessage());
        }
    }

    private List<Editor> readRoster(String page, String branch, Instant now) {
        return leases.listEditors(page, branch, now).stream()
            .map(s -> new Editor(s.username == null ? "" : s.username, s.clientId == null ? "" : s.clientId))
            .toList();
    }

    static String newSessionId() {
        byte[] bytes = new byte[12];
        RANDOM.nextBytes(bytes);
        return SESSION_ID_ENCODER.encodeToString(bytes);
    }

    public static class BadRequestException extends RuntimeException {
        public BadRequestException(String message) { super(message); }
    }

    public static class DuplicateSessionException extends RuntimeException {
        public DuplicateSessionException(String message) { super(message); }
    }

    // Lease storage is unreachable.
    public static class PresenceOfflineException extends RuntimeException {
        public PresenceOfflineException(String message, Throwable cause) { super(message, cause); }
    }
}
