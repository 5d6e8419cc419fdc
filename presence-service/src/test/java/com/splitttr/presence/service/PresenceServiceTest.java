package com.splitttr.presence.service;

import com.splitttr.presence.entity.EditSession;
import com.splitttr.presence.message.ServerMessage.Editor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PresenceServiceTest {

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    private InMemoryLeaseStore leases;
    private MutableClock clock;
    private PresenceService service;

    @BeforeEach
    void setUp() {
        leases = new InMemoryLeaseStore();
        clock = new MutableClock(START);
        service = PresenceServiceFixture.create(leases, clock, true);
    }

    @Test
    void createThenReleaseEmptiesRoster() {
        var grant = service.createSession("Home", "main", "edit", "c1", "u1", "alice");

        assertEquals(List.of(new Editor("alice", "c1")), grant.roster());
        assertEquals(List.of(new Editor("alice", "c1")), service.getRoster("Home", "main"));
        assertEquals(START.plusSeconds(90), grant.leaseExpiresAt());

        assertTrue(service.release(grant.sessionId(), "u1"));

        assertTrue(service.getRoster("Home", "main").isEmpty());
        assertFalse(service.release(grant.sessionId(), "u1"), "release is idempotent");
    }

    @Test
    void sessionIdsAreUrlSafeAndSixteenChars() {
        String id = PresenceService.newSessionId();

        assertEquals(16, id.length());
        assertTrue(id.matches("[A-Za-z0-9_-]+"), id);
        assertNotEquals(id, PresenceService.newSessionId());
    }

    @Test
    void duplicateClientIsRejectedWhileLeaseIsLive() {
        service.createSession("Home", "main", "edit", "c1", "u1", "alice");

        assertThrows(PresenceService.DuplicateSessionException.class,
            () -> service.createSession("Home", "main", "edit", "c1", "u1", "alice"));
        assertEquals(1, leases.stored("u1", "c1", "Home", "main"));
    }

    @Test
    void sameClientMayReconnectAfterExpiry() {
        service.createSession("Home", "main", "edit", "c1", "u1", "alice");
        clock.advance(Duration.ofSeconds(91));

        service.createSession("Home", "main", "edit", "c1", "u1", "alice");

        assertEquals(1, leases.stored("u1", "c1", "Home", "main"));
    }

    @Test
    void otherClientsOfTheSameUserAreSeparateEditors() {
        service.createSession("Home", "main", "edit", "c1", "u1", "alice");
        clock.advance(Duration.ofSeconds(1));
        service.createSession("Home", "main", "edit", "c2", "u1", "alice");

        assertEquals(List.of(new Editor("alice", "c1"), new Editor("alice", "c2")), service.getRoster("Home", "main"));
    }

    @Test
    void createNormalizesAndValidates() {
        var grant = service.createSession("Home", "  ", "", "c1", "u1", "alice");

        EditSession stored = leases.byId(grant.sessionId());
        assertEquals("main", stored.branch);
        assertEquals("edit", stored.mode);
        assertThrows(PresenceService.BadRequestException.class,
            () -> service.createSession("Home", "main", "edit", " ", "u1", "alice"));
        assertThrows(PresenceService.BadRequestException.class,
            () -> service.createSession("Home", "main", "admin", "c9", "u1", "alice"));
    }

    @Test
    void createRejectsInvalidPageTitles() {
        for (String page : List.of("../etc", "a/b", "Talk:Home", "What?", "Anchor#1", "back\\slash", " Home")) {
            assertThrows(PresenceService.BadRequestException.class,
                () -> service.createSession(page, "main", "edit", "c1", "u1", "alice"), page);
        }
        assertTrue(leases.rows.isEmpty());
    }

    @Test
    void viewersAreNotListedAsEditors() {
        service.createSession("Home", "main", "view", "c1", "u1", "alice");
        service.createSession("Home", "main", "edit", "c2", "u2", "bob");

        assertEquals(List.of(new Editor("bob", "c2")), service.getRoster("Home", "main"));
    }

    @Test
    void expiredLeaseNeverAppearsInRoster() {
        service.createSession("Home", "main", "edit", "c1", "u1", "alice");
        leases.pruneFails = true;
        clock.advance(Duration.ofSeconds(90));

        assertTrue(service.getRoster("Home", "main").isEmpty());
    }

    @Test
    void rosterPrunesExpiredLeases() {
        service.createSession("Home", "main", "edit", "c1", "u1", "alice");
        clock.advance(Duration.ofMinutes(5));

        service.getRoster("Home", "main");

        assertTrue(leases.rows.isEmpty());
    }

    @Test
    void heartbeatExtendsButNeverTooFarAhead() {
        var grant = service.createSession("Home", "main", "edit", "c1", "u1", "alice");
        clock.advance(Duration.ofSeconds(10));

        var result = service.heartbeat(grant.sessionId(), "u1", "Home", "main");

        assertEquals(PresenceService.HeartbeatStatus.EXTENDED, result.status());
        // max(expiry, now) + 90 would be 180s out, capped at now + 120
        assertEquals(START.plusSeconds(130), result.leaseExpiresAt());
        assertEquals(START.plusSeconds(130), leases.byId(grant.sessionId()).leaseExpiresAt);
        assertEquals(START.plusSeconds(10), leases.byId(grant.sessionId()).lastHeartbeat);
    }

    @Test
    void heartbeatsInsideTheThrottleWindowSkipStorage() {
        var grant = service.createSession("Home", "main", "edit", "c1", "u1", "alice");
        service.heartbeat(grant.sessionId(), "u1", "Home", "main");
        int readsBefore = leases.reads;
        clock.advance(Duration.ofSeconds(4));

        var throttled = service.heartbeat(grant.sessionId(), "u1", "Home", "main");

        assertEquals(PresenceService.HeartbeatStatus.THROTTLED, throttled.status());
        assertEquals(readsBefore, leases.reads);

        clock.advance(Duration.ofSeconds(1));
        assertEquals(PresenceService.HeartbeatStatus.EXTENDED,
            service.heartbeat(grant.sessionId(), "u1", "Home", "main").status());
    }

    @Test
    void heartbeatReportsMissingAndExpiredLeases() {
        assertEquals(PresenceService.HeartbeatStatus.MISSING,
            service.heartbeat("nope", "u1", "Home", "main").status());

        var grant = service.createSession("Home", "main", "edit", "c1", "u1", "alice");
        assertEquals(PresenceService.HeartbeatStatus.MISSING,
            service.heartbeat(grant.sessionId(), "u2", "Home", "main").status(), "other user");
        assertEquals(PresenceService.HeartbeatStatus.MISSING,
            service.heartbeat(grant.sessionId(), "u1", "Home", "draft").status(), "other branch");

        clock.advance(Duration.ofSeconds(90));
        var expired = service.heartbeat(grant.sessionId(), "u1", "Home", "main");

        assertEquals(PresenceService.HeartbeatStatus.EXPIRED, expired.status());
        assertTrue(expired.isGone());
        assertTrue(leases.rows.isEmpty(), "expired lease is deleted");
    }

    @Test
    void releaseClearsTheThrottleGuard() {
        var grant = service.createSession("Home", "main", "edit", "c1", "u1", "alice");
        service.heartbeat(grant.sessionId(), "u1", "Home", "main");

        service.release(grant.sessionId(), "u1");

        assertEquals(PresenceService.HeartbeatStatus.MISSING,
            service.heartbeat(grant.sessionId(), "u1", "Home", "main").status());
    }

    @Test
    void validateSessionMatchesPageBranchAndMode() {
        var grant = service.createSession("Home", "draft", "view", "c1", "u1", "alice");
        String id = grant.sessionId();

        assertTrue(service.validateSession(id, "u1", "Home", "draft", "view").isPresent());
        assertTrue(service.validateSession(id, "u1", "Home", "draft", "edit").isEmpty());
        assertTrue(service.validateSession(id, "u1", "Home", "main", "view").isEmpty());
        assertTrue(service.validateSession(id, "u1", "Other", "draft", "view").isEmpty());
        assertTrue(service.validateSession(id, "u2", "Home", "draft", "view").isEmpty());
        assertTrue(service.validateSession(id, "u1", "Home", "draft", "bogus").isEmpty());
    }

    @Test
    void expiredSessionIsDeletedOnLookup() {
        var grant = service.createSession("Home", "main", "edit", "c1", "u1", "alice");
        clock.advance(Duration.ofSeconds(120));

        assertTrue(service.findSession(grant.sessionId(), "u1").isEmpty());
        assertTrue(leases.rows.isEmpty());
    }

    @Test
    void storageOutageSurfacesAsOffline() {
        leases.offline = true;

        assertThrows(PresenceService.PresenceOfflineException.class,
            () -> service.createSession("Home", "main", "edit", "c1", "u1", "alice"));
        assertThrows(PresenceService.PresenceOfflineException.class,
            () -> service.getRoster("Home", "main"));
    }
}
