package com.splitttr.presence.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.splitttr.presence.message.ServerMessage;
import com.splitttr.presence.service.AuthService.Caller;
import com.splitttr.presence.service.InMemoryLeaseStore;
import com.splitttr.presence.service.MutableClock;
import com.splitttr.presence.service.PresenceService;
import com.splitttr.presence.service.PresenceServiceFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PresenceCoordinatorTest {

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");
    private static final ObjectMapper JSON = new ObjectMapper();

    private static final Caller ALICE = new Caller("u1", "alice");
    private static final Caller BOB = new Caller("u2", "bob");

    private InMemoryLeaseStore leases;
    private MutableClock clock;
    private PresenceService presence;
    private PresenceCoordinator coordinator;

    @BeforeEach
    void setUp() {
        leases = new InMemoryLeaseStore();
        clock = new MutableClock(START);
        presence = PresenceServiceFixture.create(leases, clock, true);
        coordinator = newCoordinator(presence);
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
    }

    private static PresenceCoordinator newCoordinator(PresenceService presence) {
        PresenceCoordinator coordinator = new PresenceCoordinator();
        coordinator.presence = presence;
        // ticks are driven by the tests
        coordinator.housekeepingIntervalSeconds = 3600;
        coordinator.init();
        return coordinator;
    }

    private FakeSocket join(String socketId, Caller caller, String clientId) {
        var grant = presence.createSession("Home", "main", "edit", clientId, caller.userId(), caller.username());
        FakeSocket socket = new FakeSocket(socketId);
        coordinator.open(socket, caller, "Home", "main", grant.sessionId(), "edit");
        return socket;
    }

    private static JsonNode parse(String json) throws Exception {
        return JSON.readTree(json);
    }

    private static List<String> editorNames(String json) throws Exception {
        JsonNode node = parse(json);
        assertEquals("presence", node.get("type").asText());
        List<String> names = new ArrayList<>();
        node.get("editors").forEach(e -> names.add(e.get("username").asText() + "/" + e.get("client_id").asText()));
        return names;
    }

    @Test
    void joiningPushesTheCurrentRoster() throws Exception {
        FakeSocket socket = join("s1", ALICE, "c1");

        assertNull(socket.closeCode);
        assertEquals(List.of("alice/c1"), editorNames(socket.last()));
        assertEquals(1, coordinator.occupancy("Home", "main"));
    }

    @Test
    void everyoneInTheRoomSeesNewArrivals() throws Exception {
        FakeSocket first = join("s1", ALICE, "c1");
        clock.advance(Duration.ofSeconds(1));
        join("s2", BOB, "c2");

        assertEquals(List.of("alice/c1", "bob/c2"), editorNames(first.last()));
    }

    @Test
    void rejectedConnectionsGetDistinctCloseCodes() {
        var grant = presence.createSession("Home", "main", "edit", "c1", "u1", "alice");

        FakeSocket missing = new FakeSocket("a");
        coordinator.open(missing, ALICE, "Home", "main", null, "edit");
        assertEquals(PresenceCoordinator.CLOSE_PROTOCOL_ERROR, missing.closeCode);

        FakeSocket anonymous = new FakeSocket("b");
        coordinator.open(anonymous, null, "Home", "main", grant.sessionId(), "edit");
        assertEquals(PresenceCoordinator.CLOSE_UNAUTHENTICATED, anonymous.closeCode);

        FakeSocket wrongMode = new FakeSocket("c");
        coordinator.open(wrongMode, ALICE, "Home", "main", grant.sessionId(), "view");
        assertEquals(PresenceCoordinator.CLOSE_INVALID_SESSION, wrongMode.closeCode);

        FakeSocket stranger = new FakeSocket("d");
        coordinator.open(stranger, BOB, "Home", "main", grant.sessionId(), "edit");
        assertEquals(PresenceCoordinator.CLOSE_INVALID_SESSION, stranger.closeCode);

        assertEquals(0, coordinator.roomCount());
    }

    @Test
    void expiredLeaseCannotJoin() {
        var grant = presence.createSession("Home", "main", "edit", "c1", "u1", "alice");
        clock.advance(Duration.ofSeconds(90));

        FakeSocket socket = new FakeSocket("s1");
        coordinator.open(socket, ALICE, "Home", "main", grant.sessionId(), "edit");

        assertEquals(4409, socket.closeCode);
        assertTrue(socket.sent.isEmpty());
    }

    @Test
    void disabledPresenceClosesEveryConnection() {
        PresenceCoordinator disabled = newCoordinator(PresenceServiceFixture.create(leases, clock, false));
        try {
            FakeSocket socket = new FakeSocket("s1");
            disabled.open(socket, ALICE, "Home", "main", "whatever", "edit");

            assertEquals(4404, socket.closeCode);
        } finally {
            disabled.shutdown();
        }
    }

    @Test
    void pingExtendsTheLease() {
        FakeSocket socket = join("s1", ALICE, "c1");
        String sessionId = leases.rows.get(0).sessionId;
        clock.advance(Duration.ofSeconds(30));

        coordinator.onMessage(socket, "{\"type\":\"ping\"}");

        assertEquals(START.plusSeconds(150), leases.byId(sessionId).leaseExpiresAt);
        assertNull(socket.closeCode);
    }

    @Test
    void pingAfterExpirySaysGoodbyeAndCloses() throws Exception {
        FakeSocket socket = join("s1", ALICE, "c1");
        clock.advance(Duration.ofSeconds(91));

        coordinator.onMessage(socket, "{\"type\":\"ping\"}");

        JsonNode goodbye = parse(socket.last());
        assertEquals("goodbye", goodbye.get("type").asText());
        assertEquals("expired", goodbye.get("reason").asText());
        assertEquals(PresenceCoordinator.CLOSE_INVALID_SESSION, socket.closeCode);
        assertEquals(0, coordinator.roomCount());
    }

    @Test
    void releaseMessageDropsLeaseAndUpdatesOthers() throws Exception {
        FakeSocket alice = join("s1", ALICE, "c1");
        clock.advance(Duration.ofSeconds(1));
        FakeSocket bob = join("s2", BOB, "c2");

        coordinator.onMessage(alice, "{\"type\":\"release\"}");

        assertEquals("released", parse(alice.last()).get("reason").asText());
        assertEquals(PresenceCoordinator.CLOSE_NORMAL, alice.closeCode);
        assertEquals(List.of("bob/c2"), editorNames(bob.last()));
        assertEquals(1, leases.rows.size());
        assertEquals(1, coordinator.occupancy("Home", "main"));
    }

    @Test
    void disconnectReleasesLeaseAndRebroadcasts() throws Exception {
        FakeSocket alice = join("s1", ALICE, "c1");
        clock.advance(Duration.ofSeconds(1));
        FakeSocket bob = join("s2", BOB, "c2");

        coordinator.onClose(alice);

        assertEquals(List.of("bob/c2"), editorNames(bob.last()));
        assertTrue(leases.rows.stream().noneMatch(s -> s.userId.equals("u1")));
    }

    @Test
    void lastDisconnectRemovesTheRoom() {
        FakeSocket alice = join("s1", ALICE, "c1");

        coordinator.onClose(alice);
        coordinator.onClose(alice);

        assertEquals(0, coordinator.roomCount());
        assertTrue(leases.rows.isEmpty());
    }

    @Test
    void socketsThatFailToReceiveAreDropped() {
        FakeSocket alice = join("s1", ALICE, "c1");
        clock.advance(Duration.ofSeconds(1));
        FakeSocket bob = join("s2", BOB, "c2");
        alice.broken = true;
        int bobBefore = bob.sent.size();

        coordinator.broadcastRoster("Home", "main");

        assertEquals(1, coordinator.occupancy("Home", "main"));
        assertEquals(bobBefore + 2, bob.sent.size());
    }

    @Test
    void droppedSocketGivesUpItsLeaseAndIsClosed() throws Exception {
        FakeSocket alice = join("s1", ALICE, "c1");
        clock.advance(Duration.ofSeconds(1));
        FakeSocket bob = join("s2", BOB, "c2");
        alice.broken = true;

        coordinator.broadcastRoster("Home", "main");

        assertEquals(PresenceCoordinator.CLOSE_UNAVAILABLE, alice.closeCode);
        assertEquals(List.of("bob/c2"), editorNames(bob.last()));
        assertEquals(List.of(new ServerMessage.Editor("bob", "c2")), presence.getRoster("Home", "main"));

        // the transport reports the disconnect afterwards
        coordinator.onClose(alice);

        assertEquals(1, leases.rows.size());
        assertEquals(1, coordinator.occupancy("Home", "main"));
        assertNull(bob.closeCode);
    }

    @Test
    void housekeepingSurfacesLeasesThatExpiredSilently() throws Exception {
        FakeSocket alice = join("s1", ALICE, "c1");
        clock.advance(Duration.ofSeconds(60));
        FakeSocket bob = join("s2", BOB, "c2");
        assertEquals(List.of("alice/c1", "bob/c2"), editorNames(bob.last()));
        clock.advance(Duration.ofSeconds(31));

        coordinator.runHousekeeping(new PresenceRoom.Key("Home", "main"));

        assertEquals(List.of("bob/c2"), editorNames(bob.last()));
        assertEquals(List.of("bob/c2"), editorNames(alice.last()));
    }

    @Test
    void housekeepingTickOnEmptyRoomDoesNothing() {
        FakeSocket alice = join("s1", ALICE, "c1");
        coordinator.onClose(alice);
        int sent = alice.sent.size();

        coordinator.runHousekeeping(new PresenceRoom.Key("Home", "main"));

        assertEquals(sent, alice.sent.size());
    }

    @Test
    void unreadableRosterSkipsTheBroadcast() {
        FakeSocket alice = join("s1", ALICE, "c1");
        int sent = alice.sent.size();
        leases.offline = true;

        coordinator.broadcastRoster("Home", "main");

        assertEquals(sent, alice.sent.size());
        assertEquals(1, coordinator.occupancy("Home", "main"));
    }

    @Test
    void malformedAndUnknownMessagesAreIgnored() {
        FakeSocket alice = join("s1", ALICE, "c1");
        int sent = alice.sent.size();

        coordinator.onMessage(alice, "not json");
        coordinator.onMessage(alice, "{\"type\":\"dance\"}");
        coordinator.onMessage(new FakeSocket("unknown"), "{\"type\":\"ping\"}");

        assertEquals(sent, alice.sent.size());
        assertNull(alice.closeCode);
    }
}
