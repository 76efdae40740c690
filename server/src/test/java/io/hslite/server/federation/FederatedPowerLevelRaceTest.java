// file: server/src/test/java/io/hslite/server/federation/FederatedPowerLevelRaceTest.java
package io.hslite.server.federation;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hslite.core.EventTypes;
import io.hslite.core.StateKey;
import io.hslite.server.Homeserver;
import io.hslite.server.RoomService;
import io.hslite.server.account.Requester;
import io.hslite.server.room.RoomSnapshot;
import io.hslite.storage.StoredEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static io.hslite.server.TestServers.await;
import static io.hslite.server.TestServers.open;
import static io.hslite.server.TestServers.privateRoom;
import static io.hslite.server.TestServers.text;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Two homeservers in one room, connected through {@link LoopbackFederation}.
 */
class FederatedPowerLevelRaceTest {

    @TempDir
    Path dir;

    private final LoopbackFederation hub = new LoopbackFederation();
    private Homeserver a;
    private Homeserver b;
    private final Requester alice = new Requester("@alice:a.test", "ALICE1");
    private final Requester bob = new Requester("@bob:b.test", "BOB1");

    @BeforeEach
    void setUp() {
        a = open(dir, "a.test", hub.exchangeFor("a.test"));
        b = open(dir, "b.test", hub.exchangeFor("b.test"));
        hub.register(a);
        hub.register(b);
    }

    @AfterEach
    void tearDown() throws Exception {
        a.close();
        b.close();
    }

    @Test
    void local_events_replicate_to_the_peer() throws Exception {
        String roomId = await(a.roomService().createRoom(alice, privateRoom(bob.userId())));
        String msg = await(a.roomService().sendMessage(alice, roomId, EventTypes.MESSAGE, "t1", text("hi b")));
        hub.awaitDeliveries(10_000);

        StoredEvent replica = b.store().get(msg);
        assertNotNull(replica);
        assertTrue(replica.accepted());
        assertEquals(a.rooms().existing(roomId).currentState(), b.rooms().existing(roomId).currentState());
    }

    @Test
    void concurrent_power_level_changes_resolve_to_the_higher_sender_on_both_servers() throws Exception {
        String roomId = await(a.roomService().createRoom(alice, privateRoom(bob.userId())));
        hub.awaitDeliveries(10_000);
        await(a.roomService().sendState(alice, roomId, EventTypes.POWER_LEVELS, "", powerLevels(50, 0)));
        hub.awaitDeliveries(10_000);
        await(b.roomService().membership(bob, roomId, RoomService.MembershipAction.JOIN, null, null));
        hub.awaitDeliveries(10_000);
        assertEquals(a.rooms().existing(roomId).snapshot().extremities(),
                b.rooms().existing(roomId).snapshot().extremities());

        // both servers change power levels on top of the same extremity
        hub.hold();
        CompletableFuture<String> demote = a.roomService()
                .sendState(alice, roomId, EventTypes.POWER_LEVELS, "", powerLevels(0, 0));
        CompletableFuture<String> restrict = b.roomService()
                .sendState(bob, roomId, EventTypes.POWER_LEVELS, "", powerLevels(50, 10));
        String aliceId = await(demote);
        String bobId = await(restrict);
        hub.release();
        hub.awaitDeliveries(10_000);

        for (Homeserver hs : new Homeserver[]{a, b}) {
            RoomSnapshot snap = hs.rooms().existing(roomId).snapshot();
            assertTrue(hs.store().get(aliceId).accepted(), hs.serverName());
            assertTrue(hs.store().get(bobId).accepted(), hs.serverName());
            assertEquals(Set.of(aliceId, bobId), snap.extremities(), hs.serverName());
            assertEquals(aliceId, snap.state().get(StateKey.powerLevels()), hs.serverName());
        }
        assertEquals(a.rooms().existing(roomId).currentState(), b.rooms().existing(roomId).currentState());
    }

    private ObjectNode powerLevels(int bobLevel, int eventsDefault) {
        ObjectNode pl = JsonNodeFactory.instance.objectNode();
        pl.putObject("users").put(alice.userId(), 100).put(bob.userId(), bobLevel);
        pl.put("users_default", 0).put("events_default", eventsDefault).put("state_default", 50)
                .put("ban", 50).put("kick", 50).put("redact", 50).put("invite", 0);
        pl.putObject("events");
        return pl;
    }
}
