// file: server/src/test/java/io/hslite/server/sync/SyncSessionManagerTest.java
package io.hslite.server.sync;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hslite.core.EventTypes;
import io.hslite.server.Homeserver;
import io.hslite.server.RoomService;
import io.hslite.server.account.Requester;
import io.hslite.server.federation.NoFederation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static io.hslite.server.TestServers.await;
import static io.hslite.server.TestServers.open;
import static io.hslite.server.TestServers.privateRoom;
import static io.hslite.server.TestServers.text;
import static org.junit.jupiter.api.Assertions.*;

class SyncSessionManagerTest {

    @TempDir
    Path dir;

    private Homeserver hs;
    private RoomService rooms;
    private SyncSessionManager sync;
    private final Requester alice = new Requester("@alice:a.test", "ALICE1");
    private final Requester bob = new Requester("@bob:a.test", "BOB1");

    @BeforeEach
    void setUp() {
        hs = open(dir, "a.test", new NoFederation());
        rooms = hs.roomService();
        sync = hs.sync();
    }

    @AfterEach
    void tearDown() throws Exception {
        hs.close();
    }

    private SyncResponse syncNow(Requester who, String since) throws Exception {
        return await(sync.sync(new SyncRequest(who.userId(), who.deviceId(), since, 0, null)));
    }

    private static List<String> ids(List<ObjectNode> events) {
        List<String> out = new ArrayList<>();
        for (ObjectNode e : events) out.add(e.path("event_id").asText());
        return out;
    }

    /** Completion callbacks may still be running when the caller's get() returns. */
    private static boolean eventually(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) return false;
            Thread.sleep(10);
        }
        return true;
    }

    @Test
    void initial_sync_returns_state_and_recent_timeline_of_joined_rooms() throws Exception {
        String roomId = await(rooms.createRoom(alice, privateRoom()));
        String msg = await(rooms.sendMessage(alice, roomId, EventTypes.MESSAGE, "t1", text("hello")));

        SyncResponse r = syncNow(alice, null);

        assertTrue(r.nextBatch().startsWith("s_"));
        SyncResponse.JoinedRoom room = r.join().get(roomId);
        assertNotNull(room);
        List<String> timeline = ids(room.timeline());
        assertEquals(msg, timeline.get(timeline.size() - 1));
        assertFalse(room.limited());
        assertNotNull(room.prevBatch());
    }

    @Test
    void next_batch_round_trips_to_an_empty_delta_with_the_same_token() throws Exception {
        await(rooms.createRoom(alice, privateRoom()));
        SyncResponse first = syncNow(alice, null);

        SyncResponse second = syncNow(alice, first.nextBatch());

        assertTrue(second.isEmpty());
        assertEquals(first.nextBatch(), second.nextBatch());
        assertEquals(first.nextBatch(), SyncToken.decode(first.nextBatch()).encode());
    }

    @Test
    void idle_long_poll_times_out_with_an_unchanged_token() throws Exception {
        await(rooms.createRoom(alice, privateRoom()));
        String token = syncNow(alice, null).nextBatch();

        long start = System.nanoTime();
        SyncResponse r = sync.sync(new SyncRequest(alice.userId(), alice.deviceId(), token, 5000, null))
                .get(15, TimeUnit.SECONDS);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

        assertTrue(elapsedMs >= 4900, "returned after " + elapsedMs + "ms");
        assertTrue(r.isEmpty());
        assertTrue(r.join().isEmpty());
        assertEquals(token, r.nextBatch());
        assertTrue(eventually(() -> sync.waiting() == 0));
    }

    @Test
    void parked_sync_wakes_when_an_event_is_admitted() throws Exception {
        String roomId = await(rooms.createRoom(alice, privateRoom()));
        String token = syncNow(alice, null).nextBatch();

        long start = System.nanoTime();
        CompletableFuture<SyncResponse> pending =
                sync.sync(new SyncRequest(alice.userId(), alice.deviceId(), token, 30_000, null));
        assertFalse(pending.isDone());
        String msg = await(rooms.sendMessage(alice, roomId, EventTypes.MESSAGE, "t1", text("wake up")));

        SyncResponse r = pending.get(10, TimeUnit.SECONDS);
        assertTrue((System.nanoTime() - start) / 1_000_000L < 10_000);
        assertEquals(List.of(msg), ids(r.join().get(roomId).timeline()));
        assertNotEquals(token, r.nextBatch());
        long head = hs.store().currentPosition(roomId);
        assertTrue(eventually(() -> hs.store().cursor(alice.deviceId(), roomId) == head));
    }

    @Test
    void parked_sync_ignores_rooms_the_user_is_not_in_until_invited() throws Exception {
        String roomId = await(rooms.createRoom(alice, privateRoom()));
        String token = syncNow(bob, null).nextBatch();

        CompletableFuture<SyncResponse> pending =
                sync.sync(new SyncRequest(bob.userId(), bob.deviceId(), token, 30_000, null));
        long checks = sync.checksRun();
        await(rooms.sendMessage(alice, roomId, EventTypes.MESSAGE, "t1", text("not for bob")));
        await(rooms.sendMessage(alice, roomId, EventTypes.MESSAGE, "t2", text("still not")));
        Thread.sleep(200);

        assertFalse(pending.isDone());
        assertEquals(checks, sync.checksRun());

        await(rooms.membership(alice, roomId, RoomService.MembershipAction.INVITE, bob.userId(), null));
        SyncResponse r = pending.get(10, TimeUnit.SECONDS);
        assertTrue(r.invite().containsKey(roomId));
    }

    @Test
    void new_sync_from_the_same_device_supersedes_the_parked_one() throws Exception {
        await(rooms.createRoom(alice, privateRoom()));
        String token = syncNow(alice, null).nextBatch();

        CompletableFuture<SyncResponse> first =
                sync.sync(new SyncRequest(alice.userId(), alice.deviceId(), token, 30_000, null));
        CompletableFuture<SyncResponse> second =
                sync.sync(new SyncRequest(alice.userId(), alice.deviceId(), token, 30_000, null));

        assertTrue(first.isCancelled());
        assertFalse(second.isDone());
        assertEquals(1, sync.waiting());

        second.cancel(false);
        assertEquals(0, sync.waiting());
    }

    @Test
    void invites_and_leaves_are_reported_to_the_affected_user() throws Exception {
        String roomId = await(rooms.createRoom(alice, privateRoom()));
        String token = syncNow(bob, null).nextBatch();

        await(rooms.membership(alice, roomId, RoomService.MembershipAction.INVITE, bob.userId(), null));
        SyncResponse invited = syncNow(bob, token);
        assertTrue(invited.invite().containsKey(roomId));
        assertTrue(invited.join().isEmpty());

        await(rooms.membership(bob, roomId, RoomService.MembershipAction.JOIN, null, null));
        SyncResponse joined = syncNow(bob, invited.nextBatch());
        assertTrue(joined.join().containsKey(roomId));

        String kick = await(rooms.membership(alice, roomId, RoomService.MembershipAction.KICK, bob.userId(), "bye"));
        SyncResponse left = syncNow(bob, joined.nextBatch());
        List<String> timeline = ids(left.leave().get(roomId).timeline());
        assertEquals(kick, timeline.get(timeline.size() - 1));
        assertFalse(left.join().containsKey(roomId));
    }

    @Test
    void typing_shows_up_as_ephemeral_event() throws Exception {
        String roomId = await(rooms.createRoom(alice, privateRoom()));
        String token = syncNow(alice, null).nextBatch();

        rooms.typing(alice, roomId, alice.userId(), true, 30_000);
        SyncResponse r = syncNow(alice, token);

        List<ObjectNode> eph = r.join().get(roomId).ephemeral();
        assertEquals(EventTypes.TYPING, eph.get(0).path("type").asText());
        assertEquals(alice.userId(), eph.get(0).path("content").path("user_ids").get(0).asText());
    }

    @Test
    void timeline_filter_limits_events_and_marks_the_room_limited() throws Exception {
        String roomId = await(rooms.createRoom(alice, privateRoom()));
        for (int i = 0; i < 5; i++) {
            await(rooms.sendMessage(alice, roomId, EventTypes.MESSAGE, "t" + i, text("m" + i)));
        }
        SyncFilter filter = SyncFilter.parse("{\"room\":{\"timeline\":{\"limit\":2}}}");

        SyncResponse r = await(sync.sync(new SyncRequest(alice.userId(), alice.deviceId(), null, 0, filter)));

        SyncResponse.JoinedRoom room = r.join().get(roomId);
        assertEquals(2, room.timeline().size());
        assertTrue(room.limited());
    }

    @Test
    void invalid_token_is_rejected_before_waiting() {
        assertThrows(IllegalArgumentException.class,
                () -> sync.sync(new SyncRequest(alice.userId(), alice.deviceId(), "s_not-a-token", 1000, null)));
        assertEquals(0, sync.waiting());
    }
}
