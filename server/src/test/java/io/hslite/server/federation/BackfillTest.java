// file: server/src/test/java/io/hslite/server/federation/BackfillTest.java
package io.hslite.server.federation;

import io.hslite.core.EventTypes;
import io.hslite.core.RoomEvent;
import io.hslite.server.Homeserver;
import io.hslite.server.HomeserverConfig;
import io.hslite.server.account.Requester;
import io.hslite.server.room.AdmissionResult;
import io.hslite.server.timeline.Direction;
import io.hslite.server.timeline.TimelinePage;
import io.hslite.storage.StoredEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static io.hslite.server.TestServers.await;
import static io.hslite.server.TestServers.open;
import static io.hslite.server.TestServers.privateRoom;
import static io.hslite.server.TestServers.text;
import static org.junit.jupiter.api.Assertions.*;

class BackfillTest {

    @TempDir
    Path dir;

    private final Requester alice = new Requester("@alice:a.test", "ALICE1");
    private Homeserver origin;
    private Homeserver replica;

    /** Serves backfill from the origin server's store and counts requests. */
    private final class OriginExchange implements FederationExchange {
        final AtomicInteger requests = new AtomicInteger();
        volatile boolean available = true;

        @Override
        public void eventAdmitted(RoomEvent event) {
            // replica does not push
        }

        @Override
        public CompletableFuture<BackfillResponse> requestBackfill(String roomId, List<String> missingIds) {
            requests.incrementAndGet();
            if (!available) {
                return CompletableFuture.completedFuture(BackfillResponse.unavailable());
            }
            // the missing events and everything they reference, as a peer would answer
            Map<String, RoomEvent> found = new LinkedHashMap<>();
            Deque<String> todo = new ArrayDeque<>(missingIds);
            while (!todo.isEmpty()) {
                String id = todo.pop();
                if (found.containsKey(id)) continue;
                StoredEvent s = origin.store().get(id);
                if (s == null) continue;
                found.put(id, s.event());
                todo.addAll(s.event().prevEvents());
                todo.addAll(s.event().authEvents());
            }
            return CompletableFuture.completedFuture(BackfillResponse.of(new ArrayList<>(found.values())));
        }
    }

    @AfterEach
    void tearDown() throws Exception {
        if (origin != null) origin.close();
        if (replica != null) replica.close();
    }

    private OriginExchange start(RetryPolicy retry) {
        OriginExchange exchange = new OriginExchange();
        origin = open(dir, "a.test", new NoFederation());
        replica = open(dir, "b.test", HomeserverConfig.defaults().withBackfillRetry(retry), exchange);
        replica.keyRing().register(origin.serverName(), origin.signingKey().keyId(),
                origin.signingKey().encodedPublicKey());
        return exchange;
    }

    @Test
    void gap_triggers_backfill_and_resubmission_is_admitted() throws Exception {
        OriginExchange exchange = start(RetryPolicy.DEFAULT);
        String roomId = await(origin.roomService().createRoom(alice, privateRoom()));
        String msgId = await(origin.roomService().sendMessage(alice, roomId, EventTypes.MESSAGE, "t1", text("late")));
        RoomEvent msg = origin.store().find(msgId);

        AdmissionResult first = await(replica.roomService().submit(roomId, msg));

        var gap = assertInstanceOf(AdmissionResult.GraphGap.class, first);
        assertEquals(msg.prevEvents().get(0), gap.missing().get(0));
        assertNotNull(gap.backfill());
        assertTrue(await(gap.backfill()));
        assertEquals(1, exchange.requests.get());

        AdmissionResult second = await(replica.roomService().submit(roomId, msg));
        assertInstanceOf(AdmissionResult.Admitted.class, second);
        assertEquals(origin.rooms().existing(roomId).currentState(), replica.rooms().existing(roomId).currentState());
        assertTrue(replica.store().gaps(roomId).isEmpty());
    }

    @Test
    void receiver_backfills_and_retries_on_its_own() throws Exception {
        start(RetryPolicy.DEFAULT);
        String roomId = await(origin.roomService().createRoom(alice, privateRoom()));
        String msgId = await(origin.roomService().sendMessage(alice, roomId, EventTypes.MESSAGE, "t1", text("push")));

        AdmissionResult r = await(replica.receiver().receivePdu(roomId, origin.store().find(msgId)));

        assertInstanceOf(AdmissionResult.Admitted.class, r);
        assertEquals(Set.of(msgId), replica.rooms().existing(roomId).snapshot().extremities());
    }

    @Test
    void exhausted_retries_leave_a_durable_gap_marker() throws Exception {
        OriginExchange exchange = start(new RetryPolicy(3, Duration.ofMillis(10), 2.0));
        exchange.available = false;
        String roomId = await(origin.roomService().createRoom(alice, privateRoom()));
        String msgId = await(origin.roomService().sendMessage(alice, roomId, EventTypes.MESSAGE, "t1", text("lost")));
        RoomEvent msg = origin.store().find(msgId);

        AdmissionResult r = await(replica.receiver().receivePdu(roomId, msg));

        var gap = assertInstanceOf(AdmissionResult.GraphGap.class, r);
        assertFalse(await(gap.backfill()));
        assertEquals(3, exchange.requests.get());
        assertTrue(replica.store().gaps(roomId).containsAll(gap.missing()));
        assertNull(replica.store().get(msgId));
        TimelinePage page = replica.timeline().page(roomId, null, 10, Direction.BACKWARD);
        assertTrue(page.gaps().containsAll(gap.missing()));
    }
}
