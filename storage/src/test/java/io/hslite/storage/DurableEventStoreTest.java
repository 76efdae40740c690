// file: storage/src/test/java/io/hslite/storage/DurableEventStoreTest.java
package io.hslite.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hslite.core.EventBuilder;
import io.hslite.core.EventTypes;
import io.hslite.core.RoomEvent;
import io.hslite.core.StateKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static io.hslite.storage.StoreFixtures.ALICE;
import static io.hslite.storage.StoreFixtures.ROOM;
import static org.junit.jupiter.api.Assertions.*;

class DurableEventStoreTest {

    @TempDir Path dataDir;

    private DurableEventStore store;

    private DurableEventStore open(int snapshotEvery) {
        store = DurableEventStore.open(dataDir, snapshotEvery);
        return store;
    }

    private DurableEventStore reopen(int snapshotEvery) throws Exception {
        store.close();
        return open(snapshotEvery);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (store != null) store.close();
    }

    @Test
    void accepted_events_get_consecutive_positions_and_are_indexed() {
        var f = new StoreFixtures(open(1_000));
        var create = f.create();
        var m1 = f.message("one");
        var m2 = f.message("two");

        assertEquals(3, store.currentPosition(ROOM));
        assertEquals(create.eventId(), store.eventAt(ROOM, 1).eventId());
        assertEquals(List.of(m1.eventId(), m2.eventId()),
                store.eventsAfter(ROOM, 1, 10).stream().map(StoredEvent::eventId).collect(Collectors.toList()));
        assertEquals(List.of(m1.eventId(), create.eventId()),
                store.eventsBefore(ROOM, 3, 10).stream().map(StoredEvent::eventId).collect(Collectors.toList()));
        assertEquals(Set.of(m2.eventId()), store.getForwardExtremities(ROOM));
        assertEquals(create, store.find(create.eventId()));
    }

    @Test
    void duplicate_append_is_idempotent() {
        var f = new StoreFixtures(open(1_000));
        f.create();
        var msg = f.message("hi");

        var again = store.append(msg, Map.of(), new RoomHead(Set.of("$elsewhere"), Map.of()));
        assertInstanceOf(AppendOutcome.Duplicate.class, again);
        assertEquals(2, ((AppendOutcome.Duplicate) again).existing().streamPos());
        assertEquals(2, store.currentPosition(ROOM));
        assertEquals(Set.of(msg.eventId()), store.getForwardExtremities(ROOM));
    }

    @Test
    void serialized_copy_or_extra_signature_is_a_duplicate_not_a_conflict() {
        var f = new StoreFixtures(open(1_000));
        f.create();
        var msg = f.message("hi");

        var parsed = RoomEvent.fromBytes(store.get(msg.eventId()).event().toCanonicalBytes());
        var head = new RoomHead(Set.of(msg.eventId()), Map.of());
        assertInstanceOf(AppendOutcome.Duplicate.class, store.append(parsed, Map.of(), head));

        ObjectNode resigned = msg.toJson();
        resigned.putObject("signatures").putObject("b.test").put("ed25519:k", "c2ln");
        assertInstanceOf(AppendOutcome.Duplicate.class, store.append(RoomEvent.fromJson(resigned), Map.of(), head));
        assertEquals(2, store.currentPosition(ROOM));
    }

    @Test
    void same_id_with_different_content_is_a_hard_error() {
        var f = new StoreFixtures(open(1_000));
        f.create();
        var msg = f.message("original");

        ObjectNode forged = msg.toJson();
        ((ObjectNode) forged.get("content")).put("body", "forged");
        var impostor = RoomEvent.fromJson(forged);
        assertEquals(msg.eventId(), impostor.eventId());

        var ex = assertThrows(EventConflictException.class,
                () -> store.append(impostor, Map.of(), new RoomHead(Set.of(), Map.of())));
        assertEquals(msg.eventId(), ex.eventId());
    }

    @Test
    void rejected_events_are_kept_but_invisible_to_the_room() {
        var f = new StoreFixtures(open(1_000));
        f.create();
        var bad = f.next(EventBuilder.event(ROOM, "@mallory:b.test", EventTypes.MESSAGE).content("body", "spam"));

        var out = store.appendRejected(bad, "not joined", f.state);
        assertEquals(new AppendOutcome.Rejected("not joined"), out);

        StoredEvent stored = store.get(bad.eventId());
        assertFalse(stored.accepted());
        assertEquals(StoredEvent.NO_POSITION, stored.streamPos());
        assertNull(store.find(bad.eventId()));
        assertEquals(1, store.currentPosition(ROOM));
        assertFalse(store.getForwardExtremities(ROOM).contains(bad.eventId()));
    }

    @Test
    void state_at_and_changes_since_follow_current_state_deltas() {
        var f = new StoreFixtures(open(1_000));
        var create = f.create();
        var t1 = f.topic("first");
        f.message("chat");
        var t2 = f.topic("second");
        StateKey topic = StateKey.of(EventTypes.TOPIC, "");

        assertNull(store.stateAt(ROOM, 1).get(topic));
        assertEquals(create.eventId(), store.stateAt(ROOM, 1).get(StateKey.create()));
        assertEquals(t1.eventId(), store.stateAt(ROOM, 3).get(topic));
        assertEquals(t2.eventId(), store.currentState(ROOM).get(topic));

        assertEquals(Map.of(topic, t2.eventId()), store.stateChangesSince(ROOM, 2));
        assertTrue(store.stateChangesSince(ROOM, 4).isEmpty());
        assertEquals(t1.eventId(), store.get(t1.eventId()).stateAfter().get(topic));
    }

    @Test
    void redactions_are_indexed_by_target() {
        var f = new StoreFixtures(open(1_000));
        f.create();
        var msg = f.message("oops");
        var redaction = f.next(EventBuilder.event(ROOM, ALICE, EventTypes.REDACTION).redacts(msg.eventId()));
        f.add(redaction);

        assertEquals(List.of(redaction.eventId()), store.redactionsOf(msg.eventId()));
    }

    @Test
    void cursors_only_move_forward_and_survive_restart() throws Exception {
        open(1_000);
        store.advanceCursor("DEV", ROOM, 5);
        store.advanceCursor("DEV", ROOM, 3);
        assertEquals(5, store.cursor("DEV", ROOM));
        assertEquals(0, store.cursor("OTHER", ROOM));

        reopen(1_000);
        assertEquals(Map.of(ROOM, 5L), store.cursors("DEV"));
    }

    @Test
    void gap_markers_are_durable_and_clearable() throws Exception {
        open(1_000);
        store.recordGap(ROOM, List.of("$missing1", "$missing2"));
        reopen(1_000);
        assertEquals(Set.of("$missing1", "$missing2"), store.gaps(ROOM));

        store.clearGap(ROOM, List.of("$missing1"));
        reopen(1_000);
        assertEquals(Set.of("$missing2"), store.gaps(ROOM));
    }

    @Test
    void recovery_from_wal_restores_events_positions_and_state() throws Exception {
        var f = new StoreFixtures(open(1_000));
        f.create();
        var topic = f.topic("persisted");
        var msg = f.message("hello");

        reopen(1_000);
        assertEquals(3, store.currentPosition(ROOM));
        assertEquals(msg, store.find(msg.eventId()));
        assertEquals(topic.eventId(), store.currentState(ROOM).get(StateKey.of(EventTypes.TOPIC, "")));
        assertEquals(Set.of(msg.eventId()), store.getForwardExtremities(ROOM));
        assertEquals(topic.eventId(), store.get(msg.eventId()).stateAfter().get(StateKey.of(EventTypes.TOPIC, "")));
    }

    @Test
    void recovery_from_snapshot_plus_wal_tail() throws Exception {
        var f = new StoreFixtures(open(3));     // snapshot after every third write
        f.create();
        f.topic("a");
        f.message("m1");                         // snapshot here
        var last = f.message("m2");              // only in the WAL
        store.advanceCursor("DEV", ROOM, 2);

        try (var files = Files.list(dataDir.resolve("snapshots"))) {
            assertEquals(1, files.filter(p -> p.toString().endsWith(".bin")).count());
        }

        reopen(1_000);
        assertEquals(4, store.currentPosition(ROOM));
        assertEquals(Set.of(last.eventId()), store.getForwardExtremities(ROOM));
        assertEquals(2, store.cursor("DEV", ROOM));

        // continue writing after recovery
        var f2 = new StoreFixtures(store);
        f2.head = last.eventId();
        f2.depth = last.depth();
        f2.state = Map.copyOf(store.currentState(ROOM));
        f2.ts = 10_000;
        var after = f2.message("m3");
        assertEquals(5, store.get(after.eventId()).streamPos());
    }

    @Test
    void replaying_the_same_record_twice_applies_it_once() throws Exception {
        var f = new StoreFixtures(open(1_000));
        var create = f.create();
        store.close();

        // append the create record a second time, as a retried write would
        var wal = new FileWal(dataDir.resolve("wal"), 1L << 60);
        wal.append(RecordCodec.encode(new LogRecord.Admission(create, 1, null, null,
                Map.of(StateKey.create(), create.eventId()), List.of(create.eventId()), Map.of())));
        wal.close();

        open(1_000);
        assertEquals(1, store.currentPosition(ROOM));
        assertEquals(1, store.eventsAfter(ROOM, 0, 10).size());
    }
}
