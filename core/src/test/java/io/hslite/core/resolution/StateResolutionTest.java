// file: core/src/test/java/io/hslite/core/resolution/StateResolutionTest.java
package io.hslite.core.resolution;

import io.hslite.core.EventBuilder;
import io.hslite.core.EventTypes;
import io.hslite.core.RoomEvent;
import io.hslite.core.RoomVersion;
import io.hslite.core.StateKey;
import io.hslite.core.TestRoom;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StateResolutionTest {
    private static final String ALICE = "@alice:a.test";
    private static final String BOB = "@bob:b.test";

    private final StateResolver resolver = new StateResolutionV2();
    private TestRoom room;

    @BeforeEach
    void setUp() {
        room = new TestRoom("!room:a.test");
        room.create(ALICE);
        room.member(ALICE, ALICE, "join");
        room.powerLevels(ALICE, Map.of(ALICE, 100, BOB, 50));
        room.state(ALICE, EventTypes.JOIN_RULES, "", TestRoom.json().put("join_rule", "public"));
        room.member(BOB, BOB, "join");
    }

    private Map<StateKey, String> with(RoomEvent e) {
        Map<StateKey, String> s = new HashMap<>(room.state);
        s.put(e.key(), e.eventId());
        return s;
    }

    /** Two power-level changes forked from the same head. */
    private RoomEvent[] concurrentPowerChanges() {
        // alice demotes bob; bob concurrently hands out power
        var byAlice = room.remember(room.powerLevelsDraft(ALICE, Map.of(ALICE, 100, BOB, 0),
                room.state, room.head, room.depth() + 1));
        var byBob = room.remember(room.powerLevelsDraft(BOB, Map.of(ALICE, 100, BOB, 50, "@carol:b.test", 40),
                room.state, room.head, room.depth() + 1));
        return new RoomEvent[]{byAlice, byBob};
    }

    @Test
    void identical_states_resolve_to_themselves() {
        var out = resolver.resolve(RoomVersion.V10, List.of(room.state, room.state), room.lookup());
        assertEquals(room.state, out);
    }

    @Test
    void higher_power_sender_wins_power_level_conflict() {
        var pl = concurrentPowerChanges();
        var out = resolver.resolve(RoomVersion.V10, List.of(with(pl[0]), with(pl[1])), room.lookup());

        assertEquals(pl[0].eventId(), out.get(StateKey.powerLevels()));
        // everything else carried through
        assertEquals(room.state.get(StateKey.member(BOB)), out.get(StateKey.member(BOB)));
        assertEquals(room.state.get(StateKey.create()), out.get(StateKey.create()));
    }

    @Test
    void resolution_is_independent_of_input_order_and_replica() {
        var pl = concurrentPowerChanges();
        var forward = resolver.resolve(RoomVersion.V10, List.of(with(pl[0]), with(pl[1])), room.lookup());
        var backward = resolver.resolve(RoomVersion.V10, List.of(with(pl[1]), with(pl[0])), room.lookup());

        // a second replica holding copies of the same events
        Map<String, RoomEvent> replicaEvents = new HashMap<>();
        room.events.forEach((id, e) -> replicaEvents.put(id, RoomEvent.fromJson(e.toJson())));
        var replica = new StateResolutionV2().resolve(RoomVersion.V10,
                List.of(with(pl[1]), room.state, with(pl[0])), replicaEvents::get);

        assertEquals(forward, backward);
        assertEquals(forward, replica);
    }

    @Test
    void concurrent_topics_are_ordered_by_mainline_then_timestamp() {
        var first = room.remember(room.draft(EventBuilder.state(room.roomId, ALICE, EventTypes.TOPIC, "")
                .content("topic", "first")));
        var second = room.remember(room.draft(EventBuilder.state(room.roomId, BOB, EventTypes.TOPIC, "")
                .content("topic", "second")));
        assertTrue(first.originServerTs() < second.originServerTs());

        var out = resolver.resolve(RoomVersion.V10, List.of(with(second), with(first)), room.lookup());
        assertEquals(second.eventId(), out.get(StateKey.of(EventTypes.TOPIC, "")));
    }

    @Test
    void key_present_in_one_branch_only_is_kept_when_it_passes_auth() {
        var name = room.remember(room.draft(EventBuilder.state(room.roomId, ALICE, EventTypes.NAME, "")
                .content("name", "Lobby")));
        var out = resolver.resolve(RoomVersion.V10, List.of(room.state, with(name)), room.lookup());
        assertEquals(name.eventId(), out.get(StateKey.of(EventTypes.NAME, "")));
    }

    @Test
    void conflicting_event_failing_auth_loses() {
        // carol was never in the room; her topic cannot pass auth
        var stray = room.remember(EventBuilder.state(room.roomId, "@carol:b.test", EventTypes.TOPIC, "")
                .content("topic", "spam")
                .prevEvents(room.head)
                .authEvents(List.of(room.state.get(StateKey.create()), room.state.get(StateKey.powerLevels())))
                .depth(room.depth() + 1)
                .build());
        var out = resolver.resolve(RoomVersion.V10, List.of(room.state, with(stray)), room.lookup());
        assertNull(out.get(StateKey.of(EventTypes.TOPIC, "")));
    }

    @Test
    void missing_event_is_a_resolution_failure() {
        var pl = concurrentPowerChanges();
        var partial = new HashMap<>(room.events);
        partial.remove(pl[1].eventId());
        assertThrows(ResolutionFailureException.class, () -> resolver.resolve(RoomVersion.V10,
                List.of(with(pl[0]), with(pl[1])), partial::get));
    }
}
