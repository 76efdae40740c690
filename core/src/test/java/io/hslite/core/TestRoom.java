package io.hslite.core;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hslite.core.auth.AuthEvents;
import io.hslite.core.graph.EventLookup;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a linear room history in memory for auth and resolution tests.
 * Every built event gets prev_events = current head, auth_events selected
 * from the tracked state, and the right depth.
 */
public final class TestRoom {
    public final String roomId;
    public final Map<String, RoomEvent> events = new HashMap<>();
    public Map<StateKey, String> state = new HashMap<>();
    public List<String> head = List.of();
    private long depth = 0;
    private long ts = 1_000;

    public TestRoom(String roomId) {
        this.roomId = roomId;
    }

    public EventLookup lookup() {
        return events::get;
    }

    public static ObjectNode json() {
        return JsonNodeFactory.instance.objectNode();
    }

    public RoomEvent create(String creator) {
        return append(draft(EventBuilder.state(roomId, creator, EventTypes.CREATE, "")
                .content(json().put("creator", creator).put("room_version", "10"))));
    }

    public RoomEvent member(String sender, String target, String membership) {
        return append(memberDraft(sender, target, membership));
    }

    public RoomEvent memberDraft(String sender, String target, String membership) {
        return draft(EventBuilder.state(roomId, sender, EventTypes.MEMBER, target)
                .content("membership", membership));
    }

    public RoomEvent state(String sender, String type, String key, ObjectNode content) {
        return append(draft(EventBuilder.state(roomId, sender, type, key).content(content)));
    }

    public RoomEvent powerLevels(String sender, Map<String, Integer> users) {
        return append(powerLevelsDraft(sender, users, state, head, depth + 1));
    }

    public RoomEvent message(String sender, String body) {
        return append(draft(EventBuilder.event(roomId, sender, EventTypes.MESSAGE)
                .content(json().put("msgtype", "m.text").put("body", body))));
    }

    /** Event on top of the current head and state, not yet appended. */
    public RoomEvent draft(EventBuilder b) {
        return fill(b, state, head, depth + 1);
    }

    /** Power-levels event built on an explicit state and parents, for forked histories. */
    public RoomEvent powerLevelsDraft(String sender, Map<String, Integer> users,
                                      Map<StateKey, String> atState, List<String> prev, long atDepth) {
        ObjectNode content = json();
        ObjectNode u = content.putObject("users");
        users.forEach(u::put);
        return fill(EventBuilder.state(roomId, sender, EventTypes.POWER_LEVELS, "").content(content),
                atState, prev, atDepth);
    }

    public RoomEvent fill(EventBuilder b, Map<StateKey, String> atState, List<String> prev, long atDepth) {
        RoomEvent probe = b.build();
        List<String> auth = new ArrayList<>();
        for (StateKey k : AuthEvents.selectKeys(probe.type(), probe.sender(), probe.stateKey(), probe.content())) {
            String id = atState.get(k);
            if (id != null) auth.add(id);
        }
        return b.prevEvents(prev).authEvents(auth).depth(atDepth).originServerTs(ts++).build();
    }

    /** Record an event as the new head, applying it to the state. */
    public RoomEvent append(RoomEvent e) {
        events.put(e.eventId(), e);
        head = List.of(e.eventId());
        depth = e.depth();
        if (e.isState()) {
            state = new HashMap<>(state);
            state.put(e.key(), e.eventId());
        }
        return e;
    }

    /** Remember an event without moving the head. */
    public RoomEvent remember(RoomEvent e) {
        events.put(e.eventId(), e);
        return e;
    }

    public long depth() {
        return depth;
    }
}
