// file: server/src/main/java/io/hslite/server/sync/SyncResponse.java
package io.hslite.server.sync;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One sync result. Rooms without anything new are left out of incremental
 * responses, so an empty response means "nothing happened".
 */
public record SyncResponse(String nextBatch,
                           Map<String, JoinedRoom> join,
                           Map<String, LeftRoom> leave,
                           Map<String, InvitedRoom> invite) {

    public SyncResponse {
        join = Collections.unmodifiableMap(new TreeMap<>(join));
        leave = Collections.unmodifiableMap(new TreeMap<>(leave));
        invite = Collections.unmodifiableMap(new TreeMap<>(invite));
    }

    public static SyncResponse empty(String nextBatch) {
        return new SyncResponse(nextBatch, Map.of(), Map.of(), Map.of());
    }

    public boolean isEmpty() {
        return join.isEmpty() && leave.isEmpty() && invite.isEmpty();
    }

    public record JoinedRoom(List<ObjectNode> timeline, boolean limited, String prevBatch,
                             List<ObjectNode> state, List<ObjectNode> ephemeral) {
        public JoinedRoom {
            timeline = List.copyOf(timeline);
            state = List.copyOf(state);
            ephemeral = List.copyOf(ephemeral);
        }

        public boolean isEmpty() {
            return timeline.isEmpty() && state.isEmpty() && ephemeral.isEmpty();
        }
    }

    /** History up to and including the event that took the user out of the room. */
    public record LeftRoom(List<ObjectNode> timeline, List<ObjectNode> state) {
        public LeftRoom {
            timeline = List.copyOf(timeline);
            state = List.copyOf(state);
        }
    }

    /** Stripped state the invitee may see before joining. */
    public record InvitedRoom(List<ObjectNode> inviteState) {
        public InvitedRoom {
            inviteState = List.copyOf(inviteState);
        }
    }

    /** Client-server API shape. */
    public ObjectNode toJson() {
        JsonNodeFactory f = JsonNodeFactory.instance;
        ObjectNode out = f.objectNode();
        out.put("next_batch", nextBatch);
        ObjectNode rooms = out.putObject("rooms");

        ObjectNode j = rooms.putObject("join");
        join.forEach((id, r) -> {
            ObjectNode room = j.putObject(id);
            ObjectNode tl = room.putObject("timeline");
            events(tl, r.timeline());
            tl.put("limited", r.limited());
            if (r.prevBatch() != null) tl.put("prev_batch", r.prevBatch());
            events(room.putObject("state"), r.state());
            events(room.putObject("ephemeral"), r.ephemeral());
        });

        ObjectNode l = rooms.putObject("leave");
        leave.forEach((id, r) -> {
            ObjectNode room = l.putObject(id);
            events(room.putObject("timeline"), r.timeline());
            events(room.putObject("state"), r.state());
        });

        ObjectNode i = rooms.putObject("invite");
        invite.forEach((id, r) -> events(i.putObject(id).putObject("invite_state"), r.inviteState()));
        return out;
    }

    private static void events(ObjectNode parent, List<ObjectNode> events) {
        ArrayNode arr = parent.putArray("events");
        events.forEach(arr::add);
    }
}
