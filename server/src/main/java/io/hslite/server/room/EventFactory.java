// file: server/src/main/java/io/hslite/server/room/EventFactory.java
package io.hslite.server.room;

import io.hslite.core.EventBuilder;
import io.hslite.core.EventTypes;
import io.hslite.core.RoomEvent;
import io.hslite.core.RoomVersion;
import io.hslite.core.StateKey;
import io.hslite.core.auth.AuthEvents;
import io.hslite.core.signing.ServerSigningKey;
import io.hslite.storage.EventStore;
import io.hslite.storage.StoredEvent;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a local {@link EventDraft} into a complete signed event on top of a
 * room snapshot: prev_events from the frontier, auth_events from the current
 * state, depth, timestamp, hashes, signature and id.
 */
public final class EventFactory {
    static final int MAX_PREV_EVENTS = 20;

    private final EventStore store;
    private final ServerSigningKey signingKey;
    private final Clock clock;

    public EventFactory(EventStore store, ServerSigningKey signingKey, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.signingKey = Objects.requireNonNull(signingKey, "signingKey");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RoomEvent build(EventDraft draft, RoomSnapshot room) {
        EventBuilder b = draft.stateKey() == null
                ? EventBuilder.event(room.roomId(), draft.sender(), draft.type())
                : EventBuilder.state(room.roomId(), draft.sender(), draft.type(), draft.stateKey());
        var content = draft.content();
        if (draft.redacts() != null) {
            b.redacts(draft.redacts());
            if (room.version() == RoomVersion.V11) {
                content.put("redacts", draft.redacts());
            }
        }
        b.content(content);

        if (EventTypes.CREATE.equals(draft.type())) {
            return b.depth(1).originServerTs(clock.millis()).build(signingKey);
        }

        List<String> prev = new ArrayList<>(room.extremities());
        if (prev.size() > MAX_PREV_EVENTS) {
            prev = prev.subList(prev.size() - MAX_PREV_EVENTS, prev.size());
        }
        long depth = 0;
        for (String p : prev) {
            StoredEvent s = store.get(p);
            if (s == null) {
                throw new IllegalStateException("frontier event " + p + " is not stored");
            }
            depth = Math.max(depth, s.event().depth());
        }

        List<String> auth = new ArrayList<>();
        for (StateKey k : AuthEvents.selectKeys(draft.type(), draft.sender(), draft.stateKey(), content)) {
            String id = room.state().get(k);
            if (id != null) auth.add(id);
        }
        auth.sort(null);

        return b.prevEvents(prev)
                .authEvents(auth)
                .depth(depth + 1)
                .originServerTs(clock.millis())
                .build(signingKey);
    }
}
