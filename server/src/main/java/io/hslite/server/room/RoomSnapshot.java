// file: server/src/main/java/io/hslite/server/room/RoomSnapshot.java
package io.hslite.server.room;

import io.hslite.core.RoomEvent;
import io.hslite.core.RoomVersion;
import io.hslite.core.StateKey;
import io.hslite.storage.EventStore;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable view of a room published by its actor after every admission.
 * Readers take it without locking.
 *
 * @param version null until the room has a create event
 */
public record RoomSnapshot(String roomId, RoomVersion version, long streamPos,
                           Set<String> extremities, Map<StateKey, String> state) {

    public RoomSnapshot {
        extremities = Collections.unmodifiableSet(new TreeSet<>(extremities));
        state = Collections.unmodifiableMap(new TreeMap<>(state));
    }

    static RoomSnapshot load(String roomId, EventStore store) {
        Map<StateKey, String> state = store.currentState(roomId);
        return new RoomSnapshot(roomId, versionOf(state, store), store.currentPosition(roomId),
                store.getForwardExtremities(roomId), state);
    }

    static RoomVersion versionOf(Map<StateKey, String> state, EventStore store) {
        String createId = state.get(StateKey.create());
        RoomEvent create = createId == null ? null : store.find(createId);
        return create == null ? null : RoomVersion.of(create);
    }

    public boolean exists() {
        return state.containsKey(StateKey.create());
    }

    /** Version for algorithms that need one before the room is created. */
    RoomVersion versionOrDefault() {
        return version == null ? RoomVersion.DEFAULT : version;
    }
}
