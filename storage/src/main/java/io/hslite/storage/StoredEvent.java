// file: storage/src/main/java/io/hslite/storage/StoredEvent.java
package io.hslite.storage;

import io.hslite.core.RoomEvent;
import io.hslite.core.StateKey;

import java.util.Map;

/**
 * An event as kept by the store.
 *
 * @param event      the immutable event
 * @param streamPos  room-local stream position; -1 for rejected (soft-failed) events
 * @param rejection  why the event was rejected, or null when accepted
 * @param stateAfter room state after applying this event on top of its prev_events
 *                   (equal to the state before when rejected or not a state event)
 */
public record StoredEvent(RoomEvent event, long streamPos, String rejection, Map<StateKey, String> stateAfter) {

    public static final long NO_POSITION = -1;

    public boolean accepted() {
        return rejection == null;
    }

    public String eventId() {
        return event.eventId();
    }

    public String roomId() {
        return event.roomId();
    }
}
