// file: storage/src/main/java/io/hslite/storage/EventStore.java
package io.hslite.storage;

import io.hslite.core.RoomEvent;
import io.hslite.core.StateKey;
import io.hslite.core.graph.EventLookup;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Content-addressed, append-only store of room events.
 * <p>
 * Contract:
 *  - append() of an id already stored with identical content returns Duplicate;
 *    with different content it throws {@link EventConflictException};
 *  - stored events are never modified or removed;
 *  - accepted events get strictly increasing, gap-free stream positions per room
 *    starting at 1;
 *  - all writes for one room are expected to come from a single writer (the room's
 *    actor); reads may happen from any thread at any time.
 */
public interface EventStore extends EventLookup {

    /**
     * Store an accepted event.
     *
     * @param stateAfter room state after the event
     * @param head       frontier and current-state change resulting from the event
     */
    AppendOutcome append(RoomEvent event, Map<StateKey, String> stateAfter, RoomHead head);

    /**
     * Store a rejected (soft-failed) event for diagnosis. It gets no stream
     * position and does not change the room.
     */
    AppendOutcome appendRejected(RoomEvent event, String reason, Map<StateKey, String> stateBefore);

    /** @return the stored event, accepted or rejected, or null */
    StoredEvent get(String eventId);

    /** Accepted events only; rejected events are invisible to graph lookups. */
    @Override
    default RoomEvent find(String eventId) {
        StoredEvent s = get(eventId);
        return (s == null || !s.accepted()) ? null : s.event();
    }

    Set<String> rooms();

    boolean hasRoom(String roomId);

    Set<String> getForwardExtremities(String roomId);

    Map<StateKey, String> currentState(String roomId);

    /** Current state as it was right after the event at {@code streamPos}. */
    Map<StateKey, String> stateAt(String roomId, long streamPos);

    /**
     * Net change of the current state after {@code streamPos}: every key whose
     * value differs now, mapped to its current value (null when removed).
     */
    Map<StateKey, String> stateChangesSince(String roomId, long streamPos);

    /** Highest assigned stream position, 0 for an empty room. */
    long currentPosition(String roomId);

    /** Accepted events with position > {@code afterPos}, ascending, at most {@code limit}. */
    List<StoredEvent> eventsAfter(String roomId, long afterPos, int limit);

    /** Accepted events with position < {@code beforePos}, descending, at most {@code limit}. */
    List<StoredEvent> eventsBefore(String roomId, long beforePos, int limit);

    StoredEvent eventAt(String roomId, long streamPos);

    /** Ids of accepted redactions targeting {@code eventId}, in admission order. */
    List<String> redactionsOf(String eventId);

    /** Remember ids that backfill could not fetch. */
    void recordGap(String roomId, Collection<String> missingIds);

    /** Forget gap markers once the events arrived. */
    void clearGap(String roomId, Collection<String> ids);

    Set<String> gaps(String roomId);
}
