// file: storage/src/main/java/io/hslite/storage/LogRecord.java
package io.hslite.storage;

import io.hslite.core.RoomEvent;
import io.hslite.core.StateKey;

import java.util.List;
import java.util.Map;

/**
 * Decoded durable records. The WAL holds one per mutation; a snapshot holds
 * the compacted sequence that rebuilds the same store.
 */
public sealed interface LogRecord
        permits LogRecord.Admission, LogRecord.Cursor, LogRecord.Gap, LogRecord.Heads {

    /**
     * One admitted or rejected event.
     *
     * @param stateBase     id of the event whose state-after this record's state is relative to, or null
     * @param stateDelta    differences from the base state; a null value removes the key
     * @param extremities   frontier after the event, or null when unchanged
     * @param currentDelta  change of the current state; a null value removes the key
     */
    record Admission(RoomEvent event, long streamPos, String rejection,
                     String stateBase, Map<StateKey, String> stateDelta,
                     List<String> extremities, Map<StateKey, String> currentDelta) implements LogRecord {}

    record Cursor(String deviceId, String roomId, long streamPos) implements LogRecord {}

    /** Gap markers opened ({@code open}) or closed for a room. */
    record Gap(String roomId, List<String> eventIds, boolean open) implements LogRecord {}

    /** Frontier of a room, written at the end of a snapshot. */
    record Heads(String roomId, List<String> extremities) implements LogRecord {}
}
