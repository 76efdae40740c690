// file: core/src/main/java/io/hslite/core/graph/EventLookup.java
package io.hslite.core.graph;

import io.hslite.core.RoomEvent;

import java.util.Map;

/**
 * Resolves an event id to an event. The DAG is addressed only through this
 * lookup; events never hold references to each other.
 */
@FunctionalInterface
public interface EventLookup {

    /** @return the event, or null when it is not known locally */
    RoomEvent find(String eventId);

    /** Lookup over a fixed map; used by tests and by in-memory callers. */
    static EventLookup of(Map<String, RoomEvent> events) {
        return events::get;
    }
}
