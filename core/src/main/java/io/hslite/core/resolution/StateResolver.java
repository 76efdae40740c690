// file: core/src/main/java/io/hslite/core/resolution/StateResolver.java
package io.hslite.core.resolution;

import io.hslite.core.RoomVersion;
import io.hslite.core.StateKey;
import io.hslite.core.graph.EventLookup;

import java.util.Collection;
import java.util.Map;

/**
 * Merges the room states of several forward extremities into one.
 * <p>
 * Implementations must be deterministic: the output depends only on the set
 * of input states, never on their order or on which server runs it.
 */
public interface StateResolver {

    /**
     * @param version   room version of the room
     * @param stateSets states to merge, each (type, state_key) to event id
     * @param lookup    id to event; must know every event in the sets and their auth chains
     * @return merged state
     * @throws ResolutionFailureException if an event is missing or the auth graph is inconsistent
     */
    Map<StateKey, String> resolve(RoomVersion version,
                                  Collection<Map<StateKey, String>> stateSets,
                                  EventLookup lookup);
}
