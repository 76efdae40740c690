// file: storage/src/main/java/io/hslite/storage/RoomHead.java
package io.hslite.storage;

import io.hslite.core.StateKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Room frontier after an accepted admission.
 *
 * @param extremities       forward extremities after the event
 * @param currentStateDelta changes to the room's current state; a null value removes the key
 */
public record RoomHead(Set<String> extremities, Map<StateKey, String> currentStateDelta) {

    public RoomHead {
        extremities = Set.copyOf(Objects.requireNonNull(extremities, "extremities"));
        // values may be null, so no Map.copyOf
        currentStateDelta = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(currentStateDelta, "currentStateDelta")));
    }
}
