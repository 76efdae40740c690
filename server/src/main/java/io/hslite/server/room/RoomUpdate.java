// file: server/src/main/java/io/hslite/server/room/RoomUpdate.java
package io.hslite.server.room;

import io.hslite.core.RoomEvent;
import io.hslite.core.StateKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One admitted event as seen by room subscribers.
 *
 * @param stateDelta change of the room's current state; a null value means the key was removed
 */
public record RoomUpdate(String roomId, long streamPos, RoomEvent event, Map<StateKey, String> stateDelta) {

    public RoomUpdate {
        stateDelta = Collections.unmodifiableMap(new LinkedHashMap<>(stateDelta));
    }
}
