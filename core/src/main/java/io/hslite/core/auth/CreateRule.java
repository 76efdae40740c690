// file: core/src/main/java/io/hslite/core/auth/CreateRule.java
package io.hslite.core.auth;

import com.fasterxml.jackson.databind.JsonNode;
import io.hslite.core.RoomEvent;
import io.hslite.core.RoomVersion;

import static io.hslite.core.auth.AuthDecision.allow;
import static io.hslite.core.auth.AuthDecision.reject;

/**
 * {@code m.room.create}: the unique root of a room.
 */
final class CreateRule implements AuthRule {

    @Override
    public AuthDecision check(RoomEvent event, AuthState state, RoomVersion version) {
        if (!event.prevEvents().isEmpty()) {
            return reject("create event must not have prev_events");
        }
        if (!event.authEvents().isEmpty()) {
            return reject("create event must not have auth_events");
        }
        if (!"".equals(event.stateKey())) {
            return reject("create event must have an empty state_key");
        }
        if (state.create() != null) {
            return reject("room already has a create event");
        }
        if (!RoomEvent.serverOf(event.sender()).equals(RoomEvent.serverOf(event.roomId()))) {
            return reject("create sender domain does not match room id domain");
        }
        JsonNode v = event.contentField("room_version");
        if (v != null) {
            if (!v.isTextual()) return reject("room_version must be a string");
            try {
                RoomVersion.fromId(v.asText());
            } catch (IllegalArgumentException e) {
                return reject(e.getMessage());
            }
        }
        return allow();
    }
}
