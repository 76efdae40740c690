// file: core/src/main/java/io/hslite/core/auth/AuthEvents.java
package io.hslite.core.auth;

import com.fasterxml.jackson.databind.JsonNode;
import io.hslite.core.EventTypes;
import io.hslite.core.Membership;
import io.hslite.core.StateKey;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Which state entries an event's auth_events may (and should) reference.
 */
public final class AuthEvents {

    private AuthEvents() {
    }

    /**
     * Keys whose current values belong in the auth_events of a new event:
     * create, power levels, the sender's membership, and for member events the
     * target's membership plus join rules when joining, inviting or knocking.
     */
    public static Set<StateKey> selectKeys(String type, String sender, String stateKey, JsonNode content) {
        Set<StateKey> keys = new LinkedHashSet<>();
        if (EventTypes.CREATE.equals(type)) {
            return keys;
        }
        keys.add(StateKey.create());
        keys.add(StateKey.powerLevels());
        keys.add(StateKey.member(sender));
        if (EventTypes.MEMBER.equals(type) && stateKey != null) {
            keys.add(StateKey.member(stateKey));
            Membership m = Membership.fromContent(content);
            if (m == Membership.JOIN || m == Membership.INVITE || m == Membership.KNOCK) {
                keys.add(StateKey.joinRules());
            }
        }
        return keys;
    }
}
