// file: core/src/main/java/io/hslite/core/auth/AuthState.java
package io.hslite.core.auth;

import com.fasterxml.jackson.databind.JsonNode;
import io.hslite.core.Membership;
import io.hslite.core.RoomEvent;
import io.hslite.core.RoomVersion;
import io.hslite.core.StateKey;
import io.hslite.core.graph.EventLookup;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * The slice of room state an auth check may look at.
 * <p>
 * Backed either by concrete events or by a state map of ids resolved lazily
 * through an {@link EventLookup}, so checks only load the handful of events
 * they need (create, power levels, join rules, two memberships).
 */
public final class AuthState {
    private final Function<StateKey, RoomEvent> resolver;

    private AuthState(Function<StateKey, RoomEvent> resolver) {
        this.resolver = resolver;
    }

    public static AuthState empty() {
        return new AuthState(k -> null);
    }

    /** State made of the given events, keyed by their state key. Non-state events are ignored. */
    public static AuthState ofEvents(Collection<RoomEvent> events) {
        Map<StateKey, RoomEvent> m = new HashMap<>();
        for (RoomEvent e : events) {
            if (e.isState()) m.put(e.key(), e);
        }
        return new AuthState(m::get);
    }

    /** State map of ids; ids are resolved on demand. */
    public static AuthState ofIds(Map<StateKey, String> state, EventLookup lookup) {
        return new AuthState(k -> {
            String id = state.get(k);
            return id == null ? null : lookup.find(id);
        });
    }

    public RoomEvent get(StateKey key) {
        return resolver.apply(key);
    }

    public RoomEvent create() {
        return get(StateKey.create());
    }

    public Membership membership(String userId) {
        RoomEvent m = get(StateKey.member(userId));
        if (m == null) return null;
        return Membership.fromContent(m.content());
    }

    /** Join rule, defaulting to "invite" when the room has none. */
    public String joinRule() {
        RoomEvent jr = get(StateKey.joinRules());
        if (jr == null) return "invite";
        JsonNode v = jr.contentField("join_rule");
        return (v != null && v.isTextual()) ? v.asText() : "invite";
    }

    /**
     * Power levels in effect. A stored power-levels event that no longer parses
     * is treated as absent rather than failing every later check.
     */
    public PowerLevels powerLevels(RoomVersion version) {
        RoomEvent pl = get(StateKey.powerLevels());
        if (pl != null) {
            try {
                return PowerLevels.fromContent(pl.content());
            } catch (IllegalArgumentException ignoredMalformed) {
                // fall through to defaults
            }
        }
        RoomEvent create = create();
        return PowerLevels.absent(create == null ? null : version.creator(create));
    }
}
