// file: core/src/main/java/io/hslite/core/auth/AuthRules.java
package io.hslite.core.auth;

import io.hslite.core.EventTypes;
import io.hslite.core.Membership;
import io.hslite.core.RoomEvent;
import io.hslite.core.RoomVersion;
import io.hslite.core.StateKey;
import io.hslite.core.graph.EventLookup;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.hslite.core.auth.AuthDecision.allow;
import static io.hslite.core.auth.AuthDecision.reject;

/**
 * Auth rule engine: a table of {@link AuthRule}s keyed by event type.
 * <p>
 * Types without an entry are rejected. Every check is a pure function of the
 * event and the supplied state, so the same inputs give the same decision on
 * every server and at every point in time.
 * <p>
 * Checks common to all non-create events run before dispatch:
 *  - the state must contain a create event for the same room,
 *  - for non-member events, the sender must be joined.
 */
public final class AuthRules {
    private final Map<String, AuthRule> rules;

    private AuthRules(Map<String, AuthRule> rules) {
        this.rules = Map.copyOf(rules);
    }

    /** Rules for the standard room event types. */
    public static AuthRules standard() {
        Map<String, AuthRule> table = new HashMap<>();
        table.put(EventTypes.CREATE, new CreateRule());
        table.put(EventTypes.MEMBER, new MembershipRule());
        table.put(EventTypes.POWER_LEVELS, new PowerLevelsRule());
        table.put(EventTypes.REDACTION, StandardRules.REDACTION);
        for (String type : List.of(
                EventTypes.JOIN_RULES, EventTypes.HISTORY_VISIBILITY, EventTypes.NAME, EventTypes.TOPIC,
                EventTypes.AVATAR, EventTypes.CANONICAL_ALIAS, EventTypes.GUEST_ACCESS,
                EventTypes.ENCRYPTION, EventTypes.PINNED_EVENTS, EventTypes.SERVER_ACL,
                EventTypes.MESSAGE, EventTypes.ENCRYPTED, EventTypes.REACTION, EventTypes.STICKER)) {
            table.put(type, StandardRules.STATE);
        }
        return new AuthRules(table);
    }

    /** Copy of this table with {@code rule} registered for {@code type}. */
    public AuthRules with(String type, AuthRule rule) {
        Map<String, AuthRule> copy = new HashMap<>(rules);
        copy.put(type, rule);
        return new AuthRules(copy);
    }

    public boolean knows(String type) {
        return rules.containsKey(type);
    }

    /**
     * Authorize {@code event} against {@code state}, the room state the event
     * is applied on top of.
     */
    public AuthDecision authorize(RoomEvent event, AuthState state) {
        if (EventTypes.CREATE.equals(event.type())) {
            return rules.get(EventTypes.CREATE).check(event, state, RoomVersion.DEFAULT);
        }
        RoomEvent create = state.create();
        if (create == null) {
            return reject("no create event in auth state");
        }
        if (!create.roomId().equals(event.roomId())) {
            return reject("create event belongs to " + create.roomId());
        }
        RoomVersion version;
        try {
            version = RoomVersion.of(create);
        } catch (IllegalArgumentException e) {
            return reject(e.getMessage());
        }
        AuthRule rule = rules.get(event.type());
        if (rule == null) {
            return reject("no auth rule for event type " + event.type());
        }
        if (!EventTypes.MEMBER.equals(event.type())
                && state.membership(event.sender()) != Membership.JOIN) {
            return reject(event.sender() + " is not joined to " + event.roomId());
        }
        return rule.check(event, state, version);
    }

    /**
     * Authorize {@code event} against the state formed by its own auth_events.
     * The auth events must be known to {@code lookup}, belong to the same room,
     * occupy only the keys the event type may reference, and not repeat a key.
     */
    public AuthDecision authorizeByAuthEvents(RoomEvent event, EventLookup lookup) {
        if (EventTypes.CREATE.equals(event.type())) {
            return authorize(event, AuthState.empty());
        }
        Set<StateKey> allowedKeys = AuthEvents.selectKeys(
                event.type(), event.sender(), event.stateKey(), event.content());
        Set<StateKey> seen = new HashSet<>();
        List<RoomEvent> authEvents = new ArrayList<>(event.authEvents().size());
        for (String id : event.authEvents()) {
            RoomEvent a = lookup.find(id);
            if (a == null) {
                return reject("auth event " + id + " is unknown");
            }
            if (!a.roomId().equals(event.roomId())) {
                return reject("auth event " + id + " belongs to another room");
            }
            if (!a.isState() || !allowedKeys.contains(a.key())) {
                return reject("auth event " + id + " is not a valid auth event for " + event.type());
            }
            if (!seen.add(a.key())) {
                return reject("auth events reference " + a.key() + " twice");
            }
            authEvents.add(a);
        }
        if (!seen.contains(StateKey.create())) {
            return reject("auth events do not include the create event");
        }
        return authorize(event, AuthState.ofEvents(authEvents));
    }
}
