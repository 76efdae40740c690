// file: core/src/main/java/io/hslite/core/auth/PowerLevelsRule.java
package io.hslite.core.auth;

import io.hslite.core.RoomEvent;
import io.hslite.core.RoomVersion;
import io.hslite.core.StateKey;

import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static io.hslite.core.auth.AuthDecision.allow;
import static io.hslite.core.auth.AuthDecision.reject;

/**
 * {@code m.room.power_levels}: a sender may only change levels that are,
 * before and after the change, no higher than their own, and may not touch
 * another user already at or above their own level.
 */
final class PowerLevelsRule implements AuthRule {

    @Override
    public AuthDecision check(RoomEvent event, AuthState state, RoomVersion version) {
        AuthDecision generic = StandardRules.STATE.check(event, state, version);
        if (!generic.allowed()) {
            return generic;
        }
        PowerLevels next;
        try {
            next = PowerLevels.fromContent(event.content());
        } catch (IllegalArgumentException e) {
            return reject(e.getMessage());
        }
        if (state.get(StateKey.powerLevels()) == null) {
            return allow();
        }
        PowerLevels current = state.powerLevels(version);
        int senderLevel = current.userLevel(event.sender());

        for (String name : PowerLevels.TOP_LEVEL) {
            AuthDecision d = checkChange(name, current.levels().get(name), next.levels().get(name), senderLevel);
            if (!d.allowed()) return d;
        }
        for (String type : union(current.events(), next.events())) {
            AuthDecision d = checkChange("events." + type,
                    current.events().get(type), next.events().get(type), senderLevel);
            if (!d.allowed()) return d;
        }
        for (String user : union(current.users(), next.users())) {
            Integer before = current.users().get(user);
            Integer after = next.users().get(user);
            if (Objects.equals(before, after)) continue;
            if (!user.equals(event.sender()) && before != null && before >= senderLevel) {
                return reject("cannot change power of " + user + " at or above own level " + senderLevel);
            }
            AuthDecision d = checkChange("users." + user, before, after, senderLevel);
            if (!d.allowed()) return d;
        }
        return allow();
    }

    private static AuthDecision checkChange(String name, Integer before, Integer after, int senderLevel) {
        if (Objects.equals(before, after)) {
            return allow();
        }
        if (before != null && before > senderLevel) {
            return reject("cannot change " + name + " from " + before + " above own level " + senderLevel);
        }
        if (after != null && after > senderLevel) {
            return reject("cannot raise " + name + " to " + after + " above own level " + senderLevel);
        }
        return allow();
    }

    private static Set<String> union(Map<String, Integer> a, Map<String, Integer> b) {
        Set<String> keys = new HashSet<>(a.keySet());
        keys.addAll(b.keySet());
        return keys;
    }
}
