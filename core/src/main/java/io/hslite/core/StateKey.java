// file: core/src/main/java/io/hslite/core/StateKey.java
package io.hslite.core;

import java.util.Comparator;
import java.util.Objects;

/**
 * Key of a room state entry: (event type, state key).
 * <p>
 * Ordered by type then state key so that iteration over state maps is
 * deterministic wherever ordering matters (resolution, snapshots, sync).
 */
public record StateKey(String type, String stateKey) implements Comparable<StateKey> {

    private static final Comparator<StateKey> ORDER =
            Comparator.comparing(StateKey::type).thenComparing(StateKey::stateKey);

    public StateKey {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(stateKey, "stateKey");
    }

    public static StateKey of(String type, String stateKey) {
        return new StateKey(type, stateKey);
    }

    public static StateKey create() {
        return new StateKey(EventTypes.CREATE, "");
    }

    public static StateKey powerLevels() {
        return new StateKey(EventTypes.POWER_LEVELS, "");
    }

    public static StateKey joinRules() {
        return new StateKey(EventTypes.JOIN_RULES, "");
    }

    public static StateKey member(String userId) {
        return new StateKey(EventTypes.MEMBER, userId);
    }

    @Override
    public int compareTo(StateKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return "(" + type + ", " + stateKey + ")";
    }
}
