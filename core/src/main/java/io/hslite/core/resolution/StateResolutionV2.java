// file: core/src/main/java/io/hslite/core/resolution/StateResolutionV2.java
package io.hslite.core.resolution;

import io.hslite.core.EventTypes;
import io.hslite.core.Membership;
import io.hslite.core.RoomEvent;
import io.hslite.core.RoomVersion;
import io.hslite.core.StateKey;
import io.hslite.core.auth.AuthDecision;
import io.hslite.core.auth.AuthEvents;
import io.hslite.core.auth.AuthRules;
import io.hslite.core.auth.AuthState;
import io.hslite.core.auth.PowerLevels;
import io.hslite.core.graph.AuthChain;
import io.hslite.core.graph.EventLookup;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Power-ordered state resolution.
 * <p>
 * Algorithm:
 *  1. Split keys into unconflicted (every set has the same event) and conflicted.
 *  2. Full conflicted set = events of conflicted keys plus the auth difference
 *     (union of the sets' auth chains minus their intersection).
 *  3. Power events of the full conflicted set, together with their auth
 *     ancestors inside it, are ordered by reverse topological power ordering:
 *     auth ancestors first; among ready events higher sender power first,
 *     then earlier origin_server_ts, then smaller event id.
 *  4. Those are applied one by one on top of the unconflicted state, each only
 *     if it passes auth against the state built so far.
 *  5. The remaining events are ordered along the mainline of the resulting
 *     power-levels event and applied the same way.
 *  6. Unconflicted entries are re-applied last, again auth-checked. A failing
 *     unconflicted entry yields to a conflict-resolved value for its key when
 *     one exists; otherwise it stays.
 * <p>
 * Every ordering is total and independent of input order, so two servers
 * holding the same events compute the same result.
 */
public final class StateResolutionV2 implements StateResolver {
    private final AuthRules authRules;

    public StateResolutionV2(AuthRules authRules) {
        this.authRules = authRules;
    }

    public StateResolutionV2() {
        this(AuthRules.standard());
    }

    @Override
    public Map<StateKey, String> resolve(RoomVersion version,
                                         Collection<Map<StateKey, String>> stateSets,
                                         EventLookup lookup) {
        if (stateSets.isEmpty()) {
            return Map.of();
        }
        List<Map<StateKey, String>> sets = List.copyOf(stateSets);
        if (sets.stream().distinct().count() == 1) {
            return new TreeMap<>(sets.get(0));
        }

        // 1. Partition.
        Map<StateKey, String> unconflicted = new TreeMap<>();
        Set<String> conflictedEvents = new TreeSet<>();
        Set<StateKey> allKeys = new TreeSet<>();
        sets.forEach(s -> allKeys.addAll(s.keySet()));
        for (StateKey key : allKeys) {
            Set<String> values = new HashSet<>();
            boolean missingSomewhere = false;
            for (Map<StateKey, String> s : sets) {
                String id = s.get(key);
                if (id == null) missingSomewhere = true;
                else values.add(id);
            }
            if (values.size() == 1 && !missingSomewhere) {
                unconflicted.put(key, values.iterator().next());
            } else {
                conflictedEvents.addAll(values);
            }
        }

        // 2. Full conflicted set.
        Set<String> fullConflicted = new TreeSet<>(conflictedEvents);
        fullConflicted.addAll(authDifference(sets, lookup));
        for (String id : fullConflicted) {
            require(id, lookup);
        }

        // 3. Power events plus their auth ancestors inside the full conflicted set.
        Set<String> powerIds = new HashSet<>();
        for (String id : fullConflicted) {
            if (isPowerEvent(require(id, lookup))) {
                addWithAncestors(id, fullConflicted, lookup, powerIds);
            }
        }
        List<String> powerOrder = reverseTopologicalPowerOrder(powerIds, lookup);

        // 4. Iterative auth checks over power events.
        Map<StateKey, String> partial = new TreeMap<>(unconflicted);
        Set<StateKey> resolvedByConflict = new HashSet<>();
        iterativeAuth(powerOrder, partial, resolvedByConflict, lookup);

        // 5. Mainline ordering for everything else.
        List<String> others = new ArrayList<>();
        for (String id : fullConflicted) {
            if (!powerIds.contains(id)) others.add(id);
        }
        others.sort(mainlineOrder(partial.get(StateKey.powerLevels()), lookup));
        iterativeAuth(others, partial, resolvedByConflict, lookup);

        // 6. Unconflicted entries on top.
        for (Map.Entry<StateKey, String> e : unconflicted.entrySet()) {
            RoomEvent event = require(e.getValue(), lookup);
            AuthDecision d = authRules.authorize(event, authStateFor(event, partial, lookup));
            if (d.allowed() || !resolvedByConflict.contains(e.getKey())) {
                partial.put(e.getKey(), e.getValue());
            }
        }
        return partial;
    }

    // ---------- steps ----------

    private static Set<String> authDifference(List<Map<StateKey, String>> sets, EventLookup lookup) {
        Set<String> union = new HashSet<>();
        Set<String> intersection = null;
        for (Map<StateKey, String> s : sets) {
            Set<String> chain;
            try {
                chain = AuthChain.of(s.values(), lookup);
            } catch (AuthChain.MissingEventException e) {
                throw new ResolutionFailureException("auth chain incomplete: " + e.getMessage(), e);
            }
            union.addAll(chain);
            if (intersection == null) intersection = new HashSet<>(chain);
            else intersection.retainAll(chain);
        }
        if (intersection != null) union.removeAll(intersection);
        return union;
    }

    /** Create, power levels, join rules, and memberships removed by someone else (kicks, bans). */
    static boolean isPowerEvent(RoomEvent e) {
        if (!e.isState()) return false;
        String type = e.type();
        if ("".equals(e.stateKey())
                && (EventTypes.CREATE.equals(type) || EventTypes.POWER_LEVELS.equals(type)
                || EventTypes.JOIN_RULES.equals(type))) {
            return true;
        }
        if (EventTypes.MEMBER.equals(type) && !e.sender().equals(e.stateKey())) {
            Membership m = Membership.fromContent(e.content());
            return m == Membership.LEAVE || m == Membership.BAN;
        }
        return false;
    }

    private static void addWithAncestors(String id, Set<String> within, EventLookup lookup, Set<String> out) {
        if (!out.add(id)) return;
        for (String a : require(id, lookup).authEvents()) {
            if (within.contains(a)) addWithAncestors(a, within, lookup, out);
        }
    }

    /** Kahn's algorithm over auth edges restricted to {@code ids}. */
    private static List<String> reverseTopologicalPowerOrder(Set<String> ids, EventLookup lookup) {
        Map<String, Integer> pending = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        Map<String, RoomEvent> events = new HashMap<>();
        Map<String, Integer> power = new HashMap<>();
        for (String id : ids) {
            RoomEvent e = require(id, lookup);
            events.put(id, e);
            power.put(id, senderPowerAt(e, lookup));
            int count = 0;
            for (String a : e.authEvents()) {
                if (ids.contains(a)) {
                    count++;
                    dependents.computeIfAbsent(a, k -> new ArrayList<>()).add(id);
                }
            }
            pending.put(id, count);
        }
        Comparator<String> order = Comparator
                .<String>comparingInt(id -> -power.get(id))
                .thenComparingLong(id -> events.get(id).originServerTs())
                .thenComparing(Comparator.naturalOrder());
        PriorityQueue<String> ready = new PriorityQueue<>(order);
        pending.forEach((id, n) -> {
            if (n == 0) ready.add(id);
        });
        List<String> out = new ArrayList<>(ids.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            out.add(id);
            for (String child : dependents.getOrDefault(id, List.of())) {
                if (pending.merge(child, -1, Integer::sum) == 0) ready.add(child);
            }
        }
        if (out.size() != ids.size()) {
            throw new ResolutionFailureException("cycle in auth graph among " + ids.size() + " events");
        }
        return out;
    }

    /** Power of the sender according to the event's own auth events. */
    private static int senderPowerAt(RoomEvent e, EventLookup lookup) {
        RoomEvent create = null;
        RoomEvent pl = null;
        for (String a : e.authEvents()) {
            RoomEvent ae = require(a, lookup);
            if (EventTypes.CREATE.equals(ae.type())) create = ae;
            if (EventTypes.POWER_LEVELS.equals(ae.type())) pl = ae;
        }
        if (EventTypes.CREATE.equals(e.type())) create = e;
        if (pl != null) {
            try {
                return PowerLevels.fromContent(pl.content()).userLevel(e.sender());
            } catch (IllegalArgumentException malformed) {
                return 0;
            }
        }
        if (create == null) return 0;
        RoomVersion version;
        try {
            version = RoomVersion.of(create);
        } catch (IllegalArgumentException unsupported) {
            return 0;
        }
        return version.creator(create).equals(e.sender()) ? 100 : 0;
    }

    private void iterativeAuth(List<String> ordered, Map<StateKey, String> partial,
                               Set<StateKey> resolvedByConflict, EventLookup lookup) {
        for (String id : ordered) {
            RoomEvent e = require(id, lookup);
            if (!e.isState()) continue;
            if (authRules.authorize(e, authStateFor(e, partial, lookup)).allowed()) {
                partial.put(e.key(), id);
                resolvedByConflict.add(e.key());
            }
        }
    }

    /** The event's auth events, with the relevant keys replaced from the partially resolved state. */
    private static AuthState authStateFor(RoomEvent e, Map<StateKey, String> partial, EventLookup lookup) {
        Map<StateKey, String> ids = new HashMap<>();
        for (String a : e.authEvents()) {
            RoomEvent ae = require(a, lookup);
            if (ae.isState()) ids.put(ae.key(), a);
        }
        for (StateKey k : AuthEvents.selectKeys(e.type(), e.sender(), e.stateKey(), e.content())) {
            String id = partial.get(k);
            if (id != null) ids.put(k, id);
        }
        return AuthState.ofIds(ids, lookup);
    }

    /**
     * Order by position of the closest power-levels ancestor on the mainline
     * of {@code resolvedPowerLevels}, then ts, then id. Events with no such
     * ancestor sort first.
     */
    private static Comparator<String> mainlineOrder(String resolvedPowerLevels, EventLookup lookup) {
        List<String> mainline = new ArrayList<>();
        String cursor = resolvedPowerLevels;
        while (cursor != null) {
            mainline.add(cursor);
            cursor = powerLevelsParent(require(cursor, lookup), lookup);
        }
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < mainline.size(); i++) {
            position.put(mainline.get(i), mainline.size() - 1 - i);   // oldest = 0
        }
        Map<String, Integer> cache = new HashMap<>();
        return Comparator
                .<String>comparingInt(id -> cache.computeIfAbsent(id, k -> mainlinePosition(k, position, lookup)))
                .thenComparingLong(id -> require(id, lookup).originServerTs())
                .thenComparing(Comparator.naturalOrder());
    }

    private static int mainlinePosition(String id, Map<String, Integer> position, EventLookup lookup) {
        String cursor = id;
        Set<String> visited = new HashSet<>();
        while (cursor != null && visited.add(cursor)) {
            Integer p = position.get(cursor);
            if (p != null) return p;
            cursor = powerLevelsParent(require(cursor, lookup), lookup);
        }
        return -1;
    }

    private static String powerLevelsParent(RoomEvent e, EventLookup lookup) {
        for (String a : e.authEvents()) {
            if (EventTypes.POWER_LEVELS.equals(require(a, lookup).type())) return a;
        }
        return null;
    }

    private static RoomEvent require(String id, EventLookup lookup) {
        RoomEvent e = lookup.find(id);
        if (e == null) {
            throw new ResolutionFailureException("event " + id + " missing during resolution");
        }
        return e;
    }
}
