// file: core/src/main/java/io/hslite/core/graph/AuthChain.java
package io.hslite.core.graph;

import io.hslite.core.RoomEvent;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Closure over {@code auth_events}.
 */
public final class AuthChain {

    private AuthChain() {
    }

    /**
     * All events reachable from {@code roots} through auth_events, excluding
     * the roots themselves unless another root reaches them.
     *
     * @throws MissingEventException if an id on the chain is not in the lookup
     */
    public static Set<String> of(Collection<String> roots, EventLookup lookup) {
        Set<String> seen = new HashSet<>();
        Deque<String> work = new ArrayDeque<>();
        for (String root : roots) {
            RoomEvent e = require(root, lookup);
            work.addAll(e.authEvents());
        }
        while (!work.isEmpty()) {
            String id = work.pop();
            if (!seen.add(id)) continue;
            work.addAll(require(id, lookup).authEvents());
        }
        return seen;
    }

    /** Auth chain of one event. */
    public static Set<String> of(String eventId, EventLookup lookup) {
        return of(Set.of(eventId), lookup);
    }

    private static RoomEvent require(String id, EventLookup lookup) {
        RoomEvent e = lookup.find(id);
        if (e == null) {
            throw new MissingEventException(id);
        }
        return e;
    }

    /** An id on an auth chain is not known locally. */
    public static final class MissingEventException extends IllegalStateException {
        private final String eventId;

        public MissingEventException(String eventId) {
            super("event " + eventId + " is not known locally");
            this.eventId = eventId;
        }

        public String eventId() {
            return eventId;
        }
    }
}
