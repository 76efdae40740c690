// file: server/src/main/java/io/hslite/server/room/EventAdmitter.java
package io.hslite.server.room;

import io.hslite.core.EventTypes;
import io.hslite.core.MalformedEventException;
import io.hslite.core.RoomEvent;
import io.hslite.core.RoomVersion;
import io.hslite.core.StateKey;
import io.hslite.core.auth.AuthDecision;
import io.hslite.core.auth.AuthRules;
import io.hslite.core.auth.AuthState;
import io.hslite.core.graph.AuthChain;
import io.hslite.core.graph.EventLookup;
import io.hslite.core.resolution.ResolutionFailureException;
import io.hslite.core.resolution.StateResolver;
import io.hslite.core.signing.EventSignatures;
import io.hslite.core.signing.KeyRing;
import io.hslite.storage.AppendOutcome;
import io.hslite.storage.EventConflictException;
import io.hslite.storage.EventStore;
import io.hslite.storage.RoomHead;
import io.hslite.storage.StoredEvent;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

import static io.hslite.server.room.AdmissionResult.Kind.AUTH;
import static io.hslite.server.room.AdmissionResult.Kind.MALFORMED;
import static io.hslite.server.room.AdmissionResult.Kind.RESOLUTION_FAILURE;

/**
 * Admission pipeline for one candidate event. Called only from the room's
 * actor, so it sees a stable snapshot and is the only writer for the room.
 * <p>
 * Steps:
 *  1) Structure: room, id = reference hash, content hash, origin signature.
 *  2) Duplicate check by id.
 *  3) Every prev and auth event stored, else GraphGap. Depth = 1 + max(prev depth).
 *  4) State before the event: the single prev's state, or the resolution of the prevs' states.
 *  5) Auth against the event's own auth_events, then against the state before.
 *  6) Append with the new frontier and current-state delta.
 * <p>
 * Rejected federation events are stored as rejected records (soft fail);
 * rejected local events leave no trace.
 */
public final class EventAdmitter {
    private static final Logger log = Logger.getLogger(EventAdmitter.class.getName());

    private final EventStore store;
    private final StateResolver resolver;
    private final AuthRules authRules;
    private final KeyRing keyRing;

    public EventAdmitter(EventStore store, StateResolver resolver, AuthRules authRules, KeyRing keyRing) {
        this.store = Objects.requireNonNull(store, "store");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.authRules = Objects.requireNonNull(authRules, "authRules");
        this.keyRing = Objects.requireNonNull(keyRing, "keyRing");
    }

    /**
     * Result of one admission.
     *
     * @param snapshot room view after the admission (unchanged unless admitted)
     * @param update   what subscribers must see, or null when nothing was admitted
     */
    public record Outcome(AdmissionResult result, RoomSnapshot snapshot, RoomUpdate update) {}

    public Outcome admit(RoomEvent event, EventOrigin origin, RoomSnapshot room) {
        String id = event.eventId();
        try {
            checkStructure(event, room.roomId());
        } catch (MalformedEventException e) {
            return unchanged(new AdmissionResult.Rejected(id, MALFORMED, e.getMessage(), false), room);
        }

        StoredEvent existing = store.get(id);
        if (existing != null) {
            if (!existing.event().equals(event)) {
                return unchanged(new AdmissionResult.Rejected(id, MALFORMED,
                        "event " + id + " is already stored with different content", false), room);
            }
            AdmissionResult r = existing.accepted()
                    ? new AdmissionResult.Duplicate(id, existing.streamPos())
                    : new AdmissionResult.Rejected(id, AUTH, existing.rejection(), true);
            return unchanged(r, room);
        }

        List<String> missing = missingAncestors(event);
        if (!missing.isEmpty()) {
            return unchanged(new AdmissionResult.GraphGap(id, missing, null), room);
        }
        String malformed = checkDepth(event);
        if (malformed != null) {
            return unchanged(new AdmissionResult.Rejected(id, MALFORMED, malformed, false), room);
        }

        boolean isCreate = EventTypes.CREATE.equals(event.type());
        if (isCreate && room.exists()) {
            return reject(event, origin, AUTH, "room " + room.roomId() + " already has a create event", null, room);
        }
        String rejectedAncestor = rejectedAncestor(event);
        if (rejectedAncestor != null) {
            return reject(event, origin, AUTH, "references rejected event " + rejectedAncestor, null, room);
        }

        RoomVersion version = isCreate ? versionOfCreate(event) : room.versionOrDefault();
        Map<StateKey, String> before;
        try {
            before = stateBefore(event, version);
        } catch (ResolutionFailureException | AuthChain.MissingEventException e) {
            return unchanged(new AdmissionResult.Rejected(id, RESOLUTION_FAILURE, e.getMessage(), false), room);
        }

        AuthDecision decision = authRules.authorizeByAuthEvents(event, store);
        if (decision.allowed()) {
            decision = authRules.authorize(event, AuthState.ofIds(before, store));
        }
        if (decision instanceof AuthDecision.Reject r) {
            return reject(event, origin, AUTH, r.reason(), before, room);
        }

        Map<StateKey, String> after = before;
        if (event.isState()) {
            after = new HashMap<>(before);
            after.put(event.key(), id);
        }

        Set<String> extremities = new TreeSet<>(room.extremities());
        event.prevEvents().forEach(extremities::remove);
        extremities.add(id);

        Map<StateKey, String> current;
        try {
            current = currentState(event, after, extremities, version);
        } catch (ResolutionFailureException | AuthChain.MissingEventException e) {
            return unchanged(new AdmissionResult.Rejected(id, RESOLUTION_FAILURE, e.getMessage(), false), room);
        }
        Map<StateKey, String> delta = diff(room.state(), current);

        AppendOutcome out;
        try {
            out = store.append(event, after, new RoomHead(extremities, delta));
        } catch (EventConflictException e) {
            return unchanged(new AdmissionResult.Rejected(id, MALFORMED, e.getMessage(), false), room);
        }
        if (out instanceof AppendOutcome.Duplicate d) {
            return unchanged(new AdmissionResult.Duplicate(id, d.existing().streamPos()), room);
        }
        if (out instanceof AppendOutcome.Rejected r) {
            return unchanged(new AdmissionResult.Rejected(id, AUTH, r.reason(), false), room);
        }
        long pos = ((AppendOutcome.Stored) out).streamPos();
        RoomVersion roomVersion = room.version() != null ? room.version() : (isCreate ? version : null);
        var next = new RoomSnapshot(room.roomId(), roomVersion, pos, extremities, current);
        return new Outcome(new AdmissionResult.Admitted(id, pos), next,
                new RoomUpdate(room.roomId(), pos, event, delta));
    }

    // ---------- steps ----------

    private void checkStructure(RoomEvent event, String roomId) {
        if (!event.roomId().equals(roomId)) {
            throw new MalformedEventException("event belongs to " + event.roomId() + ", not " + roomId);
        }
        if (!event.hasValidId()) {
            throw new MalformedEventException("event id " + event.eventId() + " does not match its reference hash");
        }
        if (!event.hasValidContentHash()) {
            throw new MalformedEventException("content hash mismatch");
        }
        EventSignatures.verifyOrigin(event, keyRing);
    }

    private List<String> missingAncestors(RoomEvent event) {
        Set<String> missing = new LinkedHashSet<>();
        for (String p : event.prevEvents()) {
            if (store.get(p) == null) missing.add(p);
        }
        for (String a : event.authEvents()) {
            if (store.get(a) == null) missing.add(a);
        }
        return new ArrayList<>(missing);
    }

    private String checkDepth(RoomEvent event) {
        long expected = 1;
        for (String p : event.prevEvents()) {
            expected = Math.max(expected, store.get(p).event().depth() + 1);
        }
        if (event.depth() != expected) {
            return "depth " + event.depth() + " does not follow prev events (expected " + expected + ")";
        }
        return null;
    }

    private String rejectedAncestor(RoomEvent event) {
        for (String p : event.prevEvents()) {
            if (!store.get(p).accepted()) return p;
        }
        for (String a : event.authEvents()) {
            if (!store.get(a).accepted()) return a;
        }
        return null;
    }

    private static RoomVersion versionOfCreate(RoomEvent create) {
        try {
            return RoomVersion.of(create);
        } catch (IllegalArgumentException e) {
            // CreateRule reports the unsupported version
            return RoomVersion.DEFAULT;
        }
    }

    private Map<StateKey, String> stateBefore(RoomEvent event, RoomVersion version) {
        List<String> prevs = event.prevEvents();
        if (prevs.isEmpty()) {
            return Map.of();
        }
        List<Map<StateKey, String>> states = new ArrayList<>(prevs.size());
        for (String p : prevs) {
            Map<StateKey, String> s = store.get(p).stateAfter();
            if (!states.contains(s)) states.add(s);
        }
        if (states.size() == 1) {
            return states.get(0);
        }
        return resolver.resolve(version, states, store);
    }

    private Map<StateKey, String> currentState(RoomEvent event, Map<StateKey, String> after,
                                               Set<String> extremities, RoomVersion version) {
        if (extremities.size() == 1) {
            return after;
        }
        List<Map<StateKey, String>> states = new ArrayList<>(extremities.size());
        for (String x : extremities) {
            states.add(x.equals(event.eventId()) ? after : store.get(x).stateAfter());
        }
        EventLookup lookup = eid -> eid.equals(event.eventId()) ? event : store.find(eid);
        return resolver.resolve(version, states, lookup);
    }

    private Outcome reject(RoomEvent event, EventOrigin origin, AdmissionResult.Kind kind, String reason,
                           Map<StateKey, String> before, RoomSnapshot room) {
        if (origin != EventOrigin.FEDERATION) {
            return unchanged(new AdmissionResult.Rejected(event.eventId(), kind, reason, false), room);
        }
        store.appendRejected(event, reason, before == null ? Map.of() : before);
        log.info("Soft-failed " + event.eventId() + " in " + event.roomId() + " from "
                + event.originServer() + ": " + reason);
        return unchanged(new AdmissionResult.Rejected(event.eventId(), kind, reason, true), room);
    }

    private static Outcome unchanged(AdmissionResult result, RoomSnapshot room) {
        return new Outcome(result, room, null);
    }

    /** Entries of {@code to} that differ from {@code from}; removed keys map to null. */
    static Map<StateKey, String> diff(Map<StateKey, String> from, Map<StateKey, String> to) {
        Map<StateKey, String> delta = new LinkedHashMap<>();
        for (Map.Entry<StateKey, String> e : to.entrySet()) {
            if (!e.getValue().equals(from.get(e.getKey()))) delta.put(e.getKey(), e.getValue());
        }
        for (StateKey k : from.keySet()) {
            if (!to.containsKey(k)) delta.put(k, null);
        }
        return delta;
    }
}
