// file: server/src/main/java/io/hslite/server/sync/SyncSessionManager.java
package io.hslite.server.sync;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hslite.core.EventTypes;
import io.hslite.core.Membership;
import io.hslite.core.RoomEvent;
import io.hslite.core.StateKey;
import io.hslite.server.room.RoomRegistry;
import io.hslite.server.room.RoomSnapshot;
import io.hslite.server.room.RoomUpdate;
import io.hslite.server.timeline.PaginationToken;
import io.hslite.server.timeline.TimelineBuilder;
import io.hslite.server.timeline.TimelineEntry;
import io.hslite.storage.CursorStore;
import io.hslite.storage.EventStore;
import io.hslite.storage.StoredEvent;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Incremental sync.
 * <p>
 * A request either returns at once (initial sync, something new, or no
 * timeout) or parks a waiter. Waiters are woken by room updates and ephemeral
 * changes; each wake re-computes the response off the write path and completes
 * the waiter when it is no longer empty. A scheduler completes the waiter with
 * an empty response carrying the unchanged token when the timeout fires.
 * <p>
 * One waiter per device: a new sync from the same device cancels the old one.
 * Parked waiters are indexed by the rooms the user is joined or invited to
 * and by user id, so an update only re-checks the waiters it can affect.
 */
public final class SyncSessionManager {
    private static final Logger log = Logger.getLogger(SyncSessionManager.class.getName());

    /** Stripped state shown with invites. */
    private static final List<StateKey> INVITE_STATE = List.of(
            StateKey.create(), StateKey.joinRules(),
            StateKey.of(EventTypes.NAME, ""), StateKey.of(EventTypes.AVATAR, ""),
            StateKey.of(EventTypes.CANONICAL_ALIAS, ""), StateKey.of(EventTypes.ENCRYPTION, ""));

    private final RoomRegistry rooms;
    private final EventStore store;
    private final CursorStore cursors;
    private final TimelineBuilder timeline;
    private final EphemeralStore ephemeral;
    private final ScheduledExecutorService scheduler;
    private final SyncSettings settings;

    private final Map<String, Waiter> waiters = new ConcurrentHashMap<>();
    private final Map<String, Set<Waiter>> byRoom = new ConcurrentHashMap<>();
    private final Map<String, Set<Waiter>> byUser = new ConcurrentHashMap<>();
    private final AtomicLong checks = new AtomicLong();

    public SyncSessionManager(RoomRegistry rooms,
                              EventStore store,
                              CursorStore cursors,
                              TimelineBuilder timeline,
                              EphemeralStore ephemeral,
                              ScheduledExecutorService scheduler,
                              SyncSettings settings) {
        this.rooms = Objects.requireNonNull(rooms, "rooms");
        this.store = Objects.requireNonNull(store, "store");
        this.cursors = Objects.requireNonNull(cursors, "cursors");
        this.timeline = Objects.requireNonNull(timeline, "timeline");
        this.ephemeral = Objects.requireNonNull(ephemeral, "ephemeral");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    private static final class Waiter {
        final SyncRequest request;
        final SyncToken since;
        final CompletableFuture<SyncResponse> future = new CompletableFuture<>();
        volatile ScheduledFuture<?> timer;
        Set<String> watched = Set.of();

        Waiter(SyncRequest request, SyncToken since) {
            this.request = request;
            this.since = since;
        }
    }

    /**
     * Run one sync. The returned future may be cancelled; that releases the waiter.
     *
     * @throws IllegalArgumentException when {@code since} is not a valid token
     */
    public CompletableFuture<SyncResponse> sync(SyncRequest request) {
        SyncToken since = request.since() == null ? null : SyncToken.decode(request.since());
        String key = request.userId() + "|" + request.deviceId();

        Waiter previous = waiters.remove(key);
        if (previous != null) {
            previous.future.cancel(false);
        }

        SyncResponse now = compute(request, since);
        if (since == null || !now.isEmpty() || request.timeoutMs() == 0) {
            delivered(request, now);
            return CompletableFuture.completedFuture(now);
        }

        Waiter w = new Waiter(request, since);
        w.watched = watchedRooms(request.userId());
        for (String roomId : w.watched) index(byRoom, roomId, w);
        index(byUser, request.userId(), w);
        Waiter raced = waiters.put(key, w);
        if (raced != null) {
            raced.future.cancel(false);
        }
        w.future.whenComplete((r, e) -> {
            waiters.remove(key, w);
            for (String roomId : w.watched) unindex(byRoom, roomId, w);
            unindex(byUser, request.userId(), w);
            ScheduledFuture<?> t = w.timer;
            if (t != null) t.cancel(false);
        });
        w.timer = scheduler.schedule(
                () -> w.future.complete(SyncResponse.empty(request.since())),
                request.timeoutMs(), TimeUnit.MILLISECONDS);
        if (w.future.isDone()) {
            w.timer.cancel(false);
        }
        // an update may have landed between compute() and put()
        check(w);
        return w.future;
    }

    /** Ephemeral data of {@code roomId} changed; re-check the waiters watching it. */
    public void wake(String roomId) {
        wakeAll(byRoom.get(roomId));
    }

    /**
     * An event was admitted. Waiters watching the room are re-checked, and so
     * are the waiters of a user whose membership the event changes, since an
     * invite or join brings a room they are not yet watching.
     */
    public void roomUpdated(RoomUpdate update) {
        wake(update.roomId());
        RoomEvent event = update.event();
        if (event != null && EventTypes.MEMBER.equals(event.type()) && event.stateKey() != null) {
            wakeAll(byUser.get(event.stateKey()));
        }
    }

    private void wakeAll(Set<Waiter> targets) {
        if (targets == null) return;
        for (Waiter w : targets) {
            scheduler.execute(() -> check(w));
        }
    }

    private Set<String> watchedRooms(String user) {
        Set<String> out = new HashSet<>();
        for (String roomId : rooms.rooms()) {
            String memberId = rooms.actor(roomId).snapshot().state().get(StateKey.member(user));
            if (memberId == null) continue;
            Membership m = Membership.fromContent(store.get(memberId).event().content());
            if (m == Membership.JOIN || m == Membership.INVITE) out.add(roomId);
        }
        return Set.copyOf(out);
    }

    private static void index(Map<String, Set<Waiter>> index, String key, Waiter w) {
        index.compute(key, (k, set) -> {
            Set<Waiter> s = set == null ? ConcurrentHashMap.newKeySet() : set;
            s.add(w);
            return s;
        });
    }

    private static void unindex(Map<String, Set<Waiter>> index, String key, Waiter w) {
        index.computeIfPresent(key, (k, set) -> {
            set.remove(w);
            return set.isEmpty() ? null : set;
        });
    }

    /** Number of parked sync requests. */
    public int waiting() {
        return waiters.size();
    }

    /** Waiter re-checks run so far. */
    long checksRun() {
        return checks.get();
    }

    private void check(Waiter w) {
        if (w.future.isDone()) return;
        checks.incrementAndGet();
        try {
            SyncResponse r = compute(w.request, w.since);
            if (!r.isEmpty() && w.future.complete(r)) {
                delivered(w.request, r);
            }
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Sync for " + w.request.deviceId() + " failed", e);
            w.future.completeExceptionally(e);
        }
    }

    private void delivered(SyncRequest request, SyncResponse response) {
        if (response.isEmpty() && request.since() != null) return;
        SyncToken token = SyncToken.decode(response.nextBatch());
        token.rooms().forEach((roomId, pos) -> cursors.advanceCursor(request.deviceId(), roomId, pos));
    }

    // ---------- response building ----------

    SyncResponse compute(SyncRequest request, SyncToken since) {
        String user = request.userId();
        SyncFilter filter = request.filter();
        int limit = filter.limitOr(settings.defaultTimelineLimit());
        long sinceEphemeral = since == null ? 0 : since.ephemeral();
        long ephemeralNow = ephemeral.serial();

        Map<String, Long> next = new TreeMap<>(since == null ? Map.of() : since.rooms());
        Map<String, SyncResponse.JoinedRoom> join = new TreeMap<>();
        Map<String, SyncResponse.LeftRoom> leave = new TreeMap<>();
        Map<String, SyncResponse.InvitedRoom> invite = new TreeMap<>();

        for (String roomId : new TreeSet<>(rooms.rooms())) {
            if (!filter.allowsRoom(roomId)) continue;
            RoomSnapshot snap = rooms.actor(roomId).snapshot();
            String memberId = snap.state().get(StateKey.member(user));
            if (memberId == null) continue;
            StoredEvent member = store.get(memberId);
            Membership m = Membership.fromContent(member.event().content());
            Long from = since == null ? null : since.position(roomId);

            if (m == Membership.JOIN) {
                var room = from == null
                        ? initialRoom(snap, limit, filter, sinceEphemeral)
                        : incrementalRoom(snap, from, limit, filter, sinceEphemeral);
                if (from == null || !room.isEmpty()) join.put(roomId, room);
                next.put(roomId, snap.streamPos());
            } else if (m == Membership.INVITE) {
                if (from == null || member.streamPos() > from) {
                    invite.put(roomId, new SyncResponse.InvitedRoom(inviteState(snap, member)));
                }
                next.put(roomId, snap.streamPos());
            } else if (m == Membership.LEAVE || m == Membership.BAN) {
                if (from != null && from < member.streamPos()) {
                    List<ObjectNode> tl = new ArrayList<>();
                    for (TimelineEntry e : timeline.range(roomId, from, member.streamPos())) {
                        if (filter.allowsType(e.event().type())) tl.add(e.clientJson());
                    }
                    leave.put(roomId, new SyncResponse.LeftRoom(tl, List.of()));
                }
                if (from != null) next.put(roomId, Math.max(from, member.streamPos()));
            }
        }

        SyncToken nextToken = new SyncToken(next, ephemeralNow);
        if (since != null && join.isEmpty() && leave.isEmpty() && invite.isEmpty()) {
            return SyncResponse.empty(since.encode());
        }
        return new SyncResponse(nextToken.encode(), join, leave, invite);
    }

    private SyncResponse.JoinedRoom initialRoom(RoomSnapshot snap, int limit, SyncFilter filter, long sinceEphemeral) {
        long head = snap.streamPos();
        long from = Math.max(0, head - limit);
        List<TimelineEntry> entries = timeline.range(snap.roomId(), from, head);
        Set<String> inTimeline = ids(entries);
        List<ObjectNode> state = new ArrayList<>();
        for (String id : snap.state().values()) {
            if (inTimeline.contains(id)) continue;
            ObjectNode json = timeline.render(id);
            if (json != null) state.add(json);
        }
        return new SyncResponse.JoinedRoom(clientEvents(entries, filter), from > 0,
                prevBatch(entries, head), state, ephemeral.eventsSince(snap.roomId(), sinceEphemeral));
    }

    private SyncResponse.JoinedRoom incrementalRoom(RoomSnapshot snap, long from, int limit, SyncFilter filter,
                                                    long sinceEphemeral) {
        long head = snap.streamPos();
        List<ObjectNode> eph = ephemeral.eventsSince(snap.roomId(), sinceEphemeral);
        if (head <= from) {
            return new SyncResponse.JoinedRoom(List.of(), false, null, List.of(), eph);
        }
        boolean limited = head - from > limit;
        long start = limited ? head - limit : from;
        List<TimelineEntry> entries = timeline.range(snap.roomId(), start, head);
        Set<String> inTimeline = ids(entries);

        List<ObjectNode> state = new ArrayList<>();
        for (StateKey k : store.stateChangesSince(snap.roomId(), from).keySet()) {
            String id = snap.state().get(k);
            if (id == null || inTimeline.contains(id)) continue;
            ObjectNode json = timeline.render(id);
            if (json != null) state.add(json);
        }
        return new SyncResponse.JoinedRoom(clientEvents(entries, filter), limited,
                prevBatch(entries, head), state, eph);
    }

    private List<ObjectNode> inviteState(RoomSnapshot snap, StoredEvent invite) {
        List<ObjectNode> out = new ArrayList<>();
        for (StateKey k : INVITE_STATE) {
            String id = snap.state().get(k);
            RoomEvent e = id == null ? null : store.find(id);
            if (e != null) out.add(stripped(e));
        }
        out.add(stripped(invite.event()));
        return out;
    }

    private static ObjectNode stripped(RoomEvent e) {
        ObjectNode json = JsonNodeFactory.instance.objectNode();
        json.put("type", e.type());
        json.put("state_key", e.stateKey());
        json.put("sender", e.sender());
        json.set("content", e.content());
        return json;
    }

    private static List<ObjectNode> clientEvents(List<TimelineEntry> entries, SyncFilter filter) {
        List<ObjectNode> out = new ArrayList<>(entries.size());
        for (TimelineEntry e : entries) {
            if (filter.allowsType(e.event().type())) out.add(e.clientJson());
        }
        return out;
    }

    private static Set<String> ids(List<TimelineEntry> entries) {
        Set<String> out = new HashSet<>();
        for (TimelineEntry e : entries) out.add(e.event().eventId());
        return out;
    }

    private static String prevBatch(List<TimelineEntry> entries, long head) {
        long before = entries.isEmpty() ? head : entries.get(0).streamPos() - 1;
        return new PaginationToken(before).encode();
    }
}
