// file: storage/src/main/java/io/hslite/storage/DurableEventStore.java
package io.hslite.storage;

import io.hslite.core.EventTypes;
import io.hslite.core.Redactor;
import io.hslite.core.RoomEvent;
import io.hslite.core.StateKey;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/**
 * Durable event store.
 * <p>
 * Responsibilities:
 *  - Keep every event in memory: id -> StoredEvent, plus per room a stream
 *    index, frontier, current state and the current-state delta of every position.
 *  - On write:
 *      1) Build one record holding the event, its stream position, its state
 *         (relative to a parent's state), the new frontier and the current-state delta.
 *      2) Append+fsync it to the WAL.
 *      3) Apply it to memory.
 *      4) Rotate the WAL segment if needed; snapshot according to SnapshotPolicy.
 *  - On startup:
 *      1) Replay the latest snapshot, drop WAL segments it covers.
 *      2) Replay remaining WAL records. Records for ids already present are skipped,
 *         so replay is idempotent.
 * <p>
 * Writes are serialized on the store monitor. Reads never lock: every published
 * structure is either concurrent or immutable.
 */
public class DurableEventStore implements EventStore, CursorStore, AutoCloseable {
    private static final Logger log = Logger.getLogger(DurableEventStore.class.getName());

    static final long DEFAULT_SEGMENT_BYTES = 64L * 1024 * 1024;

    private final Map<String, StoredEvent> events = new ConcurrentHashMap<>();
    private final List<String> admissionOrder = new ArrayList<>();          // guarded by this
    private final Map<String, RoomData> rooms = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Long>> cursors = new ConcurrentHashMap<>();
    private final Map<String, List<String>> redactions = new ConcurrentHashMap<>();

    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;

    public DurableEventStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy) {
        this.wal = wal;
        this.snaps = snaps;
        this.snapPolicy = snapPolicy;
        recover();
    }

    /** Store under {@code dataDir}: WAL in "wal/", snapshots in "snapshots/". */
    public static DurableEventStore open(Path dataDir, int snapshotEvery) {
        return new DurableEventStore(
                new FileWal(dataDir.resolve("wal"), DEFAULT_SEGMENT_BYTES),
                new FileSnapshotter(dataDir.resolve("snapshots")),
                new SnapshotPolicy(snapshotEvery));
    }

    // ---------- writes ----------

    @Override
    public synchronized AppendOutcome append(RoomEvent event, Map<StateKey, String> stateAfter, RoomHead head) {
        StoredEvent existing = existing(event);
        if (existing != null) {
            return new AppendOutcome.Duplicate(existing);
        }
        RoomData room = room(event.roomId());
        long pos = room.lastPos + 1;
        String base = stateBase(event);
        var rec = new LogRecord.Admission(event, pos, null, base, diff(stateOf(base), stateAfter),
                sorted(head.extremities()), head.currentStateDelta());
        wal.append(RecordCodec.encode(rec));
        applyAdmission(rec);
        afterWrite();
        return new AppendOutcome.Stored(pos);
    }

    @Override
    public synchronized AppendOutcome appendRejected(RoomEvent event, String reason, Map<StateKey, String> stateBefore) {
        Objects.requireNonNull(reason, "reason");
        StoredEvent existing = existing(event);
        if (existing != null) {
            return new AppendOutcome.Duplicate(existing);
        }
        String base = stateBase(event);
        var rec = new LogRecord.Admission(event, StoredEvent.NO_POSITION, reason, base,
                diff(stateOf(base), stateBefore), null, Map.of());
        wal.append(RecordCodec.encode(rec));
        applyAdmission(rec);
        afterWrite();
        return new AppendOutcome.Rejected(reason);
    }

    @Override
    public synchronized void recordGap(String roomId, Collection<String> missingIds) {
        List<String> fresh = new ArrayList<>();
        Set<String> known = room(roomId).gaps;
        for (String id : missingIds) {
            if (!known.contains(id)) fresh.add(id);
        }
        if (fresh.isEmpty()) return;
        var rec = new LogRecord.Gap(roomId, fresh, true);
        wal.append(RecordCodec.encode(rec));
        apply(rec);
        afterWrite();
    }

    @Override
    public synchronized void clearGap(String roomId, Collection<String> ids) {
        RoomData room = rooms.get(roomId);
        if (room == null) return;
        List<String> present = new ArrayList<>();
        for (String id : ids) {
            if (room.gaps.contains(id)) present.add(id);
        }
        if (present.isEmpty()) return;
        var rec = new LogRecord.Gap(roomId, present, false);
        wal.append(RecordCodec.encode(rec));
        apply(rec);
        afterWrite();
    }

    @Override
    public synchronized void advanceCursor(String deviceId, String roomId, long streamPos) {
        if (streamPos <= cursor(deviceId, roomId)) return;
        var rec = new LogRecord.Cursor(deviceId, roomId, streamPos);
        wal.append(RecordCodec.encode(rec));
        apply(rec);
        afterWrite();
    }

    /** Write a snapshot now and drop the WAL segments it covers. */
    public synchronized String snapshot() {
        String segment = wal.rotate();
        String id = snaps.writeSnapshot(segment, compacted());
        wal.deleteSegmentsBefore(segment);
        log.info("Snapshot " + id + " written: " + events.size() + " events, " + rooms.size() + " rooms");
        return id;
    }

    private StoredEvent existing(RoomEvent event) {
        StoredEvent existing = events.get(event.eventId());
        if (existing == null) return null;
        if (!existing.event().equals(event)) {
            throw new EventConflictException(event.eventId());
        }
        return existing;
    }

    private void afterWrite() {
        wal.rotateIfNeeded();
        if (snapPolicy.recordWrite()) {
            snapshot();
        }
    }

    // ---------- reads ----------

    @Override
    public StoredEvent get(String eventId) {
        return events.get(eventId);
    }

    @Override
    public Set<String> rooms() {
        return Set.copyOf(rooms.keySet());
    }

    @Override
    public boolean hasRoom(String roomId) {
        return rooms.containsKey(roomId);
    }

    @Override
    public Set<String> getForwardExtremities(String roomId) {
        RoomData room = rooms.get(roomId);
        return room == null ? Set.of() : room.extremities;
    }

    @Override
    public Map<StateKey, String> currentState(String roomId) {
        RoomData room = rooms.get(roomId);
        return room == null ? Map.of() : room.current;
    }

    @Override
    public Map<StateKey, String> stateAt(String roomId, long streamPos) {
        RoomData room = rooms.get(roomId);
        if (room == null) return Map.of();
        if (streamPos >= room.lastPos) return room.current;
        Map<StateKey, String> state = new HashMap<>();
        for (Map<StateKey, String> delta : room.deltas.headMap(streamPos, true).values()) {
            applyDelta(state, delta);
        }
        return Collections.unmodifiableMap(state);
    }

    @Override
    public Map<StateKey, String> stateChangesSince(String roomId, long streamPos) {
        RoomData room = rooms.get(roomId);
        if (room == null) return Map.of();
        NavigableMap<Long, Map<StateKey, String>> later = room.deltas.tailMap(streamPos, false);
        if (later.isEmpty()) return Map.of();
        Map<StateKey, String> current = room.current;
        Map<StateKey, String> before = stateAt(roomId, streamPos);
        Map<StateKey, String> out = new LinkedHashMap<>();
        for (Map<StateKey, String> delta : later.values()) {
            for (StateKey k : delta.keySet()) {
                String now = current.get(k);
                if (!Objects.equals(now, before.get(k))) out.put(k, now);
            }
        }
        return out;
    }

    @Override
    public long currentPosition(String roomId) {
        RoomData room = rooms.get(roomId);
        return room == null ? 0 : room.lastPos;
    }

    @Override
    public List<StoredEvent> eventsAfter(String roomId, long afterPos, int limit) {
        RoomData room = rooms.get(roomId);
        if (room == null || limit <= 0) return List.of();
        List<StoredEvent> out = new ArrayList<>();
        for (String id : room.byPos.tailMap(afterPos, false).values()) {
            out.add(events.get(id));
            if (out.size() >= limit) break;
        }
        return out;
    }

    @Override
    public List<StoredEvent> eventsBefore(String roomId, long beforePos, int limit) {
        RoomData room = rooms.get(roomId);
        if (room == null || limit <= 0) return List.of();
        List<StoredEvent> out = new ArrayList<>();
        for (String id : room.byPos.headMap(beforePos, false).descendingMap().values()) {
            out.add(events.get(id));
            if (out.size() >= limit) break;
        }
        return out;
    }

    @Override
    public StoredEvent eventAt(String roomId, long streamPos) {
        RoomData room = rooms.get(roomId);
        if (room == null) return null;
        String id = room.byPos.get(streamPos);
        return id == null ? null : events.get(id);
    }

    @Override
    public List<String> redactionsOf(String eventId) {
        List<String> ids = redactions.get(eventId);
        return ids == null ? List.of() : List.copyOf(ids);
    }

    @Override
    public Set<String> gaps(String roomId) {
        RoomData room = rooms.get(roomId);
        return room == null ? Set.of() : Set.copyOf(room.gaps);
    }

    @Override
    public long cursor(String deviceId, String roomId) {
        Map<String, Long> perRoom = cursors.get(deviceId);
        if (perRoom == null) return 0;
        return perRoom.getOrDefault(roomId, 0L);
    }

    @Override
    public Map<String, Long> cursors(String deviceId) {
        Map<String, Long> perRoom = cursors.get(deviceId);
        return perRoom == null ? Map.of() : Map.copyOf(perRoom);
    }

    @Override
    public synchronized void close() throws Exception {
        wal.close();
    }

    // ---------- applying records ----------

    private void apply(LogRecord rec) {
        if (rec instanceof LogRecord.Admission a) {
            if (!events.containsKey(a.event().eventId())) applyAdmission(a);
        } else if (rec instanceof LogRecord.Cursor c) {
            cursors.computeIfAbsent(c.deviceId(), d -> new ConcurrentHashMap<>())
                    .merge(c.roomId(), c.streamPos(), Math::max);
        } else if (rec instanceof LogRecord.Gap g) {
            Set<String> gaps = room(g.roomId()).gaps;
            if (g.open()) gaps.addAll(g.eventIds());
            else g.eventIds().forEach(gaps::remove);
        } else if (rec instanceof LogRecord.Heads h) {
            room(h.roomId()).extremities = Set.copyOf(h.extremities());
        }
    }

    private void applyAdmission(LogRecord.Admission a) {
        RoomEvent event = a.event();
        Map<StateKey, String> baseState = stateOf(a.stateBase());
        Map<StateKey, String> stateAfter;
        if (a.stateDelta().isEmpty() && a.stateBase() != null) {
            stateAfter = baseState;
        } else {
            Map<StateKey, String> s = new HashMap<>(baseState);
            applyDelta(s, a.stateDelta());
            stateAfter = Collections.unmodifiableMap(s);
        }
        events.put(event.eventId(), new StoredEvent(event, a.streamPos(), a.rejection(), stateAfter));
        admissionOrder.add(event.eventId());

        RoomData room = room(event.roomId());
        if (a.rejection() != null) {
            return;
        }
        room.byPos.put(a.streamPos(), event.eventId());
        if (a.extremities() != null) {
            room.extremities = Set.copyOf(a.extremities());
        }
        if (!a.currentDelta().isEmpty()) {
            Map<StateKey, String> delta = new HashMap<>(a.currentDelta());
            Map<StateKey, String> next = new HashMap<>(room.current);
            applyDelta(next, delta);
            room.deltas.put(a.streamPos(), Collections.unmodifiableMap(delta));
            room.current = Collections.unmodifiableMap(next);
        }
        room.lastPos = Math.max(room.lastPos, a.streamPos());
        if (EventTypes.REDACTION.equals(event.type())) {
            String target = Redactor.targetOf(event);
            if (target != null) {
                redactions.computeIfAbsent(target, t -> new CopyOnWriteArrayList<>()).add(event.eventId());
            }
        }
    }

    /** Records that rebuild the store as it is now. */
    private List<LogRecord> compacted() {
        List<LogRecord> out = new ArrayList<>(admissionOrder.size() + rooms.size());
        for (String id : admissionOrder) {
            StoredEvent s = events.get(id);
            String base = stateBase(s.event());
            Map<StateKey, String> current = Map.of();
            if (s.accepted()) {
                current = rooms.get(s.roomId()).deltas.getOrDefault(s.streamPos(), Map.of());
            }
            out.add(new LogRecord.Admission(s.event(), s.streamPos(), s.rejection(), base,
                    diff(stateOf(base), s.stateAfter()), null, current));
        }
        rooms.forEach((roomId, room) -> {
            out.add(new LogRecord.Heads(roomId, sorted(room.extremities)));
            if (!room.gaps.isEmpty()) out.add(new LogRecord.Gap(roomId, sorted(room.gaps), true));
        });
        cursors.forEach((device, perRoom) ->
                perRoom.forEach((roomId, pos) -> out.add(new LogRecord.Cursor(device, roomId, pos))));
        return out;
    }

    private void recover() {
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null) {
            loaded.records().forEach(this::apply);
            wal.deleteSegmentsBefore(loaded.walSegment());
        }
        int replayed = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                apply(RecordCodec.decode(payload));
                replayed++;
            }
        }
        if (loaded != null || replayed > 0) {
            log.info("Recovered " + events.size() + " events in " + rooms.size() + " rooms ("
                    + (loaded == null ? "no snapshot" : loaded.id()) + ", " + replayed + " WAL records)");
        }
    }

    // ---------- helpers ----------

    private RoomData room(String roomId) {
        return rooms.computeIfAbsent(roomId, RoomData::new);
    }

    /** First stored parent; its state is the base the event's state is encoded against. */
    private String stateBase(RoomEvent event) {
        for (String prev : event.prevEvents()) {
            if (events.containsKey(prev)) return prev;
        }
        return null;
    }

    private Map<StateKey, String> stateOf(String eventId) {
        if (eventId == null) return Map.of();
        StoredEvent s = events.get(eventId);
        return s == null ? Map.of() : s.stateAfter();
    }

    private static Map<StateKey, String> diff(Map<StateKey, String> base, Map<StateKey, String> target) {
        Map<StateKey, String> delta = new LinkedHashMap<>();
        target.forEach((k, v) -> {
            if (!v.equals(base.get(k))) delta.put(k, v);
        });
        for (StateKey k : base.keySet()) {
            if (!target.containsKey(k)) delta.put(k, null);
        }
        return delta;
    }

    private static void applyDelta(Map<StateKey, String> state, Map<StateKey, String> delta) {
        delta.forEach((k, v) -> {
            if (v == null) state.remove(k);
            else state.put(k, v);
        });
    }

    private static List<String> sorted(Collection<String> ids) {
        return List.copyOf(new TreeSet<>(ids));
    }

    /** Per-room indexes. Mutated only under the store monitor. */
    private static final class RoomData {
        final String roomId;
        final NavigableMap<Long, String> byPos = new ConcurrentSkipListMap<>();
        final NavigableMap<Long, Map<StateKey, String>> deltas = new ConcurrentSkipListMap<>();
        final Set<String> gaps = ConcurrentHashMap.newKeySet();
        volatile Set<String> extremities = Set.of();
        volatile Map<StateKey, String> current = Map.of();
        volatile long lastPos;

        RoomData(String roomId) {
            this.roomId = roomId;
        }
    }
}
