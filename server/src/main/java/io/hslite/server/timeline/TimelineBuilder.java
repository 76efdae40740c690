// file: server/src/main/java/io/hslite/server/timeline/TimelineBuilder.java
package io.hslite.server.timeline;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hslite.core.Redactor;
import io.hslite.core.RoomEvent;
import io.hslite.core.RoomVersion;
import io.hslite.core.StateKey;
import io.hslite.core.auth.AuthState;
import io.hslite.core.auth.PowerLevels;
import io.hslite.storage.EventStore;
import io.hslite.storage.StoredEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Client-facing view of a room's history in stream order.
 * <p>
 * Every listed event has all of its prev events accepted: admission turns a
 * missing ancestor into backfill and refuses a rejected one. Ancestors that
 * backfill could not fetch are reported with each page as gap markers.
 * <p>
 * Redactions are applied here, at read time: the stored event never changes,
 * but a redaction admitted by the room and allowed by the power levels at the
 * redaction hides the target's content.
 */
public final class TimelineBuilder {
    public static final int MAX_LIMIT = 1000;

    private final EventStore store;

    public TimelineBuilder(EventStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * One page of events starting at {@code from} (null: the live end for
     * backward paging, the room start for forward paging).
     */
    public TimelinePage page(String roomId, PaginationToken from, int limit, Direction dir) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        int n = Math.min(limit, MAX_LIMIT);
        long head = store.currentPosition(roomId);

        List<StoredEvent> stored;
        PaginationToken start;
        if (dir == Direction.BACKWARD) {
            start = from != null ? from : new PaginationToken(head);
            stored = store.eventsBefore(roomId, Math.min(start.streamPos(), head) + 1, n);
        } else {
            start = from != null ? from : new PaginationToken(0);
            stored = store.eventsAfter(roomId, start.streamPos(), n);
        }

        List<TimelineEntry> entries = new ArrayList<>(stored.size());
        for (StoredEvent s : stored) {
            entries.add(entry(s));
        }
        PaginationToken end = null;
        if (!stored.isEmpty()) {
            long last = stored.get(stored.size() - 1).streamPos();
            end = dir == Direction.BACKWARD ? new PaginationToken(last - 1) : new PaginationToken(last);
        }
        return new TimelinePage(entries, start, end, store.gaps(roomId));
    }

    /** Events with positions in {@code (afterPos, upToPos]}, ascending. */
    public List<TimelineEntry> range(String roomId, long afterPos, long upToPos) {
        List<TimelineEntry> out = new ArrayList<>();
        long pos = afterPos;
        while (pos < upToPos) {
            List<StoredEvent> batch = store.eventsAfter(roomId, pos, (int) Math.min(MAX_LIMIT, upToPos - pos));
            if (batch.isEmpty()) break;
            for (StoredEvent s : batch) {
                if (s.streamPos() > upToPos) return out;
                out.add(entry(s));
                pos = s.streamPos();
            }
        }
        return out;
    }

    public TimelineEntry entry(StoredEvent s) {
        return new TimelineEntry(s.streamPos(), s.event(), render(s));
    }

    /** Client JSON of a stored event, redacted when an effective redaction exists. */
    public ObjectNode render(StoredEvent s) {
        RoomEvent event = s.event();
        List<String> redactions = store.redactionsOf(event.eventId());
        if (!redactions.isEmpty()) {
            RoomVersion version = versionOf(event.roomId());
            for (String rid : redactions) {
                StoredEvent r = store.get(rid);
                if (r == null || !r.accepted()) continue;
                PowerLevels pl = AuthState.ofIds(r.stateAfter(), store).powerLevels(version);
                if (Redactor.canRedact(r.event(), event, pl)) {
                    return Redactor.redactedJson(event, version, rid);
                }
            }
        }
        return event.toJson();
    }

    /** Client JSON of an accepted event by id, or null. */
    public ObjectNode render(String eventId) {
        StoredEvent s = store.get(eventId);
        return (s == null || !s.accepted()) ? null : render(s);
    }

    private RoomVersion versionOf(String roomId) {
        String createId = store.currentState(roomId).get(StateKey.create());
        RoomEvent create = createId == null ? null : store.find(createId);
        return create == null ? RoomVersion.DEFAULT : RoomVersion.of(create);
    }
}
