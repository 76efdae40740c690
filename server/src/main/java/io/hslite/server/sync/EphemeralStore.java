// file: server/src/main/java/io/hslite/server/sync/EphemeralStore.java
package io.hslite.server.sync;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hslite.core.EventTypes;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Typing notifications and read receipts. Nothing here is durable.
 * <p>
 * Every change bumps a global serial; sync tokens carry the serial they
 * saw. Memory is bounded: at most {@code maxRooms} rooms and
 * {@code maxPerRoom} users per room are kept, oldest first out. Typing
 * entries expire on their own timeout.
 */
public final class EphemeralStore {
    private static final Logger log = Logger.getLogger(EphemeralStore.class.getName());

    private final Clock clock;
    private final int maxRooms;
    private final int maxPerRoom;
    private final Map<String, RoomEphemeral> rooms;
    private final List<Consumer<String>> listeners = new CopyOnWriteArrayList<>();
    private long serial;   // guarded by this

    public EphemeralStore(Clock clock, int maxRooms, int maxPerRoom) {
        if (maxRooms <= 0 || maxPerRoom <= 0) {
            throw new IllegalArgumentException("bounds must be > 0");
        }
        this.clock = clock;
        this.maxRooms = maxRooms;
        this.maxPerRoom = maxPerRoom;
        this.rooms = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, RoomEphemeral> eldest) {
                return size() > EphemeralStore.this.maxRooms;
            }
        };
    }

    public EphemeralStore(Clock clock) {
        this(clock, 10_000, 1_000);
    }

    private final class RoomEphemeral {
        final Map<String, Long> typingUntil = bounded();
        final Map<String, Receipt> receipts = bounded();
        long changedAt;
    }

    private record Receipt(String eventId, long ts) {}

    private <V> Map<String, V> bounded() {
        return new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, V> eldest) {
                return size() > maxPerRoom;
            }
        };
    }

    public void addListener(Consumer<String> roomListener) {
        listeners.add(roomListener);
    }

    public synchronized long serial() {
        return serial;
    }

    public void setTyping(String roomId, String userId, boolean typing, long timeoutMs) {
        synchronized (this) {
            RoomEphemeral r = room(roomId);
            if (typing) {
                r.typingUntil.remove(userId);
                r.typingUntil.put(userId, clock.millis() + Math.max(0, timeoutMs));
            } else if (r.typingUntil.remove(userId) == null) {
                return;
            }
            r.changedAt = ++serial;
        }
        notifyListeners(roomId);
    }

    public void receipt(String roomId, String userId, String eventId) {
        synchronized (this) {
            RoomEphemeral r = room(roomId);
            r.receipts.remove(userId);
            r.receipts.put(userId, new Receipt(eventId, clock.millis()));
            r.changedAt = ++serial;
        }
        notifyListeners(roomId);
    }

    /**
     * Current typing and receipt events of a room when they changed after
     * {@code sinceSerial}; otherwise empty.
     */
    public synchronized List<ObjectNode> eventsSince(String roomId, long sinceSerial) {
        RoomEphemeral r = rooms.get(roomId);
        List<ObjectNode> out = new ArrayList<>(2);
        if (r == null || r.changedAt <= sinceSerial) {
            return out;
        }
        JsonNodeFactory f = JsonNodeFactory.instance;
        long now = clock.millis();
        r.typingUntil.values().removeIf(until -> until <= now);

        ObjectNode typing = f.objectNode().put("type", EventTypes.TYPING);
        var ids = typing.putObject("content").putArray("user_ids");
        new TreeSet<>(r.typingUntil.keySet()).forEach(ids::add);
        out.add(typing);

        if (!r.receipts.isEmpty()) {
            ObjectNode receipt = f.objectNode().put("type", EventTypes.RECEIPT);
            ObjectNode content = receipt.putObject("content");
            r.receipts.forEach((user, rc) -> {
                ObjectNode byEvent = content.has(rc.eventId())
                        ? (ObjectNode) content.get(rc.eventId())
                        : content.putObject(rc.eventId());
                ObjectNode read = byEvent.has("m.read") ? (ObjectNode) byEvent.get("m.read") : byEvent.putObject("m.read");
                read.putObject(user).put("ts", rc.ts());
            });
            out.add(receipt);
        }
        return out;
    }

    private RoomEphemeral room(String roomId) {
        return rooms.computeIfAbsent(roomId, id -> new RoomEphemeral());
    }

    private void notifyListeners(String roomId) {
        for (Consumer<String> l : listeners) {
            try {
                l.accept(roomId);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Ephemeral listener failed for " + roomId, e);
            }
        }
    }
}
