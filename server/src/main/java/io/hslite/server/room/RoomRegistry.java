// file: server/src/main/java/io/hslite/server/room/RoomRegistry.java
package io.hslite.server.room;

import io.hslite.core.RoomEvent;
import io.hslite.storage.EventStore;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns one {@link RoomActor} per room, created on first use. All actors share
 * one executor. Registry-wide listeners see the updates of every room.
 */
public final class RoomRegistry {
    private static final Logger log = Logger.getLogger(RoomRegistry.class.getName());

    private final EventStore store;
    private final EventAdmitter admitter;
    private final EventFactory factory;
    private final Executor executor;
    private final Consumer<RoomEvent> onLocalAdmitted;

    private final Map<String, RoomActor> actors = new ConcurrentHashMap<>();
    private final List<Consumer<RoomUpdate>> listeners = new CopyOnWriteArrayList<>();

    public RoomRegistry(EventStore store,
                        EventAdmitter admitter,
                        EventFactory factory,
                        Executor executor,
                        Consumer<RoomEvent> onLocalAdmitted) {
        this.store = Objects.requireNonNull(store, "store");
        this.admitter = Objects.requireNonNull(admitter, "admitter");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.onLocalAdmitted = Objects.requireNonNull(onLocalAdmitted, "onLocalAdmitted");
    }

    /** Actor for {@code roomId}, created if needed (for rooms that arrive over federation). */
    public RoomActor actor(String roomId) {
        return actors.computeIfAbsent(roomId,
                id -> new RoomActor(id, store, admitter, factory, executor, this::fanOut, onLocalAdmitted));
    }

    /** Actor of a room that has a create event, or null. */
    public RoomActor existing(String roomId) {
        if (!actors.containsKey(roomId) && !store.hasRoom(roomId)) {
            return null;
        }
        RoomActor a = actor(roomId);
        return a.snapshot().exists() ? a : null;
    }

    /** Rooms known to the store. */
    public Set<String> rooms() {
        return store.rooms();
    }

    public void addListener(Consumer<RoomUpdate> listener) {
        listeners.add(listener);
    }

    private void fanOut(RoomUpdate update) {
        for (Consumer<RoomUpdate> l : listeners) {
            try {
                l.accept(update);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Update listener failed for room " + update.roomId(), e);
            }
        }
    }
}
