// file: server/src/main/java/io/hslite/server/room/RoomActor.java
package io.hslite.server.room;

import io.hslite.core.RoomEvent;
import io.hslite.core.StateKey;
import io.hslite.storage.EventStore;
import io.hslite.storage.StoredEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single writer for one room.
 * <p>
 * Submissions go into a FIFO mailbox that is drained on a shared executor by
 * at most one thread at a time, so admissions for a room never overlap while
 * different rooms proceed in parallel. Readers use the published
 * {@link RoomSnapshot} and never wait for the mailbox.
 * <p>
 * Listeners see every admitted event in stream order, before the submitter's
 * future completes.
 */
public final class RoomActor {
    private static final Logger log = Logger.getLogger(RoomActor.class.getName());

    /** Turns drained per executor task before yielding to other rooms. */
    private static final int BATCH = 32;

    public enum Phase { IDLE, ADMITTING }

    private final String roomId;
    private final EventStore store;
    private final EventAdmitter admitter;
    private final EventFactory factory;
    private final Executor executor;
    private final Consumer<RoomUpdate> fanOut;
    private final Consumer<RoomEvent> onLocalAdmitted;

    private final Queue<Runnable> mailbox = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean();
    private final List<Consumer<RoomUpdate>> listeners = new CopyOnWriteArrayList<>();

    private volatile RoomSnapshot snapshot;
    private volatile Phase phase = Phase.IDLE;

    RoomActor(String roomId,
              EventStore store,
              EventAdmitter admitter,
              EventFactory factory,
              Executor executor,
              Consumer<RoomUpdate> fanOut,
              Consumer<RoomEvent> onLocalAdmitted) {
        this.roomId = roomId;
        this.store = store;
        this.admitter = admitter;
        this.factory = factory;
        this.executor = executor;
        this.fanOut = fanOut;
        this.onLocalAdmitted = onLocalAdmitted;
        this.snapshot = RoomSnapshot.load(roomId, store);
    }

    public String roomId() {
        return roomId;
    }

    public Phase phase() {
        return phase;
    }

    public RoomSnapshot snapshot() {
        return snapshot;
    }

    public Map<StateKey, String> currentState() {
        return snapshot.state();
    }

    /** State of the room as of stream position {@code at}. */
    public Map<StateKey, String> resolvedState(long at) {
        return store.stateAt(roomId, at);
    }

    /** Admit an event built elsewhere (a peer server, or a client that built it itself). */
    public CompletableFuture<AdmissionResult> submit(RoomEvent event, EventOrigin origin) {
        return enqueue(() -> admitter.admit(event, origin, snapshot), origin == EventOrigin.LOCAL ? event : null);
    }

    /** Build a local event from the frontier at the time of its turn, then admit it. */
    public CompletableFuture<AdmissionResult> submitDraft(EventDraft draft) {
        CompletableFuture<AdmissionResult> future = new CompletableFuture<>();
        mailbox.add(() -> {
            RoomEvent event;
            try {
                event = factory.build(draft, snapshot);
            } catch (RuntimeException e) {
                future.complete(new AdmissionResult.Rejected(null, AdmissionResult.Kind.MALFORMED,
                        e.getMessage(), false));
                return;
            }
            guarded(future, () -> runTurn(admitter.admit(event, EventOrigin.LOCAL, snapshot), event, future));
        });
        schedule();
        return future;
    }

    public RoomSubscription subscribe(Consumer<RoomUpdate> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /** Admitted events after {@code streamPos}, for subscribers resuming from a checkpoint. */
    public List<RoomUpdate> updatesSince(long streamPos) {
        List<RoomUpdate> out = new ArrayList<>();
        long upTo = snapshot.streamPos();
        long pos = streamPos;
        while (pos < upTo) {
            List<StoredEvent> page = store.eventsAfter(roomId, pos, 256);
            if (page.isEmpty()) break;
            for (StoredEvent s : page) {
                if (s.streamPos() > upTo) return out;
                Map<StateKey, String> delta = EventAdmitter.diff(
                        store.stateAt(roomId, s.streamPos() - 1), store.stateAt(roomId, s.streamPos()));
                out.add(new RoomUpdate(roomId, s.streamPos(), s.event(), delta));
                pos = s.streamPos();
            }
        }
        return out;
    }

    // ---------- mailbox ----------

    private CompletableFuture<AdmissionResult> enqueue(Supplier<EventAdmitter.Outcome> turn, RoomEvent localEvent) {
        CompletableFuture<AdmissionResult> future = new CompletableFuture<>();
        mailbox.add(() -> guarded(future, () -> runTurn(turn.get(), localEvent, future)));
        schedule();
        return future;
    }

    /** Run a turn; a failure fails the submitter's future and leaves the room as it was. */
    private void guarded(CompletableFuture<AdmissionResult> future, Runnable turn) {
        try {
            turn.run();
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "Admission turn failed in " + roomId, e);
            future.completeExceptionally(e);
        }
    }

    private void runTurn(EventAdmitter.Outcome outcome, RoomEvent localEvent,
                         CompletableFuture<AdmissionResult> future) {
        snapshot = outcome.snapshot();
        if (outcome.update() != null) {
            publish(outcome.update());
            if (localEvent != null) {
                notifyFederation(localEvent);
            }
        }
        future.complete(outcome.result());
    }

    private void publish(RoomUpdate update) {
        for (Consumer<RoomUpdate> l : listeners) {
            deliver(l, update);
        }
        deliver(fanOut, update);
    }

    private void deliver(Consumer<RoomUpdate> listener, RoomUpdate update) {
        try {
            listener.accept(update);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Room listener failed for " + update.event().eventId(), e);
        }
    }

    private void notifyFederation(RoomEvent event) {
        try {
            onLocalAdmitted.accept(event);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Federation notification failed for " + event.eventId(), e);
        }
    }

    private void schedule() {
        if (scheduled.compareAndSet(false, true)) {
            executor.execute(this::drain);
        }
    }

    private void drain() {
        try {
            for (int i = 0; i < BATCH; i++) {
                Runnable turn = mailbox.poll();
                if (turn == null) break;
                phase = Phase.ADMITTING;
                try {
                    turn.run();
                } finally {
                    phase = Phase.IDLE;
                }
            }
        } finally {
            scheduled.set(false);
            if (!mailbox.isEmpty()) {
                schedule();
            }
        }
    }
}
