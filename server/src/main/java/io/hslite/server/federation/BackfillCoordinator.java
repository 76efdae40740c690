// file: server/src/main/java/io/hslite/server/federation/BackfillCoordinator.java
package io.hslite.server.federation;

import io.hslite.core.RoomEvent;
import io.hslite.server.room.AdmissionResult;
import io.hslite.server.room.EventOrigin;
import io.hslite.server.room.RoomActor;
import io.hslite.server.room.RoomRegistry;
import io.hslite.storage.EventStore;
import io.hslite.storage.StoredEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fetches missing ancestors from peers and admits them oldest first.
 * <p>
 * Each attempt asks the exchange for the ids still missing. Failed or
 * incomplete attempts are retried per {@link RetryPolicy}; when attempts run
 * out, the still-missing ids are recorded as a durable gap marker.
 */
public final class BackfillCoordinator {
    private static final Logger log = Logger.getLogger(BackfillCoordinator.class.getName());

    private final FederationExchange exchange;
    private final RoomRegistry rooms;
    private final EventStore store;
    private final RetryPolicy policy;
    private final ScheduledExecutorService scheduler;

    public BackfillCoordinator(FederationExchange exchange,
                               RoomRegistry rooms,
                               EventStore store,
                               RetryPolicy policy,
                               ScheduledExecutorService scheduler) {
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.rooms = Objects.requireNonNull(rooms, "rooms");
        this.store = Objects.requireNonNull(store, "store");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Backfill {@code missingIds} into {@code roomId}.
     *
     * @return true when every id is stored afterwards
     */
    public CompletableFuture<Boolean> backfill(String roomId, List<String> missingIds) {
        return attempt(roomId, List.copyOf(missingIds), 1);
    }

    private CompletableFuture<Boolean> attempt(String roomId, List<String> wanted, int attempt) {
        return delay(policy.delayBefore(attempt))
                .thenCompose(v -> exchange.requestBackfill(roomId, stillMissing(wanted)))
                .thenCompose(resp -> admitAll(roomId, resp.events()))
                .handle((v, err) -> {
                    if (err != null) {
                        log.log(Level.INFO, "Backfill attempt " + attempt + " for " + roomId + " failed", err);
                    }
                    return stillMissing(wanted);
                })
                .thenCompose(left -> {
                    if (left.isEmpty()) {
                        store.clearGap(roomId, wanted);
                        return CompletableFuture.completedFuture(true);
                    }
                    if (attempt >= policy.maxAttempts()) {
                        log.info("Backfill for " + roomId + " gave up after " + attempt
                                + " attempts; still missing " + left);
                        store.recordGap(roomId, left);
                        return CompletableFuture.completedFuture(false);
                    }
                    return attempt(roomId, wanted, attempt + 1);
                });
    }

    private CompletableFuture<Void> admitAll(String roomId, List<RoomEvent> events) {
        List<RoomEvent> ordered = new ArrayList<>(events);
        ordered.sort(Comparator.comparingLong(RoomEvent::depth).thenComparing(RoomEvent::eventId));
        RoomActor actor = rooms.actor(roomId);
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (RoomEvent e : ordered) {
            if (!e.roomId().equals(roomId)) continue;
            chain = chain.thenCompose(v -> actor.submit(e, EventOrigin.FEDERATION))
                    .thenAccept(r -> {
                        if (r instanceof AdmissionResult.GraphGap) {
                            log.fine("Backfilled " + e.eventId() + " still has a gap: " + r);
                        }
                    });
        }
        return chain;
    }

    private List<String> stillMissing(List<String> ids) {
        List<String> out = new ArrayList<>();
        for (String id : ids) {
            StoredEvent s = store.get(id);
            if (s == null) out.add(id);
        }
        return out;
    }

    private CompletableFuture<Void> delay(Duration d) {
        if (d.isZero()) return CompletableFuture.completedFuture(null);
        CompletableFuture<Void> f = new CompletableFuture<>();
        scheduler.schedule(() -> f.complete(null), d.toMillis(), TimeUnit.MILLISECONDS);
        return f;
    }
}
