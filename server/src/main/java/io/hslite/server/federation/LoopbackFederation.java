// file: server/src/main/java/io/hslite/server/federation/LoopbackFederation.java
package io.hslite.server.federation;

import io.hslite.core.RoomEvent;
import io.hslite.server.Homeserver;
import io.hslite.server.room.AdmissionResult;
import io.hslite.storage.StoredEvent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process federation between homeservers of one JVM.
 * <p>
 * Every admitted local event is pushed to every other registered server.
 * Backfill answers from the peers' stores, walking prev and auth edges back
 * until it reaches events the requester already has. Deliveries can be held
 * and released to stage concurrent histories.
 */
public final class LoopbackFederation {
    private static final Logger log = Logger.getLogger(LoopbackFederation.class.getName());

    private final Map<String, Homeserver> servers = new ConcurrentHashMap<>();
    private final Set<CompletableFuture<AdmissionResult>> inFlight = ConcurrentHashMap.newKeySet();
    private final List<Runnable> held = new ArrayList<>();
    private boolean holding;   // guarded by held

    /** Exchange used by the server named {@code serverName}; peers are looked up per call. */
    public FederationExchange exchangeFor(String serverName) {
        return new Link(serverName);
    }

    /** Join {@code server} to the federation and exchange signing keys with the other members. */
    public void register(Homeserver server) {
        for (Homeserver peer : servers.values()) {
            peer.keyRing().register(server.serverName(), server.signingKey().keyId(),
                    server.signingKey().encodedPublicKey());
            server.keyRing().register(peer.serverName(), peer.signingKey().keyId(),
                    peer.signingKey().encodedPublicKey());
        }
        servers.put(server.serverName(), server);
    }

    /** Queue deliveries instead of sending them. */
    public void hold() {
        synchronized (held) {
            holding = true;
        }
    }

    /** Send everything queued since {@link #hold()} and stop queueing. */
    public void release() {
        List<Runnable> queued;
        synchronized (held) {
            holding = false;
            queued = new ArrayList<>(held);
            held.clear();
        }
        queued.forEach(Runnable::run);
    }

    /**
     * Wait until every sent delivery, and the deliveries those caused, is
     * admitted or rejected.
     */
    public void awaitDeliveries(long timeoutMs) throws Exception {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (!inFlight.isEmpty()) {
            long left = deadline - System.currentTimeMillis();
            if (left <= 0) {
                throw new TimeoutException(inFlight.size() + " deliveries still pending");
            }
            CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0]))
                    .exceptionally(e -> null)
                    .get(left, TimeUnit.MILLISECONDS);
        }
    }

    private void deliver(String from, RoomEvent event) {
        for (Homeserver peer : servers.values()) {
            if (peer.serverName().equals(from)) continue;
            Runnable send = () -> {
                CompletableFuture<AdmissionResult> f = peer.receiver().receivePdu(event.roomId(), event);
                inFlight.add(f);
                f.whenComplete((r, err) -> {
                    inFlight.remove(f);
                    if (err != null) {
                        log.log(Level.WARNING, "Delivery of " + event.eventId() + " to " + peer.serverName()
                                + " failed", err);
                    } else if (!r.isAccepted()) {
                        log.fine("Delivery of " + event.eventId() + " to " + peer.serverName() + ": " + r);
                    }
                });
            };
            synchronized (held) {
                if (holding) {
                    held.add(send);
                    continue;
                }
            }
            send.run();
        }
    }

    private List<RoomEvent> ancestors(String requester, String roomId, List<String> missingIds) {
        Homeserver self = servers.get(requester);
        Map<String, RoomEvent> found = new LinkedHashMap<>();
        Deque<String> todo = new ArrayDeque<>(missingIds);
        Set<String> seen = new HashSet<>();
        while (!todo.isEmpty()) {
            String id = todo.pop();
            if (!seen.add(id)) continue;
            if (self != null && self.store().get(id) != null) continue;
            RoomEvent e = findAtPeers(requester, id);
            if (e == null || !e.roomId().equals(roomId)) continue;
            found.put(id, e);
            todo.addAll(e.prevEvents());
            todo.addAll(e.authEvents());
        }
        List<RoomEvent> out = new ArrayList<>(found.values());
        out.sort(Comparator.comparingLong(RoomEvent::depth).thenComparing(RoomEvent::eventId));
        return out;
    }

    private RoomEvent findAtPeers(String requester, String eventId) {
        for (Homeserver peer : servers.values()) {
            if (peer.serverName().equals(requester)) continue;
            StoredEvent s = peer.store().get(eventId);
            if (s != null) return s.event();
        }
        return null;
    }

    private final class Link implements FederationExchange {
        private final String serverName;

        Link(String serverName) {
            this.serverName = serverName;
        }

        @Override
        public void eventAdmitted(RoomEvent event) {
            deliver(serverName, event);
        }

        @Override
        public CompletableFuture<BackfillResponse> requestBackfill(String roomId, List<String> missingIds) {
            if (servers.size() < 2) {
                return CompletableFuture.completedFuture(BackfillResponse.unavailable());
            }
            return CompletableFuture.supplyAsync(() -> {
                List<RoomEvent> events = ancestors(serverName, roomId, missingIds);
                return events.isEmpty() ? BackfillResponse.unavailable() : BackfillResponse.of(events);
            });
        }
    }
}
