// file: server/src/main/java/io/hslite/server/federation/FederationReceiver.java
package io.hslite.server.federation;

import io.hslite.core.RoomEvent;
import io.hslite.server.room.AdmissionResult;
import io.hslite.server.room.EventOrigin;
import io.hslite.server.room.RoomActor;
import io.hslite.server.room.RoomRegistry;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for events pushed by other servers. Same contract as a local
 * submission, except that a gap triggers backfill and one re-submission.
 */
public final class FederationReceiver {
    private final RoomRegistry rooms;
    private final BackfillCoordinator backfill;

    public FederationReceiver(RoomRegistry rooms, BackfillCoordinator backfill) {
        this.rooms = Objects.requireNonNull(rooms, "rooms");
        this.backfill = Objects.requireNonNull(backfill, "backfill");
    }

    public CompletableFuture<AdmissionResult> receivePdu(String roomId, RoomEvent event) {
        if (!event.roomId().equals(roomId)) {
            return CompletableFuture.completedFuture(new AdmissionResult.Rejected(event.eventId(),
                    AdmissionResult.Kind.MALFORMED, "event belongs to " + event.roomId(), false));
        }
        RoomActor actor = rooms.actor(roomId);
        return actor.submit(event, EventOrigin.FEDERATION).thenCompose(r -> {
            if (!(r instanceof AdmissionResult.GraphGap gap)) {
                return CompletableFuture.completedFuture(r);
            }
            CompletableFuture<Boolean> filled = backfill.backfill(roomId, gap.missing());
            return filled.thenCompose(ok -> ok
                    ? actor.submit(event, EventOrigin.FEDERATION)
                    : CompletableFuture.completedFuture(gap.withBackfill(filled)));
        });
    }
}
