// file: server/src/main/java/io/hslite/server/federation/FederationExchange.java
package io.hslite.server.federation;

import io.hslite.core.RoomEvent;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Boundary to other servers. Transport, discovery and retries of delivery
 * belong to the implementation.
 */
public interface FederationExchange {

    /** A local event was admitted; send it to the other servers in the room. */
    void eventAdmitted(RoomEvent event);

    /** Ask peers for the given events and the ancestors this server lacks. */
    CompletableFuture<BackfillResponse> requestBackfill(String roomId, List<String> missingIds);

    /**
     * @param events    ancestors, oldest first
     * @param available false when no peer could answer
     */
    record BackfillResponse(List<RoomEvent> events, boolean available) {
        public BackfillResponse {
            events = List.copyOf(events);
        }

        public static BackfillResponse of(List<RoomEvent> events) {
            return new BackfillResponse(events, true);
        }

        public static BackfillResponse unavailable() {
            return new BackfillResponse(List.of(), false);
        }
    }
}
