// file: server/src/main/java/io/hslite/server/federation/NoFederation.java
package io.hslite.server.federation;

import io.hslite.core.RoomEvent;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Exchange for a server without peers. */
public final class NoFederation implements FederationExchange {

    @Override
    public void eventAdmitted(RoomEvent event) {
        // no peers
    }

    @Override
    public CompletableFuture<BackfillResponse> requestBackfill(String roomId, List<String> missingIds) {
        return CompletableFuture.completedFuture(BackfillResponse.unavailable());
    }
}
