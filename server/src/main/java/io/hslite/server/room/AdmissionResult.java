// file: server/src/main/java/io/hslite/server/room/AdmissionResult.java
package io.hslite.server.room;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Outcome of submitting one event to a room.
 */
public sealed interface AdmissionResult
        permits AdmissionResult.Admitted, AdmissionResult.Duplicate,
                AdmissionResult.Rejected, AdmissionResult.GraphGap {

    /** Event id the result refers to, when known. */
    String eventId();

    record Admitted(String eventId, long streamPos) implements AdmissionResult {}

    /** The event was already stored; nothing changed. */
    record Duplicate(String eventId, long streamPos) implements AdmissionResult {}

    /**
     * The event was refused.
     *
     * @param softFailed true when the event was kept as a rejected record
     *                   (federation origin) instead of being dropped
     */
    record Rejected(String eventId, Kind kind, String reason, boolean softFailed) implements AdmissionResult {}

    /**
     * Some prev or auth events are not stored locally.
     *
     * @param backfill completion of the backfill fired for the missing ids,
     *                 or null when none was requested
     */
    record GraphGap(String eventId, List<String> missing, CompletableFuture<Boolean> backfill)
            implements AdmissionResult {
        public GraphGap {
            missing = List.copyOf(missing);
        }

        public GraphGap withBackfill(CompletableFuture<Boolean> future) {
            return new GraphGap(eventId, missing, future);
        }
    }

    enum Kind {
        MALFORMED,
        AUTH,
        RESOLUTION_FAILURE
    }

    default boolean isAccepted() {
        return this instanceof Admitted || this instanceof Duplicate;
    }
}
