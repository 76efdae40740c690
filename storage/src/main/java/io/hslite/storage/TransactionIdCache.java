// file: storage/src/main/java/io/hslite/storage/TransactionIdCache.java
package io.hslite.storage;

import java.time.Duration;
import java.util.Optional;

/**
 * Remembers which event a client transaction produced.
 * <p>
 * Clients retry a send with the same transaction id after timeouts; the retry
 * must return the original event id instead of creating a second event.
 */
public interface TransactionIdCache {

    /** Event id recorded for (device, txnId) within the retention window. */
    Optional<String> lookup(String deviceId, String txnId);

    /**
     * Record the event for a transaction. If another event was recorded first,
     * that one wins and is returned.
     */
    String remember(String deviceId, String txnId, String eventId);

    /** Configure the retention window for newly recorded transactions. */
    void setTtl(Duration ttl);
}
