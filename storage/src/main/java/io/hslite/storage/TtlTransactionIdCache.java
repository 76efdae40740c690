// file: storage/src/main/java/io/hslite/storage/TtlTransactionIdCache.java
package io.hslite.storage;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TTL-bounded transaction id cache.
 * <p>
 * Semantics:
 *  - lookup() returns the event id while the entry is inside its TTL window;
 *  - remember() keeps the first live entry for a key (concurrent retries agree
 *    on one event id);
 *  - expired entries behave as absent and are removed lazily.
 * <p>
 * Backed by a ConcurrentHashMap of "device\ntxnId" -> (eventId, expireAtMillis).
 * Cleanup scans a bounded number of entries per write, no background thread.
 */
public final class TtlTransactionIdCache implements TransactionIdCache {
    private static final int SCAN_LIMIT = 64;

    private record Entry(String eventId, long expireAt) {}

    private final Map<String, Entry> seen = new ConcurrentHashMap<>();
    private final Clock clock;
    private volatile long ttlMillis;

    public TtlTransactionIdCache(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public TtlTransactionIdCache(Duration ttl, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        setTtl(ttl);
    }

    @Override
    public Optional<String> lookup(String deviceId, String txnId) {
        Entry e = seen.get(key(deviceId, txnId));
        if (e == null || e.expireAt() < clock.millis()) {
            return Optional.empty();
        }
        return Optional.of(e.eventId());
    }

    @Override
    public String remember(String deviceId, String txnId, String eventId) {
        Objects.requireNonNull(eventId, "eventId");
        long now = clock.millis();
        Entry fresh = new Entry(eventId, now + ttlMillis);
        Entry winner = seen.compute(key(deviceId, txnId),
                (k, old) -> (old != null && old.expireAt() >= now) ? old : fresh);
        maybeCleanup(now);
        return winner.eventId();
    }

    @Override
    public void setTtl(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        }
        this.ttlMillis = ttl.toMillis();
    }

    int size() {
        return seen.size();
    }

    private static String key(String deviceId, String txnId) {
        return Objects.requireNonNull(deviceId, "deviceId") + "\n" + Objects.requireNonNull(txnId, "txnId");
    }

    private void maybeCleanup(long now) {
        int scanned = 0;
        for (var it = seen.entrySet().iterator(); it.hasNext() && scanned < SCAN_LIMIT; scanned++) {
            if (it.next().getValue().expireAt() < now) {
                it.remove();
            }
        }
    }
}
