// file: storage/src/main/java/io/hslite/storage/SnapshotPolicy.java
package io.hslite.storage;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Snapshot after every N durable writes. Bounds WAL replay length; ignores
 * file size and time.
 */
public final class SnapshotPolicy {
    private final int everyOps;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /** Count one durable write; true when a snapshot is due (the counter then restarts). */
    public boolean recordWrite() {
        if (sinceLast.incrementAndGet() >= everyOps) {
            sinceLast.set(0);
            return true;
        }
        return false;
    }
}
