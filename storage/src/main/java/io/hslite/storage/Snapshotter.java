// file: storage/src/main/java/io/hslite/storage/Snapshotter.java
package io.hslite.storage;

import java.util.List;

/**
 * Snapshots bound recovery time.
 * <p>
 * A snapshot is the compacted record sequence that rebuilds the whole store.
 * On restart the latest snapshot is replayed first, then the WAL segments
 * written after it.
 */
public interface Snapshotter {

    /**
     * Persist a full snapshot.
     *
     * @param walSegment first WAL segment NOT covered by the snapshot
     * @param records    records that rebuild the store as of the snapshot
     * @return snapshot identifier (file name)
     */
    String writeSnapshot(String walSegment, List<LogRecord> records);

    /** Latest snapshot, or null when none was written yet. */
    LoadedSnapshot loadLatest();

    /**
     * @param walSegment first WAL segment to replay after this snapshot
     */
    record LoadedSnapshot(String id, String walSegment, List<LogRecord> records) {}
}
