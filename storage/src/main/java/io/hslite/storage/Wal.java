// file: storage/src/main/java/io/hslite/storage/Wal.java
package io.hslite.storage;

/**
 * Write-ahead log of admission records.
 * <p>
 * Contract:
 *  - append() is atomic per record: a partially written record is treated as
 *    absent during recovery (the reader stops at the first torn or corrupt record).
 *  - append() fsyncs before returning, so an admission acknowledged to a caller
 *    survives a crash.
 *  - segments are replayed in name order; after a snapshot the store rotates
 *    and deletes the segments the snapshot covers.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append one framed record and fsync it.
     *
     * @param serializedRecord header+payload bytes from {@link RecordCodec#frame(byte[])}
     */
    void append(byte[] serializedRecord);

    /** Start a new segment when the current one has reached its size limit. */
    void rotateIfNeeded();

    /**
     * Close the current segment and start a new one.
     *
     * @return file name of the new segment; records appended from now on live there or later
     */
    String rotate();

    /** Delete every segment whose name sorts before {@code segment}. */
    void deleteSegmentsBefore(String segment);

    /**
     * Sequential reader over all segments, oldest first. Stops at the first
     * corrupt header, truncated payload or CRC mismatch.
     */
    WalReader openReader();

    interface WalReader extends AutoCloseable {

        /** @return next valid payload (header stripped), or null at the end or at a torn tail */
        byte[] next();

        @Override
        void close();
    }
}
