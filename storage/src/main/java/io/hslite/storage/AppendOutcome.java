// file: storage/src/main/java/io/hslite/storage/AppendOutcome.java
package io.hslite.storage;

/**
 * Result of {@link EventStore#append}.
 */
public sealed interface AppendOutcome permits AppendOutcome.Stored, AppendOutcome.Duplicate, AppendOutcome.Rejected {

    /** Accepted and assigned a stream position. */
    record Stored(long streamPos) implements AppendOutcome {}

    /** Same id and content already stored; nothing changed. */
    record Duplicate(StoredEvent existing) implements AppendOutcome {}

    /** Kept as a rejected record; never part of state, timeline or extremities. */
    record Rejected(String reason) implements AppendOutcome {}
}
