// file: server/src/main/java/io/hslite/server/sync/SyncSettings.java
package io.hslite.server.sync;

/** Server-side bounds for sync requests. */
public record SyncSettings(long defaultTimeoutMs, long maxTimeoutMs, int defaultTimelineLimit) {

    public static final SyncSettings DEFAULTS = new SyncSettings(0, 60_000, 20);

    public SyncSettings {
        if (defaultTimeoutMs < 0 || maxTimeoutMs < 0) throw new IllegalArgumentException("timeouts must be >= 0");
        if (defaultTimelineLimit <= 0) throw new IllegalArgumentException("defaultTimelineLimit must be > 0");
    }

    public long clampTimeout(Long requested) {
        long t = requested == null ? defaultTimeoutMs : requested;
        return Math.max(0, Math.min(t, maxTimeoutMs));
    }
}
