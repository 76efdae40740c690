// file: server/src/main/java/io/hslite/server/sync/SyncRequest.java
package io.hslite.server.sync;

import java.util.Objects;

/**
 * @param since     token from the previous response, or null for an initial sync
 * @param timeoutMs how long to wait for new data; 0 returns immediately
 */
public record SyncRequest(String userId, String deviceId, String since, long timeoutMs, SyncFilter filter) {

    public SyncRequest {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(deviceId, "deviceId");
        if (timeoutMs < 0) throw new IllegalArgumentException("timeout must be >= 0");
        filter = filter == null ? SyncFilter.NONE : filter;
    }
}
