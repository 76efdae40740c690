// file: server/src/main/java/io/hslite/server/RequestLogger.java
package io.hslite.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One log line per HTTP request.
 *
 * Responsibilities:
 *  - Central place to log method/path/status and latency.
 *  - Separate the time spent in the room/sync core from the total.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method      HTTP method (GET, PUT, POST, etc.)
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     * @param coreMillis  time spent in the room or sync core, or -1 if not measured
     * @param error       optional exception (for 5xx logging), null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long coreMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                coreMillis >= 0 ? ", core=" + coreMillis + "ms" : ""
        );

        if (error != null && status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else if (error != null) {
            log.log(Level.INFO, msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
