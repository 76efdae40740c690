// file: server/src/main/java/io/hslite/server/federation/RetryPolicy.java
package io.hslite.server.federation;

import java.time.Duration;

/**
 * Bounded exponential backoff: attempt 1 runs at once, attempt n waits
 * {@code initialBackoff * multiplier^(n-2)}.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofMillis(200), 2.0);

    public RetryPolicy {
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be >= 0");
        }
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1");
    }

    /** Delay before {@code attempt} (1-based). */
    public Duration delayBefore(int attempt) {
        if (attempt <= 1) return Duration.ZERO;
        double ms = initialBackoff.toMillis() * Math.pow(multiplier, attempt - 2);
        return Duration.ofMillis((long) Math.min(ms, Long.MAX_VALUE / 2.0));
    }
}
