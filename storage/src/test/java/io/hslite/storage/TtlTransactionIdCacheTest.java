// file: storage/src/test/java/io/hslite/storage/TtlTransactionIdCacheTest.java
package io.hslite.storage;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TtlTransactionIdCacheTest {

    /** Clock that only moves when told to. */
    static final class ManualClock extends Clock {
        private long millis = 1_000_000;

        void advance(Duration d) {
            millis += d.toMillis();
        }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }

        @Override public Clock withZone(ZoneId zone) { return this; }

        @Override public Instant instant() { return Instant.ofEpochMilli(millis); }
    }

    @Test
    void retry_within_ttl_returns_original_event() {
        var clock = new ManualClock();
        var cache = new TtlTransactionIdCache(Duration.ofMinutes(1), clock);

        assertTrue(cache.lookup("DEV", "t1").isEmpty());
        assertEquals("$first", cache.remember("DEV", "t1", "$first"));
        // a racing retry that built another event loses
        assertEquals("$first", cache.remember("DEV", "t1", "$second"));
        assertEquals("$first", cache.lookup("DEV", "t1").orElseThrow());
    }

    @Test
    void transactions_are_scoped_per_device() {
        var cache = new TtlTransactionIdCache(Duration.ofMinutes(1), new ManualClock());
        cache.remember("DEV1", "t1", "$a");
        assertTrue(cache.lookup("DEV2", "t1").isEmpty());
    }

    @Test
    void entries_expire_after_ttl() {
        var clock = new ManualClock();
        var cache = new TtlTransactionIdCache(Duration.ofSeconds(10), clock);
        cache.remember("DEV", "t1", "$a");

        clock.advance(Duration.ofSeconds(11));
        assertTrue(cache.lookup("DEV", "t1").isEmpty());
        assertEquals("$b", cache.remember("DEV", "t1", "$b"));
    }

    @Test
    void non_positive_ttl_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new TtlTransactionIdCache(Duration.ZERO));
    }
}
