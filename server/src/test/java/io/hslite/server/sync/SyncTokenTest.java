package io.hslite.server.sync;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SyncTokenTest {

    @Test
    void encoding_is_deterministic_regardless_of_map_order() {
        var a = new SyncToken(Map.of("!b:x", 7L, "!a:x", 3L), 12);
        var b = new SyncToken(Map.of("!a:x", 3L, "!b:x", 7L), 12);

        assertEquals(a.encode(), b.encode());
        assertTrue(a.encode().startsWith("s_"));
        assertFalse(a.encode().contains("="));
    }

    @Test
    void decode_restores_positions() {
        var token = SyncToken.decode(new SyncToken(Map.of("!a:x", 3L), 5).encode());

        assertEquals(3L, token.position("!a:x"));
        assertNull(token.position("!other:x"));
        assertEquals(5, token.ephemeral());
    }

    @Test
    void foreign_or_damaged_tokens_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> SyncToken.decode(null));
        assertThrows(IllegalArgumentException.class, () -> SyncToken.decode("t42"));
        assertThrows(IllegalArgumentException.class, () -> SyncToken.decode("s_!!!"));
        // valid base64 of {"r":{}} with no ephemeral serial
        assertThrows(IllegalArgumentException.class, () -> SyncToken.decode("s_eyJyIjp7fX0"));
        // negative room position
        assertThrows(IllegalArgumentException.class, () -> SyncToken.decode("s_eyJlIjowLCJyIjp7IiFhOngiOi0xfX0"));
    }
}
