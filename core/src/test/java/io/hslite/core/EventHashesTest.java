// file: core/src/test/java/io/hslite/core/EventHashesTest.java
package io.hslite.core;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventHashesTest {

    private static RoomEvent message(String body) {
        return EventBuilder.event("!r:a.test", "@alice:a.test", EventTypes.MESSAGE)
                .content(TestRoom.json().put("body", body))
                .prevEvents(List.of("$parent"))
                .authEvents(List.of("$create"))
                .depth(2)
                .originServerTs(42)
                .build();
    }

    @Test
    void canonical_json_sorts_keys_and_drops_whitespace() {
        var json = CanonicalJson.parse("{ \"b\": 1, \"a\": {\"d\": [1, 2], \"c\": \"x\"} }".getBytes(StandardCharsets.UTF_8));
        assertEquals("{\"a\":{\"c\":\"x\",\"d\":[1,2]},\"b\":1}", CanonicalJson.encodeToString(json));
    }

    @Test
    void invalid_json_is_malformed() {
        assertThrows(MalformedEventException.class, () -> CanonicalJson.parse("{nope".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void event_id_is_derived_from_content_and_stable() {
        var a = message("hello");
        var b = message("hello");
        var c = message("hello!");

        assertTrue(a.eventId().startsWith("$"));
        assertEquals(a.eventId(), b.eventId());
        assertNotEquals(a.eventId(), c.eventId());
        assertTrue(a.hasValidId());
        assertTrue(a.hasValidContentHash());
    }

    @Test
    void event_id_commits_to_prev_events() {
        var a = message("hello");
        ObjectNode json = a.toJson();
        json.remove("event_id");
        json.putArray("prev_events").add("$other");
        assertNotEquals(a.eventId(), RoomEvent.fromJson(json).eventId());
    }

    @Test
    void tampered_content_fails_hash_and_id_checks() {
        ObjectNode json = message("hello").toJson();
        ((ObjectNode) json.get("content")).put("body", "tampered");
        var forged = RoomEvent.fromJson(json);

        assertFalse(forged.hasValidContentHash());
        assertFalse(forged.hasValidId());
    }

    @Test
    void structurally_invalid_events_are_rejected() {
        ObjectNode json = message("x").toJson();
        json.put("depth", 0);
        assertThrows(MalformedEventException.class, () -> RoomEvent.fromJson(json));

        ObjectNode noSender = message("x").toJson();
        noSender.remove("sender");
        assertThrows(MalformedEventException.class, () -> RoomEvent.fromJson(noSender));

        ObjectNode dupPrev = message("x").toJson();
        dupPrev.putArray("prev_events").add("$a").add("$a");
        assertThrows(MalformedEventException.class, () -> RoomEvent.fromJson(dupPrev));
    }

    @Test
    void storage_bytes_round_trip_to_an_equal_event() {
        var e = message("persist me");
        assertEquals(e, RoomEvent.fromBytes(e.toCanonicalBytes()));
    }

    @Test
    void equality_ignores_signatures_but_not_content() {
        var e = message("same");
        ObjectNode signed = e.toJson();
        signed.putObject("signatures").putObject("a.test").put("ed25519:k", "c2ln");
        assertEquals(e, RoomEvent.fromJson(signed));

        ObjectNode edited = e.toJson();
        ((ObjectNode) edited.get("content")).put("body", "different");
        edited.put("event_id", e.eventId());
        assertNotEquals(e, RoomEvent.fromJson(edited));
    }
}
