// file: core/src/main/java/io/hslite/core/EventBuilder.java
package io.hslite.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hslite.core.signing.EventSignatures;
import io.hslite.core.signing.ServerSigningKey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Fluent construction of a complete event: fills the content hash, signs
 * with the given server key (optional) and derives the event id.
 * <p>
 * Example:
 * <pre>
 *   RoomEvent msg = EventBuilder.event("!r:hs", "@a:hs", "m.room.message")
 *           .content(json)
 *           .prevEvents(List.of(head))
 *           .authEvents(authIds)
 *           .depth(7)
 *           .originServerTs(clock.millis())
 *           .build(signingKey);
 * </pre>
 */
public final class EventBuilder {
    private final String roomId;
    private final String sender;
    private final String type;
    private String stateKey;
    private ObjectNode content = JsonNodeFactory.instance.objectNode();
    private final List<String> prevEvents = new ArrayList<>();
    private final List<String> authEvents = new ArrayList<>();
    private long depth = 1;
    private long originServerTs;
    private String redacts;

    private EventBuilder(String roomId, String sender, String type) {
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.type = Objects.requireNonNull(type, "type");
    }

    public static EventBuilder event(String roomId, String sender, String type) {
        return new EventBuilder(roomId, sender, type);
    }

    public static EventBuilder state(String roomId, String sender, String type, String stateKey) {
        return new EventBuilder(roomId, sender, type).stateKey(stateKey);
    }

    public EventBuilder stateKey(String stateKey) {
        this.stateKey = stateKey;
        return this;
    }

    public EventBuilder content(JsonNode content) {
        if (content == null || !content.isObject()) {
            throw new MalformedEventException("content must be an object");
        }
        this.content = ((ObjectNode) content).deepCopy();
        return this;
    }

    /** Convenience for single-field content such as {"membership": "join"}. */
    public EventBuilder content(String field, String value) {
        this.content = JsonNodeFactory.instance.objectNode().put(field, value);
        return this;
    }

    public EventBuilder prevEvents(Collection<String> ids) {
        prevEvents.clear();
        prevEvents.addAll(ids);
        return this;
    }

    public EventBuilder authEvents(Collection<String> ids) {
        authEvents.clear();
        authEvents.addAll(ids);
        return this;
    }

    public EventBuilder depth(long depth) {
        this.depth = depth;
        return this;
    }

    public EventBuilder originServerTs(long ts) {
        this.originServerTs = ts;
        return this;
    }

    public EventBuilder redacts(String eventId) {
        this.redacts = eventId;
        return this;
    }

    /** Unsigned event; useful for tests and for servers without a key ring. */
    public RoomEvent build() {
        return build(null);
    }

    /** Hash, optionally sign, and derive the id. */
    public RoomEvent build(ServerSigningKey key) {
        JsonNodeFactory f = JsonNodeFactory.instance;
        ObjectNode json = f.objectNode();
        json.put("room_id", roomId);
        json.put("sender", sender);
        json.put("type", type);
        if (stateKey != null) {
            json.put("state_key", stateKey);
        }
        json.set("content", content.deepCopy());
        ArrayNode prev = json.putArray("prev_events");
        prevEvents.forEach(prev::add);
        ArrayNode auth = json.putArray("auth_events");
        authEvents.forEach(auth::add);
        json.put("depth", depth);
        json.put("origin_server_ts", originServerTs);
        if (redacts != null) {
            json.put("redacts", redacts);
        }
        json.putObject("hashes").put("sha256", EventHashes.contentHash(json));
        if (key != null) {
            EventSignatures.sign(json, key);
        }
        return RoomEvent.fromJson(json);
    }
}
