// file: core/src/main/java/io/hslite/core/RoomEvent.java
package io.hslite.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable room event (PDU).
 * <p>
 * The full JSON tree is kept as the source of truth for hashing and signing;
 * typed accessors are parsed from it once at construction. Events reference
 * each other only by id (prev_events, auth_events); resolving an id to an
 * event always goes through a store lookup.
 * <p>
 * Invariants:
 *  - never mutated after construction; JSON and content are copied on the way out,
 *  - {@code eventId} is either the id carried by the JSON or, when absent,
 *    the reference hash computed from the content.
 */
public final class RoomEvent {
    private final ObjectNode json;
    private final String eventId;
    private final String roomId;
    private final String sender;
    private final String type;
    private final String stateKey;
    private final ObjectNode content;
    private final List<String> prevEvents;
    private final List<String> authEvents;
    private final long depth;
    private final long originServerTs;
    private final Map<String, String> hashes;
    private final Map<String, Map<String, String>> signatures;
    private final String redacts;

    private RoomEvent(ObjectNode json) {
        this.json = json;
        this.roomId = requireText(json, "room_id");
        this.sender = requireText(json, "sender");
        this.type = requireText(json, "type");
        this.stateKey = optionalText(json, "state_key");
        this.redacts = optionalText(json, "redacts");

        JsonNode c = json.get("content");
        if (c == null || !c.isObject()) {
            throw new MalformedEventException("content must be an object");
        }
        this.content = (ObjectNode) c;
        this.prevEvents = idList(json, "prev_events");
        this.authEvents = idList(json, "auth_events");

        JsonNode d = json.get("depth");
        if (d == null || !d.canConvertToLong() || !d.isIntegralNumber()) {
            throw new MalformedEventException("depth must be an integer");
        }
        this.depth = d.asLong();
        if (depth < 1) {
            throw new MalformedEventException("depth must be >= 1");
        }
        JsonNode ts = json.get("origin_server_ts");
        if (ts == null || !ts.isIntegralNumber()) {
            throw new MalformedEventException("origin_server_ts must be an integer");
        }
        this.originServerTs = ts.asLong();

        this.hashes = stringMap(json.get("hashes"), "hashes");
        this.signatures = signatureMap(json.get("signatures"));

        if (!roomId.startsWith("!") || roomId.indexOf(':') < 0) {
            throw new MalformedEventException("room_id must look like !opaque:server");
        }
        if (!sender.startsWith("@") || sender.indexOf(':') < 0) {
            throw new MalformedEventException("sender must look like @user:server");
        }
        if (type.isEmpty()) {
            throw new MalformedEventException("type must not be empty");
        }

        String declared = optionalText(json, "event_id");
        json.remove("event_id");
        json.remove("unsigned");
        this.eventId = declared != null ? declared : EventHashes.referenceId(json);
    }

    /**
     * Parse and validate the structure of an event. The tree is deep-copied.
     *
     * @throws MalformedEventException when required fields are missing or mistyped
     */
    public static RoomEvent fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedEventException("event must be a JSON object");
        }
        return new RoomEvent(((ObjectNode) node).deepCopy());
    }

    /** Parse event JSON bytes. */
    public static RoomEvent fromBytes(byte[] bytes) {
        return fromJson(CanonicalJson.parse(bytes));
    }

    // ---------- accessors ----------

    public String eventId() { return eventId; }

    public String roomId() { return roomId; }

    public String sender() { return sender; }

    public String type() { return type; }

    /** State key, or null for timeline-only events. */
    public String stateKey() { return stateKey; }

    public boolean isState() { return stateKey != null; }

    /** State map key for state events, null otherwise. */
    public StateKey key() {
        return stateKey == null ? null : new StateKey(type, stateKey);
    }

    public ObjectNode content() { return content.deepCopy(); }

    /** Single top-level content field without copying the whole content. */
    public JsonNode contentField(String name) {
        JsonNode v = content.get(name);
        return v == null ? null : v.deepCopy();
    }

    public List<String> prevEvents() { return prevEvents; }

    public List<String> authEvents() { return authEvents; }

    public long depth() { return depth; }

    public long originServerTs() { return originServerTs; }

    public Map<String, String> hashes() { return hashes; }

    public Map<String, Map<String, String>> signatures() { return signatures; }

    /** Target of an {@code m.room.redaction}, or null. */
    public String redacts() { return redacts; }

    /** Server that created the event: the domain part of the sender. */
    public String originServer() {
        return serverOf(sender);
    }

    /** Full event JSON including {@code event_id}. */
    public ObjectNode toJson() {
        ObjectNode out = json.deepCopy();
        out.put("event_id", eventId);
        return out;
    }

    /** Canonical bytes of {@link #toJson()}; the storage encoding of an event. */
    public byte[] toCanonicalBytes() {
        return CanonicalJson.encode(toJson());
    }

    /** True when the carried id equals the reference hash of the content. */
    public boolean hasValidId() {
        return eventId.equals(EventHashes.referenceId(json));
    }

    /** True when {@code hashes.sha256} matches the content hash. */
    public boolean hasValidContentHash() {
        return EventHashes.contentHash(json).equals(hashes.get("sha256"));
    }

    /** Domain part of a user id or room id. */
    public static String serverOf(String id) {
        int i = id.indexOf(':');
        return i < 0 ? "" : id.substring(i + 1);
    }

    // ---------- parsing helpers ----------

    private static String requireText(ObjectNode json, String field) {
        JsonNode v = json.get(field);
        if (v == null || !v.isTextual()) {
            throw new MalformedEventException(field + " must be a string");
        }
        return v.asText();
    }

    private static String optionalText(ObjectNode json, String field) {
        JsonNode v = json.get(field);
        if (v == null || v.isNull()) return null;
        if (!v.isTextual()) {
            throw new MalformedEventException(field + " must be a string");
        }
        return v.asText();
    }

    private static List<String> idList(ObjectNode json, String field) {
        JsonNode v = json.get(field);
        if (v == null || !v.isArray()) {
            throw new MalformedEventException(field + " must be an array of event ids");
        }
        List<String> out = new ArrayList<>(v.size());
        for (JsonNode id : v) {
            if (!id.isTextual() || !id.asText().startsWith("$")) {
                throw new MalformedEventException(field + " must contain event ids");
            }
            if (out.contains(id.asText())) {
                throw new MalformedEventException(field + " contains duplicate id " + id.asText());
            }
            out.add(id.asText());
        }
        return Collections.unmodifiableList(out);
    }

    private static Map<String, String> stringMap(JsonNode node, String field) {
        if (node == null || node.isNull()) return Map.of();
        if (!node.isObject()) {
            throw new MalformedEventException(field + " must be an object");
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            var e = it.next();
            if (!e.getValue().isTextual()) {
                throw new MalformedEventException(field + "." + e.getKey() + " must be a string");
            }
            out.put(e.getKey(), e.getValue().asText());
        }
        return Collections.unmodifiableMap(out);
    }

    private static Map<String, Map<String, String>> signatureMap(JsonNode node) {
        if (node == null || node.isNull()) return Map.of();
        if (!node.isObject()) {
            throw new MalformedEventException("signatures must be an object");
        }
        Map<String, Map<String, String>> out = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            var e = it.next();
            out.put(e.getKey(), stringMap(e.getValue(), "signatures." + e.getKey()));
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * Same id and same signed content. Signatures and the JSON number
     * representation do not count, so an event that went through
     * serialization equals the one it was built from.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoomEvent other)) return false;
        return eventId.equals(other.eventId)
                && Arrays.equals(EventHashes.signingBytes(json), EventHashes.signingBytes(other.json));
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId);
    }

    @Override
    public String toString() {
        return "RoomEvent{" + eventId + " " + type
                + (stateKey == null ? "" : "[" + stateKey + "]")
                + " from " + sender + " depth=" + depth + "}";
    }
}
