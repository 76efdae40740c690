// file: server/src/main/java/io/hslite/server/sync/SyncToken.java
package io.hslite.server.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hslite.core.CanonicalJson;

import java.util.Base64;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Where a device is in every room it syncs, plus the ephemeral serial.
 * <p>
 * Encoding: {@code s_} + unpadded base64url of canonical JSON
 * {@code {"e": serial, "r": {roomId: streamPos}}}. Opaque to clients,
 * deterministic for equal tokens.
 */
public record SyncToken(Map<String, Long> rooms, long ephemeral) {
    private static final String PREFIX = "s_";

    public SyncToken {
        rooms = Collections.unmodifiableMap(new TreeMap<>(rooms));
    }

    public Long position(String roomId) {
        return rooms.get(roomId);
    }

    public String encode() {
        ObjectNode json = JsonNodeFactory.instance.objectNode();
        json.put("e", ephemeral);
        ObjectNode r = json.putObject("r");
        rooms.forEach(r::put);
        return PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(CanonicalJson.encode(json));
    }

    /**
     * @throws IllegalArgumentException when the string is not a token this server issued
     */
    public static SyncToken decode(String token) {
        if (token == null || !token.startsWith(PREFIX)) {
            throw new IllegalArgumentException("invalid sync token");
        }
        JsonNode json;
        try {
            json = CanonicalJson.parse(Base64.getUrlDecoder().decode(token.substring(PREFIX.length())));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid sync token", e);
        }
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("invalid sync token");
        }
        JsonNode e = json.get("e");
        JsonNode r = json.get("r");
        if (e == null || !e.isIntegralNumber() || r == null || !r.isObject()) {
            throw new IllegalArgumentException("invalid sync token");
        }
        Map<String, Long> rooms = new TreeMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = r.fields(); it.hasNext(); ) {
            var entry = it.next();
            if (!entry.getValue().isIntegralNumber() || entry.getValue().asLong() < 0) {
                throw new IllegalArgumentException("invalid sync token");
            }
            rooms.put(entry.getKey(), entry.getValue().asLong());
        }
        return new SyncToken(rooms, e.asLong());
    }

    @Override
    public String toString() {
        return encode();
    }
}
