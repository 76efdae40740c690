// file: core/src/main/java/io/hslite/core/CanonicalJson.java
package io.hslite.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Canonical JSON encoding used for hashing and signing events.
 * <p>
 * Rules:
 *  - object keys are sorted lexicographically (by UTF-16 code unit, which
 *    matches code point order for the BMP keys used by the protocol),
 *  - no insignificant whitespace,
 *  - UTF-8 output.
 * <p>
 * Two JSON trees that are equal as values always produce identical bytes,
 * which is what makes content-derived event ids stable across servers.
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CanonicalJson() {
        // utility
    }

    /** Shared mapper for event (de)serialization. Never reconfigure it. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /** Encode a tree as canonical UTF-8 bytes. */
    public static byte[] encode(JsonNode node) {
        try {
            return MAPPER.writeValueAsBytes(sorted(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("canonical JSON encoding failed", e);
        }
    }

    /** Canonical string form, handy for logging and equality checks. */
    public static String encodeToString(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(sorted(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("canonical JSON encoding failed", e);
        }
    }

    /** Parse bytes into a tree, surfacing syntax errors as malformed input. */
    public static JsonNode parse(byte[] bytes) {
        try {
            return MAPPER.readTree(bytes);
        } catch (IOException e) {
            throw new MalformedEventException("invalid JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Return a deep copy of {@code node} whose object fields are inserted in sorted order.
     * ObjectNode keeps insertion order, so serializing the copy yields canonical output.
     */
    static JsonNode sorted(JsonNode node) {
        if (node == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            for (Iterator<String> it = node.fieldNames(); it.hasNext(); ) {
                names.add(it.next());
            }
            Collections.sort(names);
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                out.set(name, sorted(node.get(name)));
            }
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode();
            for (JsonNode child : node) {
                out.add(sorted(child));
            }
            return out;
        }
        return node;
    }
}
