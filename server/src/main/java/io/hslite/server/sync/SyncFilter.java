// file: server/src/main/java/io/hslite/server/sync/SyncFilter.java
package io.hslite.server.sync;

import com.fasterxml.jackson.databind.JsonNode;
import io.hslite.core.CanonicalJson;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Subset of the Matrix filter language:
 * <pre>
 * {"room": {"rooms": [...], "timeline": {"limit": n, "types": [...]}}}
 * </pre>
 *
 * @param timelineLimit 0 for the server default
 * @param rooms         allowed rooms, or null for all
 * @param types         allowed timeline event types, or null for all
 */
public record SyncFilter(int timelineLimit, Set<String> rooms, Set<String> types) {

    public static final SyncFilter NONE = new SyncFilter(0, null, null);

    public SyncFilter {
        if (timelineLimit < 0) throw new IllegalArgumentException("timeline limit must be >= 0");
        rooms = rooms == null ? null : Set.copyOf(rooms);
        types = types == null ? null : Set.copyOf(types);
    }

    /**
     * Parse the {@code filter} query parameter (inline JSON).
     *
     * @throws IllegalArgumentException on invalid JSON or field types
     */
    public static SyncFilter parse(String filter) {
        if (filter == null || filter.isBlank()) return NONE;
        JsonNode json = CanonicalJson.parse(filter.getBytes(StandardCharsets.UTF_8));
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("filter must be a JSON object");
        }
        JsonNode room = json.path("room");
        JsonNode timeline = room.path("timeline");
        int limit = 0;
        if (timeline.has("limit")) {
            if (!timeline.get("limit").isIntegralNumber()) {
                throw new IllegalArgumentException("filter timeline limit must be an integer");
            }
            limit = timeline.get("limit").asInt();
        }
        return new SyncFilter(limit, strings(room.get("rooms")), strings(timeline.get("types")));
    }

    private static Set<String> strings(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (!node.isArray()) throw new IllegalArgumentException("filter lists must be arrays");
        Set<String> out = new LinkedHashSet<>();
        for (JsonNode v : node) {
            if (!v.isTextual()) throw new IllegalArgumentException("filter lists must contain strings");
            out.add(v.asText());
        }
        return out;
    }

    public boolean allowsRoom(String roomId) {
        return rooms == null || rooms.contains(roomId);
    }

    public boolean allowsType(String type) {
        return types == null || types.contains(type);
    }

    public int limitOr(int defaultLimit) {
        return timelineLimit > 0 ? timelineLimit : defaultLimit;
    }
}
