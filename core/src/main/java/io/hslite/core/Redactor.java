// file: core/src/main/java/io/hslite/core/Redactor.java
package io.hslite.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hslite.core.auth.PowerLevels;

import java.util.Map;
import java.util.Set;

/**
 * Read-time redaction. Stored events are never changed; clients get a copy
 * whose content is cut down to the keys the protocol keeps for its type.
 */
public final class Redactor {

    private static final Map<String, Set<String>> KEPT_V10 = Map.of(
            EventTypes.MEMBER, Set.of("membership"),
            EventTypes.CREATE, Set.of("creator"),
            EventTypes.JOIN_RULES, Set.of("join_rule"),
            EventTypes.POWER_LEVELS, Set.of("ban", "events", "events_default", "kick", "redact",
                    "state_default", "users", "users_default"),
            EventTypes.HISTORY_VISIBILITY, Set.of("history_visibility"));

    private static final Map<String, Set<String>> KEPT_V11 = Map.of(
            EventTypes.MEMBER, Set.of("membership", "join_authorised_via_users_server"),
            EventTypes.JOIN_RULES, Set.of("join_rule", "allow"),
            EventTypes.POWER_LEVELS, Set.of("ban", "events", "events_default", "invite", "kick", "redact",
                    "state_default", "users", "users_default"),
            EventTypes.HISTORY_VISIBILITY, Set.of("history_visibility"),
            EventTypes.REDACTION, Set.of("redacts"));

    private Redactor() {
    }

    /**
     * Whether {@code redaction} takes effect on {@code target}: same sender,
     * or a sender with at least the room's redact level.
     */
    public static boolean canRedact(RoomEvent redaction, RoomEvent target, PowerLevels powerLevels) {
        if (!redaction.roomId().equals(target.roomId())) return false;
        if (redaction.sender().equals(target.sender())) return true;
        return powerLevels.userLevel(redaction.sender()) >= powerLevels.redact();
    }

    /**
     * Client view of a redacted event: content pruned, and
     * {@code unsigned.redacted_because} naming the redaction.
     */
    public static ObjectNode redactedJson(RoomEvent event, RoomVersion version, String redactionId) {
        ObjectNode json = event.toJson();
        ObjectNode content = json.putObject("content");
        JsonNode original = event.content();
        if (EventTypes.CREATE.equals(event.type()) && version == RoomVersion.V11) {
            content.setAll((ObjectNode) original);
        } else {
            Set<String> kept = (version == RoomVersion.V11 ? KEPT_V11 : KEPT_V10)
                    .getOrDefault(event.type(), Set.of());
            for (String k : kept) {
                JsonNode v = original.get(k);
                if (v != null) content.set(k, v);
            }
        }
        json.putObject("unsigned").put("redacted_because", redactionId);
        return json;
    }

    /** Target of a redaction: top-level {@code redacts}, or {@code content.redacts}. */
    public static String targetOf(RoomEvent redaction) {
        if (redaction.redacts() != null) return redaction.redacts();
        JsonNode v = redaction.contentField("redacts");
        return (v != null && v.isTextual()) ? v.asText() : null;
    }
}
