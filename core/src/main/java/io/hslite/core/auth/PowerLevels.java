// file: core/src/main/java/io/hslite/core/auth/PowerLevels.java
package io.hslite.core.auth;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Parsed {@code m.room.power_levels} content.
 * <p>
 * Defaults follow the protocol: when a power-levels event exists, missing
 * {@code state_default} is 50 and {@code events_default} 0; when none exists
 * the creator has 100, everyone else 0, and the thresholds keep their
 * defaults, so only the creator may send state until levels are set.
 */
public final class PowerLevels {
    static final String[] TOP_LEVEL = {
            "ban", "kick", "redact", "invite", "events_default", "state_default", "users_default"
    };

    private final Map<String, Integer> levels;      // top-level thresholds
    private final Map<String, Integer> events;      // per event type
    private final Map<String, Integer> users;       // per user

    private PowerLevels(Map<String, Integer> levels, Map<String, Integer> events, Map<String, Integer> users) {
        this.levels = Collections.unmodifiableMap(levels);
        this.events = Collections.unmodifiableMap(events);
        this.users = Collections.unmodifiableMap(users);
    }

    /**
     * Parse power-levels content.
     *
     * @throws IllegalArgumentException if any level is not an integer
     */
    public static PowerLevels fromContent(JsonNode content) {
        Map<String, Integer> levels = defaults();
        for (String name : TOP_LEVEL) {
            JsonNode v = content.get(name);
            if (v != null) {
                levels.put(name, integer(v, name));
            }
        }
        return new PowerLevels(levels, intMap(content.get("events"), "events"), intMap(content.get("users"), "users"));
    }

    /** Levels in effect before any power-levels event exists. */
    public static PowerLevels absent(String creator) {
        Map<String, Integer> levels = defaults();
        Map<String, Integer> users = new HashMap<>();
        if (creator != null) {
            users.put(creator, 100);
        }
        return new PowerLevels(levels, new HashMap<>(), users);
    }

    private static Map<String, Integer> defaults() {
        Map<String, Integer> levels = new HashMap<>();
        levels.put("ban", 50);
        levels.put("kick", 50);
        levels.put("redact", 50);
        levels.put("invite", 0);
        levels.put("events_default", 0);
        levels.put("state_default", 50);
        levels.put("users_default", 0);
        return levels;
    }

    public int userLevel(String userId) {
        Integer v = users.get(userId);
        return v != null ? v : levels.get("users_default");
    }

    /** Threshold for sending an event of {@code type}, as state or as a message. */
    public int requiredFor(String type, boolean state) {
        Integer v = events.get(type);
        if (v != null) return v;
        return state ? levels.get("state_default") : levels.get("events_default");
    }

    public int ban() { return levels.get("ban"); }

    public int kick() { return levels.get("kick"); }

    public int redact() { return levels.get("redact"); }

    public int invite() { return levels.get("invite"); }

    /** Top-level threshold by name (ban, kick, ..., users_default). */
    public int level(String name) {
        Integer v = levels.get(name);
        if (v == null) throw new IllegalArgumentException("unknown power level " + name);
        return v;
    }

    Map<String, Integer> levels() { return levels; }

    public Map<String, Integer> events() { return events; }

    public Map<String, Integer> users() { return users; }

    private static int integer(JsonNode v, String name) {
        if (!v.isIntegralNumber() || !v.canConvertToInt()) {
            throw new IllegalArgumentException("power level " + name + " must be an integer");
        }
        return v.asInt();
    }

    private static Map<String, Integer> intMap(JsonNode node, String name) {
        Map<String, Integer> out = new HashMap<>();
        if (node == null || node.isNull()) return out;
        if (!node.isObject()) {
            throw new IllegalArgumentException(name + " must be an object");
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            var e = it.next();
            out.put(e.getKey(), integer(e.getValue(), name + "." + e.getKey()));
        }
        return out;
    }
}
