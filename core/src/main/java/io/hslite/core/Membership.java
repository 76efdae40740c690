// file: core/src/main/java/io/hslite/core/Membership.java
package io.hslite.core;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Membership values carried in {@code m.room.member} content.
 */
public enum Membership {
    INVITE("invite"),
    JOIN("join"),
    LEAVE("leave"),
    BAN("ban"),
    KNOCK("knock");

    private final String wire;

    Membership(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    /** Parse a wire value; returns null for unknown or missing values. */
    public static Membership fromWire(String value) {
        if (value == null) return null;
        for (Membership m : values()) {
            if (m.wire.equals(value)) return m;
        }
        return null;
    }

    /** Read {@code content.membership}; null when absent or not a known value. */
    public static Membership fromContent(JsonNode content) {
        if (content == null) return null;
        JsonNode m = content.get("membership");
        return (m == null || !m.isTextual()) ? null : fromWire(m.asText());
    }
}
