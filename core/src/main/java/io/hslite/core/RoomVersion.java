// file: core/src/main/java/io/hslite/core/RoomVersion.java
package io.hslite.core;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Room versions supported by this server.
 * <p>
 * The version pins the auth-rule variant for a room. Both versions share the
 * power-ordered state resolution algorithm; they differ in where the creator
 * comes from and which content keys survive redaction.
 */
public enum RoomVersion {
    V10("10", false),
    V11("11", true);

    public static final RoomVersion DEFAULT = V10;

    private final String id;
    private final boolean creatorFromSender;

    RoomVersion(String id, boolean creatorFromSender) {
        this.id = id;
        this.creatorFromSender = creatorFromSender;
    }

    public String id() {
        return id;
    }

    public boolean creatorFromSender() {
        return creatorFromSender;
    }

    /**
     * Look up a version by its wire id.
     *
     * @throws IllegalArgumentException if the version is not supported
     */
    public static RoomVersion fromId(String id) {
        for (RoomVersion v : values()) {
            if (v.id.equals(id)) return v;
        }
        throw new IllegalArgumentException("unsupported room version: " + id);
    }

    /** Version declared by a create event, or the default when it declares none. */
    public static RoomVersion of(RoomEvent create) {
        JsonNode v = create.content().get("room_version");
        return (v == null || !v.isTextual()) ? DEFAULT : fromId(v.asText());
    }

    /** Creator of the room as this version defines it. */
    public String creator(RoomEvent create) {
        if (creatorFromSender) {
            return create.sender();
        }
        JsonNode c = create.content().get("creator");
        return (c != null && c.isTextual()) ? c.asText() : create.sender();
    }
}
