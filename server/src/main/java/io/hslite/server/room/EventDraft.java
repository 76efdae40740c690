// file: server/src/main/java/io/hslite/server/room/EventDraft.java
package io.hslite.server.room;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hslite.core.EventTypes;

import java.util.Objects;

/**
 * What a local client asked for, before the room fills in graph position,
 * auth events, hashes and signature.
 *
 * @param stateKey null for message-like events
 * @param redacts  target of a redaction, otherwise null
 */
public record EventDraft(String sender, String type, String stateKey, ObjectNode content, String redacts) {

    public EventDraft {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(type, "type");
        content = content == null ? JsonNodeFactory.instance.objectNode() : content.deepCopy();
    }

    public static EventDraft message(String sender, String type, ObjectNode content) {
        return new EventDraft(sender, type, null, content, null);
    }

    public static EventDraft state(String sender, String type, String stateKey, ObjectNode content) {
        return new EventDraft(sender, type, stateKey == null ? "" : stateKey, content, null);
    }

    public static EventDraft redaction(String sender, String target, ObjectNode content) {
        return new EventDraft(sender, EventTypes.REDACTION, null, content, target);
    }
}
