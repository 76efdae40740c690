// file: core/src/main/java/io/hslite/core/signing/EventSignatures.java
package io.hslite.core.signing;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hslite.core.EventHashes;
import io.hslite.core.MalformedEventException;
import io.hslite.core.RoomEvent;

import java.util.Map;

/**
 * Signing and verification of whole events.
 */
public final class EventSignatures {

    private EventSignatures() {
    }

    /** Add this server's signature to an event tree (in place). */
    public static void sign(ObjectNode event, ServerSigningKey key) {
        String sig = key.sign(EventHashes.signingBytes(event));
        ObjectNode sigs = event.has("signatures") && event.get("signatures").isObject()
                ? (ObjectNode) event.get("signatures")
                : event.putObject("signatures");
        ObjectNode mine = sigs.has(key.serverName()) && sigs.get(key.serverName()).isObject()
                ? (ObjectNode) sigs.get(key.serverName())
                : sigs.putObject(key.serverName());
        mine.put(key.keyId(), sig);
    }

    /**
     * Verify the origin server's signature.
     * <p>
     * Policy: if the key ring knows the origin server, at least one of its
     * signatures must verify; an origin the ring has never heard of cannot be
     * checked and is reported as malformed.
     *
     * @throws MalformedEventException when the signature is missing or invalid
     */
    public static void verifyOrigin(RoomEvent event, KeyRing ring) {
        String origin = event.originServer();
        if (!ring.knows(origin)) {
            throw new MalformedEventException("no verify key known for origin server " + origin);
        }
        Map<String, String> sigs = event.signatures().get(origin);
        if (sigs == null || sigs.isEmpty()) {
            throw new MalformedEventException("event is not signed by origin server " + origin);
        }
        byte[] data = EventHashes.signingBytes(event.toJson());
        for (Map.Entry<String, String> e : sigs.entrySet()) {
            if (ring.verify(origin, e.getKey(), data, e.getValue())) {
                return;
            }
        }
        throw new MalformedEventException("signature from " + origin + " does not verify");
    }
}
