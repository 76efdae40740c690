// file: core/src/main/java/io/hslite/core/EventHashes.java
package io.hslite.core;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Content hash, reference hash (event id) and signing input of events.
 * <p>
 *  - content hash: SHA-256 over the canonical event without event_id,
 *    hashes, signatures and unsigned; unpadded standard base64.
 *  - event id: "$" + unpadded URL-safe base64 of SHA-256 over the canonical
 *    event without event_id, signatures and unsigned. Because the content
 *    hash is included, the id commits to the full content and prev_events.
 *  - signing input: canonical event without event_id, signatures and unsigned.
 */
public final class EventHashes {

    private static final Base64.Encoder STD = Base64.getEncoder().withoutPadding();
    private static final Base64.Encoder URL = Base64.getUrlEncoder().withoutPadding();

    private EventHashes() {
    }

    public static String contentHash(ObjectNode event) {
        ObjectNode copy = event.deepCopy();
        copy.remove("event_id");
        copy.remove("hashes");
        copy.remove("signatures");
        copy.remove("unsigned");
        return STD.encodeToString(sha256(CanonicalJson.encode(copy)));
    }

    public static String referenceId(ObjectNode event) {
        ObjectNode copy = event.deepCopy();
        copy.remove("event_id");
        copy.remove("signatures");
        copy.remove("unsigned");
        return "$" + URL.encodeToString(sha256(CanonicalJson.encode(copy)));
    }

    public static byte[] signingBytes(ObjectNode event) {
        ObjectNode copy = event.deepCopy();
        copy.remove("event_id");
        copy.remove("signatures");
        copy.remove("unsigned");
        return CanonicalJson.encode(copy);
    }

    static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
