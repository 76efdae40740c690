// file: core/src/main/java/io/hslite/core/signing/KeyRing.java
package io.hslite.core.signing;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Verify keys of known servers: server name -> key id -> public key.
 * <p>
 * Thread safe; keys can be registered while admissions are verifying.
 */
public final class KeyRing {
    private final Map<String, Map<String, PublicKey>> keys = new ConcurrentHashMap<>();

    public void register(String serverName, String keyId, PublicKey key) {
        keys.computeIfAbsent(serverName, s -> new ConcurrentHashMap<>()).put(keyId, key);
    }

    /** Register an X.509 public key in standard base64, as published by {@link ServerSigningKey}. */
    public void register(String serverName, String keyId, String encodedPublicKey) {
        try {
            PublicKey key = KeyFactory.getInstance("Ed25519")
                    .generatePublic(new X509EncodedKeySpec(Base64.getDecoder().decode(encodedPublicKey)));
            register(serverName, keyId, key);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid verify key for " + serverName, e);
        }
    }

    public void register(ServerSigningKey own) {
        register(own.serverName(), own.keyId(), own.publicKey());
    }

    public boolean knows(String serverName) {
        Map<String, PublicKey> m = keys.get(serverName);
        return m != null && !m.isEmpty();
    }

    public Optional<PublicKey> find(String serverName, String keyId) {
        Map<String, PublicKey> m = keys.get(serverName);
        return m == null ? Optional.empty() : Optional.ofNullable(m.get(keyId));
    }

    /** Check an unpadded base64 Ed25519 signature. Malformed signatures verify as false. */
    public boolean verify(String serverName, String keyId, byte[] data, String signatureB64) {
        Optional<PublicKey> key = find(serverName, keyId);
        if (key.isEmpty()) return false;
        try {
            Signature s = Signature.getInstance("Ed25519");
            s.initVerify(key.get());
            s.update(data);
            return s.verify(Base64.getDecoder().decode(signatureB64));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            return false;
        }
    }
}
