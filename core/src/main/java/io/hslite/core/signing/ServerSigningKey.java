// file: core/src/main/java/io/hslite/core/signing/ServerSigningKey.java
package io.hslite.core.signing;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

/**
 * Ed25519 signing key of this server.
 * <p>
 * File format (two lines, standard base64):
 *   line 1: PKCS#8 private key
 *   line 2: X.509 public key
 * The key id is {@code ed25519:<keyName>}.
 */
public final class ServerSigningKey {
    private static final String ALGORITHM = "Ed25519";

    private final String serverName;
    private final String keyId;
    private final PrivateKey privateKey;
    private final PublicKey publicKey;

    public ServerSigningKey(String serverName, String keyName, KeyPair pair) {
        this.serverName = Objects.requireNonNull(serverName, "serverName");
        this.keyId = "ed25519:" + Objects.requireNonNull(keyName, "keyName");
        this.privateKey = pair.getPrivate();
        this.publicKey = pair.getPublic();
    }

    /** Fresh random key. */
    public static ServerSigningKey generate(String serverName, String keyName) {
        try {
            KeyPair pair = KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
            return new ServerSigningKey(serverName, keyName, pair);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 not available", e);
        }
    }

    /**
     * Load the key from {@code file}, generating and persisting a new one when the
     * file does not exist yet.
     */
    public static ServerSigningKey loadOrGenerate(Path file, String serverName, String keyName) {
        try {
            if (Files.exists(file)) {
                List<String> lines = Files.readAllLines(file, StandardCharsets.US_ASCII);
                if (lines.size() < 2) {
                    throw new IllegalStateException("signing key file is truncated: " + file);
                }
                KeyFactory kf = KeyFactory.getInstance(ALGORITHM);
                PrivateKey priv = kf.generatePrivate(
                        new PKCS8EncodedKeySpec(Base64.getDecoder().decode(lines.get(0).trim())));
                PublicKey pub = kf.generatePublic(
                        new X509EncodedKeySpec(Base64.getDecoder().decode(lines.get(1).trim())));
                return new ServerSigningKey(serverName, keyName, new KeyPair(pub, priv));
            }
            ServerSigningKey key = generate(serverName, keyName);
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file,
                    Base64.getEncoder().encodeToString(key.privateKey.getEncoded()) + "\n"
                            + key.encodedPublicKey() + "\n",
                    StandardCharsets.US_ASCII);
            return key;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load signing key " + file, e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Invalid signing key in " + file, e);
        }
    }

    public String serverName() { return serverName; }

    public String keyId() { return keyId; }

    public PublicKey publicKey() { return publicKey; }

    /** X.509 encoding of the public key, standard base64; what peers register in their KeyRing. */
    public String encodedPublicKey() {
        return Base64.getEncoder().encodeToString(publicKey.getEncoded());
    }

    /** Sign {@code data}, returning unpadded standard base64. */
    public String sign(byte[] data) {
        try {
            Signature s = Signature.getInstance(ALGORITHM);
            s.initSign(privateKey);
            s.update(data);
            return Base64.getEncoder().withoutPadding().encodeToString(s.sign());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("signing failed", e);
        }
    }
}
