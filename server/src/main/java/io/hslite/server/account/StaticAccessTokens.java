// file: server/src/main/java/io/hslite/server/account/StaticAccessTokens.java
package io.hslite.server.account;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Token table loaded from configuration. */
public final class StaticAccessTokens implements AccessTokenValidator {
    private final Map<String, Requester> tokens = new ConcurrentHashMap<>();

    public StaticAccessTokens add(String token, Requester requester) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("access token must not be blank");
        }
        tokens.put(token, requester);
        return this;
    }

    @Override
    public Optional<Requester> validate(String accessToken) {
        if (accessToken == null) return Optional.empty();
        return Optional.ofNullable(tokens.get(accessToken));
    }
}
