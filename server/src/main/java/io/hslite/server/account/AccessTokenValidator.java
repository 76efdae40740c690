// file: server/src/main/java/io/hslite/server/account/AccessTokenValidator.java
package io.hslite.server.account;

import java.util.Optional;

/**
 * Maps an access token to the user and device it was issued to.
 * Token issuance (login, registration) lives outside this server.
 */
@FunctionalInterface
public interface AccessTokenValidator {

    Optional<Requester> validate(String accessToken);
}
