// file: server/src/main/java/io/hslite/server/account/Requester.java
package io.hslite.server.account;

/** Authenticated caller of the client API. */
public record Requester(String userId, String deviceId) {

    public Requester {
        if (userId == null || !userId.startsWith("@") || userId.indexOf(':') < 0) {
            throw new IllegalArgumentException("user id must look like @user:server");
        }
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("device id must not be blank");
        }
    }
}
