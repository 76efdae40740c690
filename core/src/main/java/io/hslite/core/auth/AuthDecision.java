// file: core/src/main/java/io/hslite/core/auth/AuthDecision.java
package io.hslite.core.auth;

/**
 * Outcome of an auth check.
 */
public sealed interface AuthDecision permits AuthDecision.Allow, AuthDecision.Reject {

    AuthDecision ALLOW = new Allow();

    static AuthDecision allow() {
        return ALLOW;
    }

    static AuthDecision reject(String reason) {
        return new Reject(reason);
    }

    default boolean allowed() {
        return this instanceof Allow;
    }

    record Allow() implements AuthDecision {}

    record Reject(String reason) implements AuthDecision {}
}
