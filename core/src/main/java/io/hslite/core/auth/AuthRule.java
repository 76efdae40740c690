// file: core/src/main/java/io/hslite/core/auth/AuthRule.java
package io.hslite.core.auth;

import io.hslite.core.RoomEvent;
import io.hslite.core.RoomVersion;

/**
 * Auth rule for one event type. Must be a pure function of its arguments:
 * no clock, no I/O.
 */
@FunctionalInterface
public interface AuthRule {

    AuthDecision check(RoomEvent event, AuthState state, RoomVersion version);
}
