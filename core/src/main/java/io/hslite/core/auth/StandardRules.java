// file: core/src/main/java/io/hslite/core/auth/StandardRules.java
package io.hslite.core.auth;

import static io.hslite.core.auth.AuthDecision.allow;
import static io.hslite.core.auth.AuthDecision.reject;

/**
 * Rules shared by ordinary event types.
 */
final class StandardRules {

    /** Sender power must reach the threshold for the type; user-owned state keys belong to their user. */
    static final AuthRule STATE = (event, state, version) -> {
        String key = event.stateKey();
        if (key != null && key.startsWith("@") && !key.equals(event.sender())) {
            return reject("state_key " + key + " is owned by another user");
        }
        PowerLevels pl = state.powerLevels(version);
        int required = pl.requiredFor(event.type(), event.isState());
        int level = pl.userLevel(event.sender());
        if (level < required) {
            return reject("power " + level + " below " + required + " required for " + event.type());
        }
        return allow();
    };

    /** Redactions enter the graph unconditionally; visibility is decided when reading. */
    static final AuthRule REDACTION = (event, state, version) ->
            event.redacts() == null && event.contentField("redacts") == null
                    ? reject("redaction without a target")
                    : allow();

    private StandardRules() {
    }
}
