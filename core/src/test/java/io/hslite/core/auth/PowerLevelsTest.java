// file: core/src/test/java/io/hslite/core/auth/PowerLevelsTest.java
package io.hslite.core.auth;

import io.hslite.core.EventTypes;
import io.hslite.core.TestRoom;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PowerLevelsTest {

    @Test
    void defaults_apply_for_missing_keys() {
        var pl = PowerLevels.fromContent(TestRoom.json());
        assertEquals(50, pl.ban());
        assertEquals(50, pl.kick());
        assertEquals(50, pl.redact());
        assertEquals(0, pl.invite());
        assertEquals(50, pl.requiredFor(EventTypes.TOPIC, true));
        assertEquals(0, pl.requiredFor(EventTypes.MESSAGE, false));
        assertEquals(0, pl.userLevel("@anyone:a.test"));
    }

    @Test
    void per_type_and_per_user_levels_override_defaults() {
        var content = TestRoom.json().put("users_default", 5);
        content.putObject("events").put(EventTypes.NAME, 75);
        content.putObject("users").put("@alice:a.test", 100);
        var pl = PowerLevels.fromContent(content);

        assertEquals(75, pl.requiredFor(EventTypes.NAME, true));
        assertEquals(100, pl.userLevel("@alice:a.test"));
        assertEquals(5, pl.userLevel("@bob:a.test"));
    }

    @Test
    void without_power_levels_event_only_creator_is_privileged() {
        var pl = PowerLevels.absent("@alice:a.test");
        assertEquals(100, pl.userLevel("@alice:a.test"));
        assertEquals(0, pl.userLevel("@bob:a.test"));
        assertTrue(pl.userLevel("@bob:a.test") < pl.requiredFor(EventTypes.TOPIC, true));
    }

    @Test
    void non_integer_levels_are_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> PowerLevels.fromContent(TestRoom.json().put("kick", 1.5)));
        assertThrows(IllegalArgumentException.class,
                () -> PowerLevels.fromContent(TestRoom.json().put("users", "nope")));
    }
}
