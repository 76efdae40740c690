// file: core/src/test/java/io/hslite/core/RedactorTest.java
package io.hslite.core;

import io.hslite.core.auth.PowerLevels;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RedactorTest {

    @Test
    void member_event_keeps_only_membership() {
        var member = EventBuilder.state("!r:a.test", "@bob:a.test", EventTypes.MEMBER, "@bob:a.test")
                .content(TestRoom.json().put("membership", "join").put("displayname", "Bob"))
                .build();
        var view = Redactor.redactedJson(member, RoomVersion.V10, "$redaction");

        assertEquals("join", view.get("content").get("membership").asText());
        assertFalse(view.get("content").has("displayname"));
        assertEquals("$redaction", view.get("unsigned").get("redacted_because").asText());
        // stored event untouched
        assertEquals("Bob", member.contentField("displayname").asText());
    }

    @Test
    void message_content_is_emptied() {
        var msg = EventBuilder.event("!r:a.test", "@bob:a.test", EventTypes.MESSAGE).content("body", "secret").build();
        assertEquals(0, Redactor.redactedJson(msg, RoomVersion.V11, "$x").get("content").size());
    }

    @Test
    void redaction_takes_effect_for_sender_or_moderator_only() {
        var msg = EventBuilder.event("!r:a.test", "@bob:a.test", EventTypes.MESSAGE).content("body", "x").build();
        var levels = PowerLevels.fromContent(TestRoom.json().set("users",
                TestRoom.json().put("@mod:a.test", 50)));

        var bySelf = EventBuilder.event("!r:a.test", "@bob:a.test", EventTypes.REDACTION).redacts(msg.eventId()).build();
        var byMod = EventBuilder.event("!r:a.test", "@mod:a.test", EventTypes.REDACTION).redacts(msg.eventId()).build();
        var byStranger = EventBuilder.event("!r:a.test", "@eve:a.test", EventTypes.REDACTION).redacts(msg.eventId()).build();

        assertTrue(Redactor.canRedact(bySelf, msg, levels));
        assertTrue(Redactor.canRedact(byMod, msg, levels));
        assertFalse(Redactor.canRedact(byStranger, msg, levels));
        assertEquals(msg.eventId(), Redactor.targetOf(byMod));
    }
}
