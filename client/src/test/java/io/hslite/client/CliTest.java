// file: client/src/test/java/io/hslite/client/CliTest.java
package io.hslite.client;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CliTest {

    @Test
    void global_options_precede_the_command() {
        Cli.Invocation inv = Cli.parse(new String[]{"--base-url", "http://hs:9000", "--token", "abc",
                "send", "!r:hs", "hello world"}, null);

        assertEquals("http://hs:9000", inv.baseUrl());
        assertEquals("abc", inv.token());
        assertEquals("send", inv.command());
        assertEquals(List.of("!r:hs", "hello world"), inv.positional());
    }

    @Test
    void token_falls_back_to_the_environment() {
        Cli.Invocation inv = Cli.parse(new String[]{"sync"}, "from-env");

        assertEquals(Cli.DEFAULT_BASE_URL, inv.baseUrl());
        assertEquals("from-env", inv.token());
    }

    @Test
    void missing_token_or_command_is_an_error() {
        assertThrows(Cli.CliException.class, () -> Cli.parse(new String[]{"sync"}, null));
        assertThrows(Cli.CliException.class, () -> Cli.parse(new String[]{"--token", "t"}, null));
        assertThrows(Cli.CliException.class, () -> Cli.parse(new String[]{"--token"}, null));
        assertThrows(Cli.CliException.class, () -> Cli.parse(new String[]{"--verbose", "sync"}, "t"));
    }

    @Test
    void repeated_and_boolean_flags_are_separated_from_positionals() {
        Cli.Invocation inv = Cli.parse(new String[]{"create-room", "--name", "Lobby", "--public",
                "--invite", "@a:hs", "--invite", "@b:hs"}, "t");

        assertEquals("Lobby", inv.option("--name"));
        assertEquals(List.of("@a:hs", "@b:hs"), inv.options("--invite"));
        assertTrue(inv.positional().isEmpty());
        assertNull(inv.option("--topic"));
    }

    @Test
    void bad_arguments_fail_before_any_request() {
        MatrixClient client = new MatrixClient("http://localhost:1", "t");

        assertThrows(Cli.CliException.class,
                () -> Cli.run(client, Cli.parse(new String[]{"send", "!r:hs"}, "t")));
        assertThrows(Cli.CliException.class,
                () -> Cli.run(client, Cli.parse(new String[]{"messages", "!r:hs", "many"}, "t")));
        assertThrows(Cli.CliException.class,
                () -> Cli.run(client, Cli.parse(new String[]{"frobnicate"}, "t")));
    }

    @Test
    void room_ids_are_escaped_in_paths() {
        MatrixClient client = new MatrixClient("http://localhost:8008/", "t");

        assertEquals("/_matrix/client/v3/rooms/%21abc%3Ahs", MatrixClient.room("!abc:hs"));
        assertEquals("http://localhost:8008/_matrix/client/v3/sync",
                client.uri("/_matrix/client/v3/sync").toString());
    }
}
