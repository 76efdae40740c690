// file: client/src/main/java/io/hslite/client/Cli.java
package io.hslite.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Simple CLI for talking to a running homeserver over the client API.
 *
 * Usage:
 *   hslite-cli [--base-url URL] [--token TOKEN] create-room [--name NAME] [--public] [--invite USER]...
 *   hslite-cli [--base-url URL] [--token TOKEN] send <roomId> <text>
 *   hslite-cli [--base-url URL] [--token TOKEN] join|leave <roomId>
 *   hslite-cli [--base-url URL] [--token TOKEN] invite <roomId> <userId>
 *   hslite-cli [--base-url URL] [--token TOKEN] state <roomId> [<type> [<stateKey>]]
 *   hslite-cli [--base-url URL] [--token TOKEN] messages <roomId> [<limit>]
 *   hslite-cli [--base-url URL] [--token TOKEN] sync [<since>] [--timeout MS]
 *
 * The token can also come from the HSLITE_TOKEN environment variable.
 */
public final class Cli {

    static final String DEFAULT_BASE_URL = "http://localhost:8008";

    /** Parsed command line: global options plus the command and its arguments. */
    record Invocation(String baseUrl, String token, String command, List<String> args) {

        /** Value following {@code flag} in the command arguments, or null. */
        String option(String flag) {
            int i = args.indexOf(flag);
            if (i < 0) return null;
            if (i + 1 >= args.size()) {
                throw new CliException(flag + " requires a value");
            }
            return args.get(i + 1);
        }

        List<String> options(String flag) {
            List<String> out = new ArrayList<>();
            for (int i = 0; i < args.size(); i++) {
                if (flag.equals(args.get(i))) {
                    if (i + 1 >= args.size()) {
                        throw new CliException(flag + " requires a value");
                    }
                    out.add(args.get(++i));
                }
            }
            return out;
        }

        /** Arguments that are neither flags nor flag values. */
        List<String> positional() {
            List<String> out = new ArrayList<>();
            for (int i = 0; i < args.size(); i++) {
                String a = args.get(i);
                if (a.equals("--public")) continue;
                if (a.startsWith("--")) {
                    i++;
                    continue;
                }
                out.add(a);
            }
            return out;
        }
    }

    private Cli() {
    }

    public static void main(String[] args) {
        try {
            Invocation inv = parse(args, System.getenv("HSLITE_TOKEN"));
            MatrixClient client = new MatrixClient(inv.baseUrl(), inv.token());
            JsonNode result = run(client, inv);
            System.out.println(new ObjectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(result));
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            usage();
            System.exit(1);
        } catch (MatrixClient.ApiException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    static Invocation parse(String[] argv, String envToken) {
        String baseUrl = DEFAULT_BASE_URL;
        String token = envToken;
        int i = 0;
        while (i < argv.length && argv[i].startsWith("--")) {
            switch (argv[i]) {
                case "--base-url" -> baseUrl = requireValue(argv, i++);
                case "--token" -> token = requireValue(argv, i++);
                default -> throw new CliException("unknown option: " + argv[i]);
            }
            i++;
        }
        if (i >= argv.length) {
            throw new CliException("missing command");
        }
        if (token == null || token.isBlank()) {
            throw new CliException("missing access token (use --token or HSLITE_TOKEN)");
        }
        String command = argv[i];
        List<String> rest = List.copyOf(Arrays.asList(argv).subList(i + 1, argv.length));
        return new Invocation(baseUrl, token, command, rest);
    }

    static JsonNode run(MatrixClient client, Invocation inv) throws Exception {
        List<String> pos = inv.positional();
        switch (inv.command()) {
            case "create-room" -> {
                return client.createRoom(inv.option("--name"), inv.args().contains("--public"), inv.options("--invite"));
            }
            case "send" -> {
                expect(pos, 2, "send requires <roomId> <text>");
                return client.sendText(pos.get(0), pos.get(1));
            }
            case "join", "leave" -> {
                expect(pos, 1, inv.command() + " requires <roomId>");
                return client.membership(pos.get(0), inv.command(), null);
            }
            case "invite" -> {
                expect(pos, 2, "invite requires <roomId> <userId>");
                return client.membership(pos.get(0), "invite", pos.get(1));
            }
            case "state" -> {
                if (pos.isEmpty() || pos.size() > 3) {
                    throw new CliException("state requires <roomId> [<type> [<stateKey>]]");
                }
                if (pos.size() == 1) {
                    return client.state(pos.get(0));
                }
                return client.stateEvent(pos.get(0), pos.get(1), pos.size() == 3 ? pos.get(2) : "");
            }
            case "messages" -> {
                if (pos.isEmpty() || pos.size() > 2) {
                    throw new CliException("messages requires <roomId> [<limit>]");
                }
                int limit = pos.size() == 2 ? parseInt(pos.get(1), "limit") : 10;
                return client.messages(pos.get(0), limit);
            }
            case "sync" -> {
                String timeout = inv.option("--timeout");
                return client.sync(pos.isEmpty() ? null : pos.get(0),
                        timeout == null ? 0 : parseInt(timeout, "--timeout"));
            }
            default -> throw new CliException("unknown command: " + inv.command());
        }
    }

    private static String requireValue(String[] argv, int flagIndex) {
        if (flagIndex + 1 >= argv.length) {
            throw new CliException(argv[flagIndex] + " requires a value");
        }
        return argv[flagIndex + 1];
    }

    private static void expect(List<String> pos, int n, String message) {
        if (pos.size() != n) {
            throw new CliException(message);
        }
    }

    private static int parseInt(String v, String name) {
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new CliException(name + " must be an integer");
        }
    }

    private static void usage() {
        System.err.println("""
                Usage:
                  hslite-cli [--base-url URL] [--token TOKEN] create-room [--name NAME] [--public] [--invite USER]...
                  hslite-cli [--base-url URL] [--token TOKEN] send <roomId> <text>
                  hslite-cli [--base-url URL] [--token TOKEN] join|leave <roomId>
                  hslite-cli [--base-url URL] [--token TOKEN] invite <roomId> <userId>
                  hslite-cli [--base-url URL] [--token TOKEN] state <roomId> [<type> [<stateKey>]]
                  hslite-cli [--base-url URL] [--token TOKEN] messages <roomId> [<limit>]
                  hslite-cli [--base-url URL] [--token TOKEN] sync [<since>] [--timeout MS]
                """);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
