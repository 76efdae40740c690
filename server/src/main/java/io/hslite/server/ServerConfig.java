// file: server/src/main/java/io/hslite/server/ServerConfig.java
package io.hslite.server;

/**
 * Per-process server configuration parsed from CLI args.
 *
 * Supports:
 *  - serverName:     the homeserver's name; the domain part of its user and room ids
 *  - httpPort:       client API port
 *  - dataDir:        WAL, snapshots, media and the signing key live here
 *  - txnTtlSeconds:  how long client transaction ids are remembered
 *  - configPath:     optional JSON file with access tokens and tuning
 */
public record ServerConfig(
        String serverName,
        int httpPort,
        String dataDir,
        long txnTtlSeconds,
        String configPath
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --server-name, -n  <name>
     *   --http-port,   -p  <port>
     *   --data-dir,    -d  <path>
     *   --txn-ttl-seconds  <seconds>
     *   --config,      -c  <path>
     *   --help,        -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        String serverName = "localhost";
        int httpPort = 8008;
        String dataDir = "./data";
        long txnTtlSeconds = 600;
        String configPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--server-name", "-n" -> {
                    ensureValue(args, i);
                    serverName = args[++i];
                }

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    try {
                        httpPort = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid http-port: " + args[i]);
                        System.exit(1);
                    }
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--txn-ttl-seconds" -> {
                    ensureValue(args, i);
                    try {
                        txnTtlSeconds = Long.parseLong(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid txn-ttl-seconds: " + args[i]);
                        System.exit(1);
                    }
                }

                case "--config", "-c" -> {
                    ensureValue(args, i);
                    configPath = args[++i];
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(serverName, httpPort, dataDir, txnTtlSeconds, configPath);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --server-name,    -n   Homeserver name (default: localhost)
              --http-port,      -p   HTTP port (default: 8008)
              --data-dir,       -d   Data directory (default: ./data)
              --txn-ttl-seconds      How long transaction ids are remembered (default: 600)
              --config,         -c   Path to JSON homeserver config (optional)
              --help,           -h   Show this help message
            """);
        System.exit(0);
    }
}
