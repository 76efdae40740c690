// file: server/src/main/java/io/hslite/server/Main.java
package io.hslite.server;

import io.hslite.server.federation.NoFederation;

import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for a single homeserver process.
 *
 * Responsibilities:
 *  - Parse configuration from CLI and the optional JSON file.
 *  - Open the homeserver (storage, rooms, sync) without federation peers.
 *  - Start the HTTP client API.
 *  - Close everything on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = ServerConfig.fromArgs(args);
        HomeserverConfig hsConfig = (cfg.configPath() != null && !cfg.configPath().isBlank())
                ? HomeserverConfig.fromJsonFile(Path.of(cfg.configPath()))
                : HomeserverConfig.defaults();

        var homeserver = new Homeserver(cfg, hsConfig, new NoFederation());
        var web = new WebServer(cfg.httpPort(), homeserver, hsConfig.sync());
        web.start();

        System.out.printf("Homeserver %s listening on http://%s:%d%n", cfg.serverName(), "localhost", cfg.httpPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
                homeserver.close();
            } catch (Exception e) {
                log.log(Level.WARNING, "Shutdown of " + cfg.serverName() + " failed", e);
            }
        }));
    }
}
