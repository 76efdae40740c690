// file: server/src/test/java/io/hslite/server/TestServers.java
package io.hslite.server;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hslite.server.federation.FederationExchange;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/** Test-only helpers: homeservers on temp dirs and bounded waits. */
public final class TestServers {

    private TestServers() {
    }

    public static Homeserver open(Path dir, String serverName, HomeserverConfig config, FederationExchange federation) {
        var server = new ServerConfig(serverName, 0, dir.resolve(serverName).toString(), 600, null);
        return new Homeserver(server, config, federation);
    }

    public static Homeserver open(Path dir, String serverName, FederationExchange federation) {
        return open(dir, serverName, HomeserverConfig.defaults(), federation);
    }

    public static RoomService.CreateRoom privateRoom(String... invite) {
        return new RoomService.CreateRoom(null, null, null, null, List.of(invite));
    }

    public static ObjectNode text(String body) {
        return JsonNodeFactory.instance.objectNode().put("msgtype", "m.text").put("body", body);
    }

    public static <T> T await(CompletableFuture<T> f) throws Exception {
        return f.get(10, TimeUnit.SECONDS);
    }
}
