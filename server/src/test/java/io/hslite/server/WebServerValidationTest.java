// file: server/src/test/java/io/hslite/server/WebServerValidationTest.java
package io.hslite.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hslite.server.federation.NoFederation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end checks of the HTTP surface: authentication, error envelopes
 * and one happy path through createRoom, send and messages.
 */
class WebServerValidationTest {

    private static final int PORT = 18080; // test-only port
    private static final String TOKEN = "secret-alice";
    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path dir;

    private Homeserver hs;
    private WebServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        HomeserverConfig config = HomeserverConfig.defaults().withAccessToken(TOKEN, "@alice:a.test", "ALICE1");
        hs = TestServers.open(dir, "a.test", config, new NoFederation());
        server = new WebServer(PORT, hs, config.sync());
        server.start();

        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() throws Exception {
        if (server != null) {
            server.stop();
        }
        hs.close();
    }

    private static String url(String path) {
        return "http://localhost:" + PORT + path;
    }

    private HttpResponse<String> send(HttpRequest.Builder builder) throws Exception {
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpRequest.Builder authed(String path) {
        return HttpRequest.newBuilder().uri(URI.create(url(path))).header("Authorization", "Bearer " + TOKEN);
    }

    private static String errcode(HttpResponse<String> resp) throws Exception {
        return JSON.readTree(resp.body()).path("errcode").asText();
    }

    private String createRoom() throws Exception {
        HttpResponse<String> resp = send(authed("/_matrix/client/v3/createRoom")
                .POST(HttpRequest.BodyPublishers.ofString("{\"name\":\"Lobby\"}"))
                .header("Content-Type", "application/json"));
        assertEquals(200, resp.statusCode(), resp.body());
        return JSON.readTree(resp.body()).path("room_id").asText();
    }

    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    @Test
    void health_needs_no_token() throws Exception {
        HttpResponse<String> resp = send(HttpRequest.newBuilder().uri(URI.create(url("/admin/health"))).GET());
        assertEquals(200, resp.statusCode());
        assertTrue(resp.body().contains("ok"));
    }

    @Test
    void missing_token_returns_401() throws Exception {
        HttpResponse<String> resp = send(HttpRequest.newBuilder()
                .uri(URI.create(url("/_matrix/client/v3/sync"))).GET());
        assertEquals(401, resp.statusCode());
        assertEquals("M_MISSING_TOKEN", errcode(resp));
    }

    @Test
    void unknown_token_returns_401() throws Exception {
        HttpResponse<String> resp = send(HttpRequest.newBuilder()
                .uri(URI.create(url("/_matrix/client/v3/sync?access_token=nope"))).GET());
        assertEquals(401, resp.statusCode());
        assertEquals("M_UNKNOWN_TOKEN", errcode(resp));
    }

    @Test
    void unknown_route_and_unknown_room_return_404() throws Exception {
        HttpResponse<String> route = send(authed("/_matrix/client/v3/nothing-here").GET());
        assertEquals(404, route.statusCode());
        assertEquals("M_UNRECOGNIZED", errcode(route));

        HttpResponse<String> room = send(authed("/_matrix/client/v3/rooms/" + enc("!missing:a.test") + "/messages").GET());
        assertEquals(404, room.statusCode());
        assertEquals("M_NOT_FOUND", errcode(room));
    }

    @Test
    void invalid_json_returns_400() throws Exception {
        String roomId = createRoom();
        HttpResponse<String> resp = send(authed("/_matrix/client/v3/rooms/" + enc(roomId) + "/send/m.room.message/t1")
                .PUT(HttpRequest.BodyPublishers.ofString("{ invalid-json"))
                .header("Content-Type", "application/json"));
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("invalid JSON"));
    }

    @Test
    void too_large_body_returns_413() throws Exception {
        String big = "x".repeat(11 * 1024 * 1024);
        HttpResponse<String> resp = send(authed("/_matrix/media/v3/upload")
                .POST(HttpRequest.BodyPublishers.ofString(big))
                .header("Content-Type", "text/plain"));
        assertEquals(413, resp.statusCode());
        assertTrue(resp.body().contains("request body too large"));
    }

    @Test
    void malformed_sync_token_returns_400() throws Exception {
        HttpResponse<String> resp = send(authed("/_matrix/client/v3/sync?since=garbage").GET());
        assertEquals(400, resp.statusCode());
        assertEquals("M_INVALID_PARAM", errcode(resp));
    }

    @Test
    void wrong_method_returns_405() throws Exception {
        String roomId = createRoom();
        HttpResponse<String> resp = send(authed("/_matrix/client/v3/rooms/" + enc(roomId) + "/messages")
                .POST(HttpRequest.BodyPublishers.noBody()));
        assertEquals(405, resp.statusCode());
    }

    @Test
    void create_send_and_read_back_messages() throws Exception {
        String roomId = createRoom();

        HttpResponse<String> sent = send(authed("/_matrix/client/v3/rooms/" + enc(roomId) + "/send/m.room.message/t1")
                .PUT(HttpRequest.BodyPublishers.ofString("{\"msgtype\":\"m.text\",\"body\":\"hello\"}"))
                .header("Content-Type", "application/json"));
        assertEquals(200, sent.statusCode(), sent.body());
        String eventId = JSON.readTree(sent.body()).path("event_id").asText();
        assertTrue(eventId.startsWith("$"));

        HttpResponse<String> page = send(authed("/_matrix/client/v3/rooms/" + enc(roomId) + "/messages?dir=b&limit=1").GET());
        assertEquals(200, page.statusCode(), page.body());
        JsonNode chunk = JSON.readTree(page.body()).path("chunk");
        assertEquals(1, chunk.size());
        assertEquals(eventId, chunk.get(0).path("event_id").asText());

        HttpResponse<String> name = send(authed("/_matrix/client/v3/rooms/" + enc(roomId) + "/state/m.room.name/").GET());
        assertEquals(200, name.statusCode(), name.body());
        assertEquals("Lobby", JSON.readTree(name.body()).path("name").asText());

        HttpResponse<String> sync = send(authed("/_matrix/client/v3/sync?timeout=0").GET());
        assertEquals(200, sync.statusCode(), sync.body());
        JsonNode body = JSON.readTree(sync.body());
        assertTrue(body.path("next_batch").asText().startsWith("s_"));
        assertTrue(body.path("rooms").path("join").has(roomId));
    }
}
