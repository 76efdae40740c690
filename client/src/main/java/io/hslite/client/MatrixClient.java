// file: client/src/main/java/io/hslite/client/MatrixClient.java
package io.hslite.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Blocking client for the handful of client-API endpoints the CLI uses.
 * Responses are returned as parsed JSON; non-2xx answers raise {@link ApiException}.
 */
public final class MatrixClient {
    private static final String CLIENT = "/_matrix/client/v3";

    private final HttpClient http;
    private final ObjectMapper json = new ObjectMapper();
    private final String baseUrl;
    private final String token;

    public MatrixClient(String baseUrl, String token) {
        this.http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token = token;
    }

    public JsonNode createRoom(String name, boolean isPublic, List<String> invite) throws IOException, InterruptedException {
        ObjectNode body = json.createObjectNode();
        if (name != null) body.put("name", name);
        body.put("preset", isPublic ? "public_chat" : "private_chat");
        var arr = body.putArray("invite");
        invite.forEach(arr::add);
        return call("POST", CLIENT + "/createRoom", body);
    }

    public JsonNode sendText(String roomId, String text) throws IOException, InterruptedException {
        ObjectNode body = json.createObjectNode().put("msgtype", "m.text").put("body", text);
        String txnId = "cli-" + UUID.randomUUID();
        return call("PUT", room(roomId) + "/send/m.room.message/" + enc(txnId), body);
    }

    /** {@code action} is one of join, leave, invite, kick, ban, unban. */
    public JsonNode membership(String roomId, String action, String userId) throws IOException, InterruptedException {
        ObjectNode body = json.createObjectNode();
        if (userId != null) body.put("user_id", userId);
        return call("POST", room(roomId) + "/" + action, body);
    }

    public JsonNode state(String roomId) throws IOException, InterruptedException {
        return call("GET", room(roomId) + "/state", null);
    }

    public JsonNode stateEvent(String roomId, String type, String stateKey) throws IOException, InterruptedException {
        return call("GET", room(roomId) + "/state/" + enc(type) + "/" + enc(stateKey), null);
    }

    public JsonNode messages(String roomId, int limit) throws IOException, InterruptedException {
        return call("GET", room(roomId) + "/messages?dir=b&limit=" + limit, null);
    }

    public JsonNode sync(String since, long timeoutMs) throws IOException, InterruptedException {
        StringBuilder path = new StringBuilder(CLIENT).append("/sync?timeout=").append(timeoutMs);
        if (since != null) path.append("&since=").append(enc(since));
        return call("GET", path.toString(), null);
    }

    URI uri(String pathAndQuery) {
        return URI.create(baseUrl + pathAndQuery);
    }

    static String room(String roomId) {
        return CLIENT + "/rooms/" + enc(roomId);
    }

    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private JsonNode call(String method, String pathAndQuery, JsonNode body) throws IOException, InterruptedException {
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(uri(pathAndQuery))
                .header("Authorization", "Bearer " + token);
        if (body == null) {
            req.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            req.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofByteArray(json.writeValueAsBytes(body)));
        }
        HttpResponse<String> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() / 100 != 2) {
            throw new ApiException(method + " " + pathAndQuery + " failed (" + resp.statusCode() + "): " + resp.body());
        }
        return resp.body().isEmpty() ? json.createObjectNode() : json.readTree(resp.body());
    }

    public static final class ApiException extends IOException {
        public ApiException(String message) {
            super(message);
        }
    }
}
