// file: server/src/main/java/io/hslite/server/WebServer.java
package io.hslite.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hslite.core.MalformedEventException;
import io.hslite.server.account.Requester;
import io.hslite.server.dto.CreateRoomRequest;
import io.hslite.server.dto.CreateRoomResponse;
import io.hslite.server.dto.ErrorResponse;
import io.hslite.server.dto.EventIdResponse;
import io.hslite.server.dto.MembershipRequest;
import io.hslite.server.dto.MessagesResponse;
import io.hslite.server.dto.RedactRequest;
import io.hslite.server.dto.TypingRequest;
import io.hslite.server.dto.UploadResponse;
import io.hslite.server.sync.SyncFilter;
import io.hslite.server.sync.SyncRequest;
import io.hslite.server.sync.SyncResponse;
import io.hslite.server.sync.SyncSettings;
import io.hslite.server.timeline.Direction;
import io.hslite.server.timeline.TimelineEntry;
import io.hslite.server.timeline.TimelinePage;
import io.hslite.storage.media.MediaStore;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.SameThreadExecutor;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Thin HTTP adapter over {@link RoomService}, the sync manager and the media store.
 *
 * Responsibilities:
 *  - Parse HTTP method + path and authenticate the access token.
 *  - Decode JSON request bodies into DTOs.
 *  - Complete long-running requests (sync, admissions) asynchronously.
 *  - Map Java exceptions to the Matrix error envelope.
 *  - Emit one log line per request.
 *
 * Path layout:
 *   - GET  /_matrix/client/v3/sync
 *   - POST /_matrix/client/v3/createRoom
 *   - PUT  /_matrix/client/v3/rooms/{room}/send/{type}/{txnId}
 *   - GET  /_matrix/client/v3/rooms/{room}/state
 *   - GET  /_matrix/client/v3/rooms/{room}/state/{type}/{stateKey}
 *   - PUT  /_matrix/client/v3/rooms/{room}/state/{type}/{stateKey}
 *   - POST /_matrix/client/v3/rooms/{room}/{invite|join|leave|kick|ban|unban}
 *   - PUT  /_matrix/client/v3/rooms/{room}/redact/{eventId}/{txnId}
 *   - PUT  /_matrix/client/v3/rooms/{room}/typing/{userId}
 *   - POST /_matrix/client/v3/rooms/{room}/receipt/m.read/{eventId}
 *   - GET  /_matrix/client/v3/rooms/{room}/messages
 *   - POST /_matrix/media/v3/upload
 *   - GET  /_matrix/media/v3/download/{server}/{mediaId}
 *   - GET  /admin/health
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB
    private static final String CLIENT = "/_matrix/client/v3/";
    private static final String MEDIA = "/_matrix/media/v3/";
    private static final int DEFAULT_MESSAGES_LIMIT = 10;
    private static final long DEFAULT_TYPING_TIMEOUT_MS = 30_000;

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final Homeserver hs;
    private final SyncSettings syncSettings;
    private final SecureRandom random = new SecureRandom();

    public WebServer(int port, Homeserver hs, SyncSettings syncSettings) {
        this.hs = hs;
        this.syncSettings = syncSettings;
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(this::route)
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop(); // For tests to stop server
    }

    @FunctionalInterface
    private interface BodyHandler {
        CompletableFuture<?> handle(byte[] body) throws Exception;
    }

    // ---------- routing ----------

    private void route(HttpServerExchange ex) {
        long start = System.nanoTime();
        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        try {
            if ("/admin/health".equals(path)) {
                respond(ex, start, CompletableFuture.completedFuture(Map.of("status", "ok")));
                return;
            }
            if (path.startsWith(MEDIA + "download/") && "GET".equals(method)) {
                handleDownload(ex, start, path.substring((MEDIA + "download/").length()));
                return;
            }
            Requester who = authenticate(ex);
            if ((CLIENT + "sync").equals(path) && "GET".equals(method)) {
                handleSync(ex, start, who);
            } else if ((CLIENT + "createRoom").equals(path) && "POST".equals(method)) {
                withBody(ex, start, body -> {
                    CreateRoomRequest req = readBody(body, CreateRoomRequest.class);
                    var options = new RoomService.CreateRoom(req.roomVersion, req.preset, req.name, req.topic, req.invite);
                    return hs.roomService().createRoom(who, options).thenApply(roomId -> {
                        var dto = new CreateRoomResponse();
                        dto.roomId = roomId;
                        return dto;
                    });
                });
            } else if (path.startsWith(CLIENT + "rooms/")) {
                routeRoom(ex, start, who, method, path.substring((CLIENT + "rooms/").length()).split("/", -1));
            } else if ((MEDIA + "upload").equals(path) && "POST".equals(method)) {
                withBody(ex, start, body -> upload(ex, who, body));
            } else {
                throw new MatrixException(404, "M_UNRECOGNIZED", "unrecognized request " + method + " " + path);
            }
        } catch (Exception e) {
            fail(ex, start, -1, e);
        }
    }

    private void routeRoom(HttpServerExchange ex, long start, Requester who, String method, String[] seg) {
        if (seg.length < 2 || seg[0].isBlank()) {
            throw new MatrixException(404, "M_UNRECOGNIZED", "unrecognized room request");
        }
        RoomService rooms = hs.roomService();
        String roomId = seg[0];
        String action = seg[1];
        switch (action) {
            case "send" -> {
                requireMethod(method, "PUT", seg.length == 4);
                withBody(ex, start, body -> rooms.sendMessage(who, roomId, seg[2], seg[3], readObject(body))
                        .thenApply(WebServer::eventIdResponse));
            }
            case "state" -> {
                if (seg.length == 2) {
                    requireMethod(method, "GET", true);
                    Long at = longParam(ex, "at");
                    respondNow(ex, start, () -> rooms.state(who, roomId, at));
                    return;
                }
                String type = seg[2];
                String stateKey = seg.length > 3 ? String.join("/", Arrays.copyOfRange(seg, 3, seg.length)) : "";
                if ("GET".equals(method)) {
                    respondNow(ex, start, () -> rooms.stateContent(who, roomId, type, stateKey));
                } else {
                    requireMethod(method, "PUT", true);
                    withBody(ex, start, body -> rooms.sendState(who, roomId, type, stateKey, readObject(body))
                            .thenApply(WebServer::eventIdResponse));
                }
            }
            case "invite", "join", "leave", "kick", "ban", "unban" -> {
                requireMethod(method, "POST", seg.length == 2);
                var act = RoomService.MembershipAction.valueOf(action.toUpperCase(Locale.ROOT));
                withBody(ex, start, body -> {
                    MembershipRequest req = body.length == 0 ? new MembershipRequest()
                            : readBody(body, MembershipRequest.class);
                    return rooms.membership(who, roomId, act, req.userId, req.reason)
                            .thenApply(id -> Map.of());
                });
            }
            case "redact" -> {
                requireMethod(method, "PUT", seg.length == 4);
                withBody(ex, start, body -> {
                    RedactRequest req = body.length == 0 ? new RedactRequest() : readBody(body, RedactRequest.class);
                    return rooms.redact(who, roomId, seg[2], seg[3], req.reason).thenApply(WebServer::eventIdResponse);
                });
            }
            case "typing" -> {
                requireMethod(method, "PUT", seg.length == 3);
                withBody(ex, start, body -> {
                    TypingRequest req = readBody(body, TypingRequest.class);
                    long timeout = req.timeout == null ? DEFAULT_TYPING_TIMEOUT_MS : req.timeout;
                    rooms.typing(who, roomId, seg[2], req.typing, timeout);
                    return CompletableFuture.completedFuture(Map.of());
                });
            }
            case "receipt" -> {
                requireMethod(method, "POST", seg.length == 4 && "m.read".equals(seg[2]));
                withBody(ex, start, body -> {
                    rooms.receipt(who, roomId, seg[3]);
                    return CompletableFuture.completedFuture(Map.of());
                });
            }
            case "messages" -> {
                requireMethod(method, "GET", seg.length == 2);
                String from = param(ex, "from");
                Direction dir = Direction.fromParam(param(ex, "dir"));
                Long limit = longParam(ex, "limit");
                int n = limit == null ? DEFAULT_MESSAGES_LIMIT : (int) Math.min(limit, Integer.MAX_VALUE);
                respondNow(ex, start, () -> messagesResponse(rooms.messages(who, roomId, from, dir, n)));
            }
            default -> throw new MatrixException(404, "M_UNRECOGNIZED", "unrecognized room request " + action);
        }
    }

    // ---------- handlers ----------

    private void handleSync(HttpServerExchange ex, long start, Requester who) {
        String since = param(ex, "since");
        long timeout = syncSettings.clampTimeout(longParam(ex, "timeout"));
        SyncFilter filter = SyncFilter.parse(param(ex, "filter"));
        var request = new SyncRequest(who.userId(), who.deviceId(), since, timeout, filter);

        long coreStart = System.nanoTime();
        CompletableFuture<SyncResponse> pending = hs.sync().sync(request);
        ex.getConnection().addCloseListener(c -> pending.cancel(false));

        // a superseded wait answers with the token it was given
        CompletableFuture<ObjectNode> body = pending.handle((r, err) -> {
            if (err == null) return r.toJson();
            if (unwrap(err) instanceof CancellationException) return SyncResponse.empty(since).toJson();
            throw new CompletionException(unwrap(err));
        });
        respond(ex, start, coreStart, body);
    }

    private CompletableFuture<UploadResponse> upload(HttpServerExchange ex, Requester who, byte[] body) {
        String contentType = ex.getRequestHeaders().getFirst(Headers.CONTENT_TYPE);
        String mediaId = randomId(24);
        hs.media().put(mediaId, body, new MediaStore.MediaMetadata(
                contentType == null ? "application/octet-stream" : contentType,
                Map.of("uploader", who.userId())));
        var dto = new UploadResponse();
        dto.contentUri = "mxc://" + hs.serverName() + "/" + mediaId;
        return CompletableFuture.completedFuture(dto);
    }

    private void handleDownload(HttpServerExchange ex, long start, String rest) {
        String[] seg = rest.split("/", -1);
        if (seg.length != 2 || !hs.serverName().equals(seg[0])) {
            throw MatrixException.notFound("unknown media " + rest);
        }
        MediaStore.MediaObject obj = hs.media().get(seg[1]);
        if (obj == null) {
            throw MatrixException.notFound("unknown media " + rest);
        }
        ex.setStatusCode(200);
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE,
                obj.contentType() == null ? "application/octet-stream" : obj.contentType());
        ex.getResponseSender().send(ByteBuffer.wrap(obj.body()));
        RequestLogger.logRequest("GET", ex.getRequestPath(), 200, millisSince(start), -1, null);
    }

    private MessagesResponse messagesResponse(TimelinePage page) {
        var dto = new MessagesResponse();
        dto.chunk = new ArrayList<>(page.events().size());
        for (TimelineEntry e : page.events()) {
            dto.chunk.add(e.clientJson());
        }
        dto.start = page.start().encode();
        dto.end = page.end() == null ? null : page.end().encode();
        dto.gaps = page.gaps().isEmpty() ? null : List.copyOf(page.gaps());
        return dto;
    }

    private static EventIdResponse eventIdResponse(String eventId) {
        var dto = new EventIdResponse();
        dto.eventId = eventId;
        return dto;
    }

    // ---------- request plumbing ----------

    private Requester authenticate(HttpServerExchange ex) {
        String token = null;
        String header = ex.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
        if (header != null && header.regionMatches(true, 0, "Bearer ", 0, 7)) {
            token = header.substring(7).trim();
        }
        if (token == null) {
            token = param(ex, "access_token");
        }
        if (token == null || token.isEmpty()) {
            throw MatrixException.missingToken();
        }
        return hs.accessTokens().validate(token)
                .orElseThrow(MatrixException::unknownToken);
    }

    private void withBody(HttpServerExchange ex, long start, BodyHandler handler) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    long coreStart = System.nanoTime();
                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            throw MatrixException.tooLarge();
                        }
                        respond(exchange, start, coreStart, handler.handle(data));
                    } catch (Exception e) {
                        fail(exchange, start, -1, e);
                    }
                },
                (exchange, ioEx) -> fail(exchange, start, -1, ioEx)
        );
    }

    private void respondNow(HttpServerExchange ex, long start, Supplier<?> work) {
        long coreStart = System.nanoTime();
        Object body = work.get();
        respond(ex, start, coreStart, CompletableFuture.completedFuture(body));
    }

    private void respond(HttpServerExchange ex, long start, CompletableFuture<?> result) {
        respond(ex, start, -1, result);
    }

    /**
     * Send the outcome of {@code result}. A pending future keeps the exchange
     * open through a dispatch; no worker thread is held while it waits.
     */
    private void respond(HttpServerExchange ex, long start, long coreStart, CompletableFuture<?> result) {
        if (result.isDone()) {
            complete(ex, start, coreStart, result);
            return;
        }
        ex.dispatch(SameThreadExecutor.INSTANCE, () ->
                result.whenComplete((r, err) -> complete(ex, start, coreStart, result)));
    }

    private void complete(HttpServerExchange ex, long start, long coreStart, CompletableFuture<?> result) {
        long coreMs = coreStart < 0 ? -1 : millisSince(coreStart);
        Object body;
        try {
            body = result.get();
        } catch (ExecutionException | CancellationException e) {
            fail(ex, start, coreMs, unwrap(e));
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(ex, start, coreMs, e);
            return;
        }
        send(ex, 200, body);
        RequestLogger.logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(), 200,
                millisSince(start), coreMs, null);
    }

    private void fail(HttpServerExchange ex, long start, long coreMs, Throwable error) {
        Throwable e = unwrap(error);
        int status;
        ErrorResponse body;
        if (e instanceof MatrixException m) {
            status = m.status();
            body = ErrorResponse.of(m.errcode(), m.getMessage());
        } else if (e instanceof MalformedEventException) {
            status = 400;
            body = ErrorResponse.of("M_BAD_JSON", e.getMessage());
        } else if (e instanceof JsonProcessingException) {
            status = 400;
            body = ErrorResponse.of("M_NOT_JSON", "invalid JSON");
        } else if (e instanceof IllegalArgumentException) {
            status = 400;
            body = ErrorResponse.of("M_INVALID_PARAM", e.getMessage());
        } else if (e instanceof IOException) {
            status = 400;
            body = ErrorResponse.of("M_BAD_JSON", "invalid request body");
        } else {
            status = 500;
            body = ErrorResponse.of("M_UNKNOWN", e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        send(ex, status, body);
        RequestLogger.logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(), status,
                millisSince(start), coreMs, e);
    }

    private ObjectNode readObject(byte[] body) throws JsonProcessingException {
        if (body.length == 0) {
            return JsonNodeFactory.instance.objectNode();
        }
        JsonNode node = json.readTree(new String(body, StandardCharsets.UTF_8));
        if (node == null || !node.isObject()) {
            throw MatrixException.badJson("request body must be a JSON object");
        }
        return (ObjectNode) node;
    }

    private <T> T readBody(byte[] body, Class<T> type) throws IOException {
        if (body.length == 0) {
            throw MatrixException.badJson("request body must be a JSON object");
        }
        return json.readValue(body, type);
    }

    private static void requireMethod(String method, String expected, boolean shapeOk) {
        if (!shapeOk) {
            throw new MatrixException(404, "M_UNRECOGNIZED", "unrecognized request path");
        }
        if (!expected.equals(method)) {
            throw new MatrixException(405, "M_UNRECOGNIZED", "method not allowed");
        }
    }

    private static String param(HttpServerExchange ex, String name) {
        return firstOrNull(ex.getQueryParameters().get(name));
    }

    private static Long longParam(HttpServerExchange ex, String name) {
        String v = param(ex, name);
        if (v == null || v.isBlank()) return null;
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException nfe) {
            throw MatrixException.invalidParam(name + " must be an integer");
        }
    }

    private static String firstOrNull(Deque<String> deque) {
        return (deque == null || deque.isEmpty()) ? null : deque.getFirst();
    }

    private static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static long millisSince(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }

    private String randomId(int length) {
        String alphabet = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        return sb.toString();
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(ByteBuffer.wrap(bytes));
        } catch (JsonProcessingException e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"errcode\":\"M_UNKNOWN\",\"error\":\"serialization\"}");
        }
    }
}
