// file: server/src/main/java/io/hslite/server/RoomService.java
package io.hslite.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hslite.core.EventTypes;
import io.hslite.core.Membership;
import io.hslite.core.RoomEvent;
import io.hslite.core.RoomVersion;
import io.hslite.core.StateKey;
import io.hslite.server.account.Requester;
import io.hslite.server.federation.BackfillCoordinator;
import io.hslite.server.room.AdmissionResult;
import io.hslite.server.room.EventDraft;
import io.hslite.server.room.EventOrigin;
import io.hslite.server.room.RoomActor;
import io.hslite.server.room.RoomRegistry;
import io.hslite.server.room.RoomSnapshot;
import io.hslite.server.sync.EphemeralStore;
import io.hslite.server.timeline.Direction;
import io.hslite.server.timeline.PaginationToken;
import io.hslite.server.timeline.TimelineBuilder;
import io.hslite.server.timeline.TimelinePage;
import io.hslite.storage.EventStore;
import io.hslite.storage.StoredEvent;
import io.hslite.storage.TransactionIdCache;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Application service for room operations.
 * <p>
 * Responsibilities:
 *  - Turn client intents (create, send, state, membership, redact) into drafts
 *    for the room actors and map admission results to client errors.
 *  - Make client retries idempotent through transaction ids.
 *  - Enforce read access for state and history.
 *  - Fire a backfill when an externally built event has a gap.
 */
public final class RoomService {
    private static final Logger log = Logger.getLogger(RoomService.class.getName());
    private static final String ID_ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private final String serverName;
    private final RoomRegistry rooms;
    private final EventStore store;
    private final TimelineBuilder timeline;
    private final EphemeralStore ephemeral;
    private final TransactionIdCache txns;
    private final BackfillCoordinator backfill;
    private final RoomVersion defaultVersion;

    private final SecureRandom random = new SecureRandom();
    private final Map<String, CompletableFuture<String>> inFlightTxns = new ConcurrentHashMap<>();

    public RoomService(String serverName,
                       RoomRegistry rooms,
                       EventStore store,
                       TimelineBuilder timeline,
                       EphemeralStore ephemeral,
                       TransactionIdCache txns,
                       BackfillCoordinator backfill,
                       RoomVersion defaultVersion) {
        this.serverName = Objects.requireNonNull(serverName, "serverName");
        this.rooms = Objects.requireNonNull(rooms, "rooms");
        this.store = Objects.requireNonNull(store, "store");
        this.timeline = Objects.requireNonNull(timeline, "timeline");
        this.ephemeral = Objects.requireNonNull(ephemeral, "ephemeral");
        this.txns = Objects.requireNonNull(txns, "txns");
        this.backfill = Objects.requireNonNull(backfill, "backfill");
        this.defaultVersion = Objects.requireNonNull(defaultVersion, "defaultVersion");
    }

    /** Options of a new room. Null fields use defaults. */
    public record CreateRoom(String roomVersion, String preset, String name, String topic, List<String> invite) {
        public CreateRoom {
            invite = invite == null ? List.of() : List.copyOf(invite);
        }
    }

    public enum MembershipAction { INVITE, JOIN, LEAVE, KICK, BAN, UNBAN }

    // ---------- admission ----------

    /**
     * Admit an event that was built outside this server's draft path. Events
     * whose origin is this server count as local; everything else as federation.
     * A gap fires one backfill request, attached to the result.
     */
    public CompletableFuture<AdmissionResult> submit(String roomId, RoomEvent candidate) {
        EventOrigin origin = serverName.equals(candidate.originServer()) ? EventOrigin.LOCAL : EventOrigin.FEDERATION;
        return rooms.actor(roomId).submit(candidate, origin).thenApply(r -> {
            if (r instanceof AdmissionResult.GraphGap gap) {
                CompletableFuture<Boolean> f = backfill.backfill(roomId, gap.missing());
                f.whenComplete((ok, err) -> {
                    if (err != null) log.log(Level.WARNING, "Backfill for " + roomId + " failed", err);
                });
                return gap.withBackfill(f);
            }
            return r;
        });
    }

    // ---------- client writes ----------

    public CompletableFuture<String> createRoom(Requester requester, CreateRoom options) {
        if (!serverName.equals(RoomEvent.serverOf(requester.userId()))) {
            throw MatrixException.forbidden("only local users can create rooms here");
        }
        RoomVersion version;
        try {
            version = options.roomVersion() == null ? defaultVersion : RoomVersion.fromId(options.roomVersion());
        } catch (IllegalArgumentException e) {
            throw new MatrixException(400, "M_UNSUPPORTED_ROOM_VERSION", e.getMessage());
        }
        String roomId = newRoomId();
        RoomActor actor = rooms.actor(roomId);
        String user = requester.userId();
        JsonNodeFactory f = JsonNodeFactory.instance;

        ObjectNode create = f.objectNode().put("room_version", version.id());
        if (!version.creatorFromSender()) {
            create.put("creator", user);
        }
        ObjectNode pl = f.objectNode();
        pl.putObject("users").put(user, 100);
        pl.put("users_default", 0).put("events_default", 0).put("state_default", 50)
                .put("ban", 50).put("kick", 50).put("redact", 50).put("invite", 0);
        pl.putObject("events");
        String joinRule = "public_chat".equals(options.preset()) ? "public" : "invite";

        List<EventDraft> drafts = new ArrayList<>();
        drafts.add(EventDraft.state(user, EventTypes.CREATE, "", create));
        drafts.add(EventDraft.state(user, EventTypes.MEMBER, user, membership(Membership.JOIN, null)));
        drafts.add(EventDraft.state(user, EventTypes.POWER_LEVELS, "", pl));
        drafts.add(EventDraft.state(user, EventTypes.JOIN_RULES, "", f.objectNode().put("join_rule", joinRule)));
        drafts.add(EventDraft.state(user, EventTypes.HISTORY_VISIBILITY, "",
                f.objectNode().put("history_visibility", "shared")));
        if (options.name() != null) {
            drafts.add(EventDraft.state(user, EventTypes.NAME, "", f.objectNode().put("name", options.name())));
        }
        if (options.topic() != null) {
            drafts.add(EventDraft.state(user, EventTypes.TOPIC, "", f.objectNode().put("topic", options.topic())));
        }
        for (String invitee : options.invite()) {
            drafts.add(EventDraft.state(user, EventTypes.MEMBER, invitee, membership(Membership.INVITE, null)));
        }

        CompletableFuture<String> chain = CompletableFuture.completedFuture(null);
        for (EventDraft d : drafts) {
            chain = chain.thenCompose(prev -> actor.submitDraft(d)).thenApply(RoomService::eventIdOrThrow);
        }
        return chain.thenApply(last -> {
            log.info("Room " + roomId + " created by " + user + " (version " + version.id() + ")");
            return roomId;
        });
    }

    public CompletableFuture<String> sendMessage(Requester requester, String roomId, String type, String txnId,
                                                 ObjectNode content) {
        RoomActor actor = requireRoom(roomId);
        if (type.isBlank()) throw MatrixException.invalidParam("event type must not be empty");
        return withTxn(requester, roomId + "|send|" + txnId,
                () -> actor.submitDraft(EventDraft.message(requester.userId(), type, content)));
    }

    public CompletableFuture<String> sendState(Requester requester, String roomId, String type, String stateKey,
                                               ObjectNode content) {
        RoomActor actor = requireRoom(roomId);
        if (EventTypes.CREATE.equals(type)) {
            throw MatrixException.forbidden("the create event cannot be replaced");
        }
        return actor.submitDraft(EventDraft.state(requester.userId(), type, stateKey, content))
                .thenApply(RoomService::eventIdOrThrow);
    }

    public CompletableFuture<String> membership(Requester requester, String roomId, MembershipAction action,
                                                String target, String reason) {
        RoomActor actor = requireRoom(roomId);
        String self = requester.userId();
        Membership m;
        String stateKey;
        switch (action) {
            case JOIN -> { m = Membership.JOIN; stateKey = self; }
            case LEAVE -> { m = Membership.LEAVE; stateKey = self; }
            case INVITE -> { m = Membership.INVITE; stateKey = requireTarget(target); }
            case KICK, UNBAN -> { m = Membership.LEAVE; stateKey = requireTarget(target); }
            case BAN -> { m = Membership.BAN; stateKey = requireTarget(target); }
            default -> throw new IllegalArgumentException("unknown membership action " + action);
        }
        return actor.submitDraft(EventDraft.state(self, EventTypes.MEMBER, stateKey, membership(m, reason)))
                .thenApply(RoomService::eventIdOrThrow);
    }

    public CompletableFuture<String> redact(Requester requester, String roomId, String targetId, String txnId,
                                            String reason) {
        RoomActor actor = requireRoom(roomId);
        ObjectNode content = JsonNodeFactory.instance.objectNode();
        if (reason != null) content.put("reason", reason);
        return withTxn(requester, roomId + "|redact|" + txnId,
                () -> actor.submitDraft(EventDraft.redaction(requester.userId(), targetId, content)));
    }

    public void typing(Requester requester, String roomId, String userId, boolean typing, long timeoutMs) {
        if (!requester.userId().equals(userId)) {
            throw MatrixException.forbidden("cannot set typing state for another user");
        }
        requireJoined(requester, requireRoom(roomId).snapshot());
        ephemeral.setTyping(roomId, userId, typing, timeoutMs);
    }

    public void receipt(Requester requester, String roomId, String eventId) {
        requireJoined(requester, requireRoom(roomId).snapshot());
        StoredEvent s = store.get(eventId);
        if (s == null || !s.accepted() || !s.roomId().equals(roomId)) {
            throw MatrixException.notFound("unknown event " + eventId);
        }
        ephemeral.receipt(roomId, requester.userId(), eventId);
    }

    // ---------- client reads ----------

    /** Full room state, now or as of stream position {@code at}. */
    public List<ObjectNode> state(Requester requester, String roomId, Long at) {
        RoomActor actor = requireRoom(roomId);
        requireJoined(requester, actor.snapshot());
        Map<StateKey, String> state = at == null ? actor.currentState() : actor.resolvedState(at);
        List<ObjectNode> out = new ArrayList<>(state.size());
        for (String id : state.values()) {
            ObjectNode json = timeline.render(id);
            if (json != null) out.add(json);
        }
        return out;
    }

    /** Content of one state event. */
    public JsonNode stateContent(Requester requester, String roomId, String type, String stateKey) {
        RoomActor actor = requireRoom(roomId);
        requireJoined(requester, actor.snapshot());
        String id = actor.currentState().get(StateKey.of(type, stateKey));
        ObjectNode json = id == null ? null : timeline.render(id);
        if (json == null) {
            throw MatrixException.notFound("no " + type + " state with key '" + stateKey + "'");
        }
        return json.get("content");
    }

    public TimelinePage messages(Requester requester, String roomId, String from, Direction dir, int limit) {
        RoomActor actor = requireRoom(roomId);
        requireJoined(requester, actor.snapshot());
        PaginationToken token = from == null ? null : PaginationToken.decode(from);
        return timeline.page(roomId, token, limit, dir);
    }

    // ---------- helpers ----------

    public RoomActor requireRoom(String roomId) {
        RoomActor actor = rooms.existing(roomId);
        if (actor == null) {
            throw MatrixException.notFound("unknown room " + roomId);
        }
        return actor;
    }

    private void requireJoined(Requester requester, RoomSnapshot room) {
        String id = room.state().get(StateKey.member(requester.userId()));
        RoomEvent member = id == null ? null : store.find(id);
        if (member == null || Membership.fromContent(member.content()) != Membership.JOIN) {
            throw MatrixException.forbidden(requester.userId() + " is not joined to " + room.roomId());
        }
    }

    private CompletableFuture<String> withTxn(Requester requester, String txnKey,
                                              Supplier<CompletableFuture<AdmissionResult>> send) {
        Optional<String> known = txns.lookup(requester.deviceId(), txnKey);
        if (known.isPresent()) {
            return CompletableFuture.completedFuture(known.get());
        }
        String inflightKey = requester.deviceId() + "|" + txnKey;
        CompletableFuture<String> created = new CompletableFuture<>();
        CompletableFuture<String> existing = inFlightTxns.putIfAbsent(inflightKey, created);
        if (existing != null) {
            return existing;
        }
        send.get().thenApply(RoomService::eventIdOrThrow).whenComplete((eventId, err) -> {
            if (err == null) {
                created.complete(txns.remember(requester.deviceId(), txnKey, eventId));
            } else {
                created.completeExceptionally(err);
            }
            inFlightTxns.remove(inflightKey, created);
        });
        return created;
    }

    private static String requireTarget(String target) {
        if (target == null || !target.startsWith("@") || target.indexOf(':') < 0) {
            throw MatrixException.invalidParam("user_id must look like @user:server");
        }
        return target;
    }

    private static ObjectNode membership(Membership m, String reason) {
        ObjectNode content = JsonNodeFactory.instance.objectNode().put("membership", m.wire());
        if (reason != null) content.put("reason", reason);
        return content;
    }

    private String newRoomId() {
        StringBuilder sb = new StringBuilder("!");
        for (int i = 0; i < 18; i++) {
            sb.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return sb.append(':').append(serverName).toString();
    }

    /** Event id of an accepted result; client error otherwise. */
    static String eventIdOrThrow(AdmissionResult r) {
        if (r instanceof AdmissionResult.Admitted a) return a.eventId();
        if (r instanceof AdmissionResult.Duplicate d) return d.eventId();
        throw asError(r);
    }

    static MatrixException asError(AdmissionResult r) {
        if (r instanceof AdmissionResult.GraphGap g) {
            return MatrixException.missingPrevEvents("missing events " + g.missing());
        }
        if (r instanceof AdmissionResult.Rejected rej) {
            return switch (rej.kind()) {
                case MALFORMED -> MatrixException.badJson(rej.reason());
                case AUTH -> MatrixException.forbidden(rej.reason());
                case RESOLUTION_FAILURE -> MatrixException.unknown(rej.reason());
            };
        }
        return MatrixException.unknown("unexpected admission result " + r);
    }
}
