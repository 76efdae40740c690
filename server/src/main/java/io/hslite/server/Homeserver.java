// file: server/src/main/java/io/hslite/server/Homeserver.java
package io.hslite.server;

import io.hslite.core.auth.AuthRules;
import io.hslite.core.resolution.StateResolutionV2;
import io.hslite.core.signing.KeyRing;
import io.hslite.core.signing.ServerSigningKey;
import io.hslite.server.account.AccessTokenValidator;
import io.hslite.server.account.StaticAccessTokens;
import io.hslite.server.federation.BackfillCoordinator;
import io.hslite.server.federation.FederationExchange;
import io.hslite.server.federation.FederationReceiver;
import io.hslite.server.room.EventAdmitter;
import io.hslite.server.room.EventFactory;
import io.hslite.server.room.RoomRegistry;
import io.hslite.server.sync.EphemeralStore;
import io.hslite.server.sync.SyncSessionManager;
import io.hslite.server.timeline.TimelineBuilder;
import io.hslite.storage.DurableEventStore;
import io.hslite.storage.TtlTransactionIdCache;
import io.hslite.storage.media.MediaStore;
import io.hslite.storage.media.MediaStores;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * One homeserver: storage, room actors, sync and federation wired together.
 *
 * Responsibilities:
 *  - Open the durable store and the signing key under the data directory.
 *  - Build the admission pipeline and the room registry.
 *  - Connect room updates and ephemeral changes to sync wake-ups.
 *  - Own the executors and shut them down on close.
 */
public final class Homeserver implements AutoCloseable {
    private static final Logger log = Logger.getLogger(Homeserver.class.getName());

    private final String serverName;
    private final DurableEventStore store;
    private final ServerSigningKey signingKey;
    private final KeyRing keyRing;
    private final ExecutorService actorPool;
    private final ScheduledExecutorService scheduler;
    private final RoomRegistry rooms;
    private final TimelineBuilder timeline;
    private final EphemeralStore ephemeral;
    private final SyncSessionManager sync;
    private final FederationReceiver receiver;
    private final RoomService roomService;
    private final MediaStore media;
    private final AccessTokenValidator accessTokens;

    public Homeserver(ServerConfig server, HomeserverConfig config, FederationExchange federation) {
        this.serverName = server.serverName();
        Path dataDir = Path.of(server.dataDir());
        Clock clock = Clock.systemUTC();

        this.store = DurableEventStore.open(dataDir, config.snapshotEvery());
        this.signingKey = ServerSigningKey.loadOrGenerate(dataDir.resolve("signing.key"),
                serverName, config.signingKeyName());
        this.keyRing = new KeyRing();
        keyRing.register(signingKey);

        this.actorPool = Executors.newFixedThreadPool(
                Math.max(2, Runtime.getRuntime().availableProcessors()), daemonThreads(serverName + "-room"));
        this.scheduler = Executors.newScheduledThreadPool(2, daemonThreads(serverName + "-sched"));

        var admitter = new EventAdmitter(store, new StateResolutionV2(), AuthRules.standard(), keyRing);
        var factory = new EventFactory(store, signingKey, clock);
        this.rooms = new RoomRegistry(store, admitter, factory, actorPool, federation::eventAdmitted);

        this.timeline = new TimelineBuilder(store);
        this.ephemeral = new EphemeralStore(clock);
        this.sync = new SyncSessionManager(rooms, store, store, timeline, ephemeral, scheduler, config.sync());
        rooms.addListener(sync::roomUpdated);
        ephemeral.addListener(sync::wake);

        var backfill = new BackfillCoordinator(federation, rooms, store, config.backfillRetry(), scheduler);
        this.receiver = new FederationReceiver(rooms, backfill);

        var txns = new TtlTransactionIdCache(Duration.ofSeconds(server.txnTtlSeconds()), clock);
        this.roomService = new RoomService(serverName, rooms, store, timeline, ephemeral, txns, backfill,
                config.defaultRoomVersion());
        this.media = MediaStores.create(config.media(), dataDir.resolve("media"));

        var tokens = new StaticAccessTokens();
        config.accessTokens().forEach(tokens::add);
        this.accessTokens = tokens;

        log.info("Homeserver " + serverName + " opened " + dataDir.toAbsolutePath()
                + " (" + store.rooms().size() + " rooms, key " + signingKey.keyId() + ")");
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public String serverName() {
        return serverName;
    }

    public ServerSigningKey signingKey() {
        return signingKey;
    }

    public KeyRing keyRing() {
        return keyRing;
    }

    public DurableEventStore store() {
        return store;
    }

    public RoomRegistry rooms() {
        return rooms;
    }

    public RoomService roomService() {
        return roomService;
    }

    public TimelineBuilder timeline() {
        return timeline;
    }

    public SyncSessionManager sync() {
        return sync;
    }

    public FederationReceiver receiver() {
        return receiver;
    }

    public MediaStore media() {
        return media;
    }

    public AccessTokenValidator accessTokens() {
        return accessTokens;
    }

    /** Stop the executors, then flush and close the store. */
    @Override
    public void close() throws Exception {
        scheduler.shutdownNow();
        actorPool.shutdown();
        if (!actorPool.awaitTermination(5, TimeUnit.SECONDS)) {
            log.warning("Room actors of " + serverName + " did not stop in time");
            actorPool.shutdownNow();
        }
        media.close();
        store.close();
        log.info("Homeserver " + serverName + " closed");
    }
}
