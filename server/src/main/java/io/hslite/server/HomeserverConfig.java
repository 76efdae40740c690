// file: server/src/main/java/io/hslite/server/HomeserverConfig.java
package io.hslite.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hslite.core.RoomVersion;
import io.hslite.server.account.Requester;
import io.hslite.server.dto.JsonConfig;
import io.hslite.server.federation.RetryPolicy;
import io.hslite.server.sync.SyncSettings;
import io.hslite.storage.media.MediaSettings;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Homeserver tuning and the access-token table.
 * <p>
 * Immutable; the {@code with*} methods return modified copies.
 */
public final class HomeserverConfig {

    private final Map<String, Requester> accessTokens;
    private final RoomVersion defaultRoomVersion;
    private final int snapshotEvery;
    private final String signingKeyName;
    private final SyncSettings sync;
    private final RetryPolicy backfillRetry;
    private final MediaSettings media;

    public HomeserverConfig(Map<String, Requester> accessTokens,
                            RoomVersion defaultRoomVersion,
                            int snapshotEvery,
                            String signingKeyName,
                            SyncSettings sync,
                            RetryPolicy backfillRetry,
                            MediaSettings media) {
        if (snapshotEvery <= 0) throw new IllegalArgumentException("snapshotEvery must be > 0");
        if (signingKeyName == null || signingKeyName.isBlank()) {
            throw new IllegalArgumentException("signingKeyName must not be blank");
        }
        this.accessTokens = Map.copyOf(accessTokens);
        this.defaultRoomVersion = Objects.requireNonNull(defaultRoomVersion, "defaultRoomVersion");
        this.snapshotEvery = snapshotEvery;
        this.signingKeyName = signingKeyName;
        this.sync = Objects.requireNonNull(sync, "sync");
        this.backfillRetry = Objects.requireNonNull(backfillRetry, "backfillRetry");
        this.media = Objects.requireNonNull(media, "media");
    }

    public static HomeserverConfig defaults() {
        return new HomeserverConfig(Map.of(), RoomVersion.DEFAULT, 1000, "auto",
                SyncSettings.DEFAULTS, RetryPolicy.DEFAULT, MediaSettings.FILE);
    }

    public static HomeserverConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonConfig cfg = mapper.readValue(path.toFile(), JsonConfig.class);
            HomeserverConfig d = defaults();

            Map<String, Requester> tokens = new LinkedHashMap<>();
            if (cfg.accessTokens != null) {
                for (JsonConfig.AccessToken t : cfg.accessTokens) {
                    tokens.put(t.token, new Requester(t.userId, t.deviceId));
                }
            }
            SyncSettings sync = d.sync;
            if (cfg.sync != null) {
                sync = new SyncSettings(
                        cfg.sync.defaultTimeoutMs != null ? cfg.sync.defaultTimeoutMs : sync.defaultTimeoutMs(),
                        cfg.sync.maxTimeoutMs != null ? cfg.sync.maxTimeoutMs : sync.maxTimeoutMs(),
                        cfg.sync.defaultTimelineLimit != null ? cfg.sync.defaultTimelineLimit : sync.defaultTimelineLimit());
            }
            RetryPolicy retry = d.backfillRetry;
            if (cfg.backfill != null) {
                retry = new RetryPolicy(
                        cfg.backfill.maxAttempts != null ? cfg.backfill.maxAttempts : retry.maxAttempts(),
                        cfg.backfill.initialBackoffMs != null
                                ? Duration.ofMillis(cfg.backfill.initialBackoffMs) : retry.initialBackoff(),
                        cfg.backfill.multiplier != null ? cfg.backfill.multiplier : retry.multiplier());
            }
            MediaSettings media = d.media;
            if (cfg.media != null && cfg.media.backend != null) {
                media = new MediaSettings(MediaSettings.Backend.fromName(cfg.media.backend),
                        cfg.media.bucket, cfg.media.endpoint, cfg.media.region,
                        cfg.media.accessKeyId, cfg.media.secretAccessKey);
            }
            return new HomeserverConfig(
                    tokens,
                    cfg.defaultRoomVersion != null ? RoomVersion.fromId(cfg.defaultRoomVersion) : d.defaultRoomVersion,
                    cfg.snapshotEvery != null ? cfg.snapshotEvery : d.snapshotEvery,
                    cfg.signingKeyName != null ? cfg.signingKeyName : d.signingKeyName,
                    sync,
                    retry,
                    media
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load HomeserverConfig from " + path, e);
        }
    }

    public HomeserverConfig withAccessToken(String token, String userId, String deviceId) {
        Map<String, Requester> tokens = new LinkedHashMap<>(accessTokens);
        tokens.put(token, new Requester(userId, deviceId));
        return new HomeserverConfig(tokens, defaultRoomVersion, snapshotEvery, signingKeyName, sync, backfillRetry, media);
    }

    public HomeserverConfig withSync(SyncSettings sync) {
        return new HomeserverConfig(accessTokens, defaultRoomVersion, snapshotEvery, signingKeyName, sync, backfillRetry,
                media);
    }

    public HomeserverConfig withBackfillRetry(RetryPolicy retry) {
        return new HomeserverConfig(accessTokens, defaultRoomVersion, snapshotEvery, signingKeyName, sync, retry, media);
    }

    public HomeserverConfig withDefaultRoomVersion(RoomVersion version) {
        return new HomeserverConfig(accessTokens, version, snapshotEvery, signingKeyName, sync, backfillRetry, media);
    }

    public HomeserverConfig withMedia(MediaSettings media) {
        return new HomeserverConfig(accessTokens, defaultRoomVersion, snapshotEvery, signingKeyName, sync,
                backfillRetry, media);
    }

    public Map<String, Requester> accessTokens() {
        return accessTokens;
    }

    public RoomVersion defaultRoomVersion() {
        return defaultRoomVersion;
    }

    public int snapshotEvery() {
        return snapshotEvery;
    }

    public String signingKeyName() {
        return signingKeyName;
    }

    public SyncSettings sync() {
        return sync;
    }

    public RetryPolicy backfillRetry() {
        return backfillRetry;
    }

    public MediaSettings media() {
        return media;
    }
}
