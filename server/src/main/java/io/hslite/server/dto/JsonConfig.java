// file: server/src/main/java/io/hslite/server/dto/JsonConfig.java
package io.hslite.server.dto;

import java.util.List;

public class JsonConfig {
    public List<AccessToken> accessTokens;
    public String defaultRoomVersion;
    public Integer snapshotEvery;
    public String signingKeyName;
    public Sync sync;
    public Backfill backfill;
    public Media media;

    public static class AccessToken {
        public String token;
        public String userId;
        public String deviceId;
    }

    public static class Sync {
        public Long defaultTimeoutMs;
        public Long maxTimeoutMs;
        public Integer defaultTimelineLimit;
    }

    public static class Backfill {
        public Integer maxAttempts;
        public Long initialBackoffMs;
        public Double multiplier;
    }

    public static class Media {
        public String backend;
        public String bucket;
        public String endpoint;
        public String region;
        public String accessKeyId;
        public String secretAccessKey;
    }
}
