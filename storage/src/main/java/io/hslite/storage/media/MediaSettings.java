// file: storage/src/main/java/io/hslite/storage/media/MediaSettings.java
package io.hslite.storage.media;

import java.util.Locale;
import java.util.Objects;

/**
 * Which media backend to use and how to reach it. The S3 fields are ignored
 * for {@link Backend#FILE}.
 *
 * @param endpoint S3-compatible endpoint URI; null uses the AWS endpoint of {@code region}
 */
public record MediaSettings(Backend backend,
                            String bucket,
                            String endpoint,
                            String region,
                            String accessKeyId,
                            String secretAccessKey) {

    public enum Backend {
        FILE, S3;

        public static Backend fromName(String name) {
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unknown media backend: " + name, e);
            }
        }
    }

    public static final MediaSettings FILE = new MediaSettings(Backend.FILE, null, null, null, null, null);

    public MediaSettings {
        Objects.requireNonNull(backend, "backend");
        if (backend == Backend.S3) {
            if (bucket == null || bucket.isBlank()) {
                throw new IllegalArgumentException("S3 media backend needs a bucket");
            }
            if (region == null || region.isBlank()) {
                throw new IllegalArgumentException("S3 media backend needs a region");
            }
            if (accessKeyId == null || secretAccessKey == null) {
                throw new IllegalArgumentException("S3 media backend needs accessKeyId and secretAccessKey");
            }
        }
    }

    public static MediaSettings s3(String bucket, String endpoint, String region,
                                   String accessKeyId, String secretAccessKey) {
        return new MediaSettings(Backend.S3, bucket, endpoint, region, accessKeyId, secretAccessKey);
    }

    /** Secrets stay out of logs. */
    @Override
    public String toString() {
        return backend == Backend.FILE
                ? "MediaSettings[file]"
                : "MediaSettings[s3 bucket=" + bucket + " endpoint=" + endpoint + " region=" + region + "]";
    }
}
