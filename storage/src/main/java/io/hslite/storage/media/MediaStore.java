// file: storage/src/main/java/io/hslite/storage/media/MediaStore.java
package io.hslite.storage.media;

import java.util.Map;

/**
 * Blob storage for uploaded media. Content is opaque; no transcoding.
 * {@link MediaStores#create} picks the backend from {@link MediaSettings}.
 */
public interface MediaStore extends AutoCloseable {

    void put(String key, byte[] body, MediaMetadata metadata);

    /** @return the object, or null when the key is unknown */
    MediaObject get(String key);

    /** Deleting an unknown key is not an error. */
    void delete(String key);

    /** Release connections held by the backend. */
    @Override
    default void close() {
    }

    record MediaMetadata(String contentType, Map<String, String> customMetadata) {
        public MediaMetadata {
            customMetadata = customMetadata == null ? Map.of() : Map.copyOf(customMetadata);
        }
    }

    record MediaObject(byte[] body, String contentType, Map<String, String> customMetadata) {}
}
