// file: storage/src/main/java/io/hslite/storage/media/MediaStores.java
package io.hslite.storage.media;

import java.nio.file.Path;

public final class MediaStores {

    private MediaStores() {
    }

    /**
     * The store {@code settings} asks for. {@code fileDir} is only used by the
     * file backend.
     */
    public static MediaStore create(MediaSettings settings, Path fileDir) {
        return switch (settings.backend()) {
            case FILE -> new FileMediaStore(fileDir);
            case S3 -> S3MediaStore.connect(settings);
        };
    }
}
