// file: storage/src/main/java/io/hslite/storage/media/FileMediaStore.java
package io.hslite.storage.media;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Media in a directory: "<key>" holds the bytes, "<key>.meta.json" the metadata.
 * Both are written to a temp file first and moved into place.
 */
public final class FileMediaStore implements MediaStore {
    private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z0-9._=-]{1,255}");

    private final Path dir;
    private final ObjectMapper mapper = new ObjectMapper();

    public FileMediaStore(Path dir) {
        this.dir = dir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create media directory " + dir, e);
        }
    }

    @Override
    public void put(String key, byte[] body, MediaMetadata metadata) {
        Path data = resolve(key);
        Path meta = dir.resolve(key + ".meta.json");
        try {
            writeAtomically(meta, mapper.writeValueAsBytes(metadata));
            writeAtomically(data, body);
        } catch (IOException e) {
            throw new UncheckedIOException("Media write failed for " + key, e);
        }
    }

    @Override
    public MediaObject get(String key) {
        Path data = resolve(key);
        if (!Files.exists(data)) return null;
        try {
            Path meta = dir.resolve(key + ".meta.json");
            MediaMetadata m = Files.exists(meta)
                    ? mapper.readValue(meta.toFile(), MediaMetadata.class)
                    : new MediaMetadata(null, null);
            return new MediaObject(Files.readAllBytes(data), m.contentType(), m.customMetadata());
        } catch (IOException e) {
            throw new UncheckedIOException("Media read failed for " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            Files.deleteIfExists(resolve(key));
            Files.deleteIfExists(dir.resolve(key + ".meta.json"));
        } catch (IOException e) {
            throw new UncheckedIOException("Media delete failed for " + key, e);
        }
    }

    private Path resolve(String key) {
        if (key == null || !SAFE_KEY.matcher(key).matches() || key.startsWith(".")
                || key.endsWith(".meta.json") || key.endsWith(".tmp")) {
            throw new IllegalArgumentException("invalid media key: " + key);
        }
        return dir.resolve(key);
    }

    private static void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.write(tmp, bytes);
        Files.move(tmp, target, ATOMIC_MOVE, REPLACE_EXISTING);
    }
}
