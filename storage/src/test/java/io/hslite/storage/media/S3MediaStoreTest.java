// file: storage/src/test/java/io/hslite/storage/media/S3MediaStoreTest.java
package io.hslite.storage.media;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectResponse;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class S3MediaStoreTest {

    @TempDir Path dir;

    /** Bucket held in memory; keys are "bucket/key". */
    static final class InMemoryS3 implements S3Client {
        final Map<String, byte[]> bodies = new HashMap<>();
        final Map<String, PutObjectRequest> heads = new HashMap<>();
        boolean closed;

        @Override
        public PutObjectResponse putObject(PutObjectRequest request, RequestBody body) {
            try (InputStream in = body.contentStreamProvider().newStream()) {
                bodies.put(request.bucket() + "/" + request.key(), in.readAllBytes());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            heads.put(request.bucket() + "/" + request.key(), request);
            return PutObjectResponse.builder().build();
        }

        @Override
        public ResponseBytes<GetObjectResponse> getObjectAsBytes(GetObjectRequest request) {
            String k = request.bucket() + "/" + request.key();
            byte[] body = bodies.get(k);
            if (body == null) {
                throw NoSuchKeyException.builder().statusCode(404).message("no such key").build();
            }
            PutObjectRequest head = heads.get(k);
            var response = GetObjectResponse.builder()
                    .contentType(head.contentType())
                    .metadata(head.hasMetadata() ? head.metadata() : Map.of())
                    .build();
            return ResponseBytes.fromByteArray(response, body);
        }

        @Override
        public DeleteObjectResponse deleteObject(DeleteObjectRequest request) {
            bodies.remove(request.bucket() + "/" + request.key());
            heads.remove(request.bucket() + "/" + request.key());
            return DeleteObjectResponse.builder().build();
        }

        @Override
        public String serviceName() {
            return "s3";
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    @Test
    void put_get_delete_against_the_bucket() {
        var s3 = new InMemoryS3();
        var store = new S3MediaStore(s3, "media");
        byte[] body = "png-bytes".getBytes(StandardCharsets.UTF_8);

        store.put("abc123", body, new MediaStore.MediaMetadata("image/png", Map.of("uploader", "@a:a.test")));

        assertTrue(s3.bodies.containsKey("media/abc123"));
        var got = store.get("abc123");
        assertArrayEquals(body, got.body());
        assertEquals("image/png", got.contentType());
        assertEquals("@a:a.test", got.customMetadata().get("uploader"));

        store.delete("abc123");
        assertNull(store.get("abc123"));
        assertDoesNotThrow(() -> store.delete("abc123"));

        store.close();
        assertTrue(s3.closed);
    }

    @Test
    void empty_key_is_rejected_before_any_request() {
        var s3 = new InMemoryS3();
        var store = new S3MediaStore(s3, "media");
        assertThrows(IllegalArgumentException.class,
                () -> store.put("", new byte[0], new MediaStore.MediaMetadata(null, null)));
        assertTrue(s3.bodies.isEmpty());
    }

    @Test
    void settings_pick_the_backend() {
        try (MediaStore files = MediaStores.create(MediaSettings.FILE, dir.resolve("media"))) {
            assertInstanceOf(FileMediaStore.class, files);
        }
        try (MediaStore s3 = MediaStores.create(
                MediaSettings.s3("media", "http://localhost:9000", "us-east-1", "key", "secret"), dir)) {
            assertInstanceOf(S3MediaStore.class, s3);
        }
    }

    @Test
    void s3_settings_need_bucket_region_and_credentials() {
        assertThrows(IllegalArgumentException.class,
                () -> MediaSettings.s3(null, null, "us-east-1", "k", "s"));
        assertThrows(IllegalArgumentException.class,
                () -> MediaSettings.s3("media", null, null, "k", "s"));
        assertThrows(IllegalArgumentException.class,
                () -> MediaSettings.s3("media", null, "us-east-1", null, "s"));
        assertEquals(MediaSettings.Backend.S3, MediaSettings.Backend.fromName(" s3 "));
        assertThrows(IllegalArgumentException.class, () -> MediaSettings.Backend.fromName("ftp"));
        assertFalse(MediaSettings.s3("media", null, "us-east-1", "k", "secret").toString().contains("secret"));
    }
}
