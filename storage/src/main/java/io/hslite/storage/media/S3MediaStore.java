// file: storage/src/main/java/io/hslite/storage/media/S3MediaStore.java
package io.hslite.storage.media;

import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Media in an S3-compatible bucket (AWS, MinIO, R2 through its S3 API).
 * Custom metadata travels as {@code x-amz-meta-*} headers.
 */
public final class S3MediaStore implements MediaStore {
    private static final Logger log = Logger.getLogger(S3MediaStore.class.getName());

    private final S3Client client;
    private final String bucket;

    public S3MediaStore(S3Client client, String bucket) {
        this.client = Objects.requireNonNull(client, "client");
        this.bucket = Objects.requireNonNull(bucket, "bucket");
    }

    /** Builds a path-style client, which most S3-compatible services require. */
    public static S3MediaStore connect(MediaSettings settings) {
        var builder = S3Client.builder()
                .region(Region.of(settings.region()))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(settings.accessKeyId(), settings.secretAccessKey())))
                .forcePathStyle(true);
        if (settings.endpoint() != null) {
            builder.endpointOverride(URI.create(settings.endpoint()));
        }
        log.info("Media stored in " + settings);
        return new S3MediaStore(builder.build(), settings.bucket());
    }

    @Override
    public void put(String key, byte[] body, MediaMetadata metadata) {
        checkKey(key);
        var request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(metadata.contentType());
        if (!metadata.customMetadata().isEmpty()) {
            request.metadata(metadata.customMetadata());
        }
        client.putObject(request.build(), RequestBody.fromBytes(body));
    }

    @Override
    public MediaObject get(String key) {
        checkKey(key);
        ResponseBytes<GetObjectResponse> bytes;
        try {
            bytes = client.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build());
        } catch (NoSuchKeyException e) {
            return null;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) return null;
            throw e;
        }
        GetObjectResponse response = bytes.response();
        return new MediaObject(bytes.asByteArray(), response.contentType(),
                response.hasMetadata() ? response.metadata() : Map.of());
    }

    @Override
    public void delete(String key) {
        checkKey(key);
        client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
    }

    @Override
    public void close() {
        client.close();
    }

    private static void checkKey(String key) {
        if (key == null || key.isEmpty() || key.length() > 1024) {
            throw new IllegalArgumentException("invalid media key: " + key);
        }
    }
}
