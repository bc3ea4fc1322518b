package com.apistack.service.storage;

import com.apistack.common.exception.StorageException;
import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.GetPresignedObjectUrlArgs;
import io.minio.ListObjectsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.ObjectWriteResponse;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.Result;
import io.minio.StatObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.errors.ServerException;
import io.minio.messages.Item;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Object storage on the MinIO Java SDK.
 *
 * <p>The client is built with a fixed region, so presigning happens locally. The SDK rejects an
 * expiry below one second; for a requested expiry of 0 it is asked for one second while the returned
 * {@link SignedUrl} records the requested (already passed) expiry.
 */
@Slf4j
public class MinioObjectStorage implements ObjectStorage {

    private static final Set<String> NOT_FOUND_CODES = Set.of("NoSuchKey", "NoSuchBucket", "NoSuchObject");
    private static final Set<String> DENIED_CODES = Set.of(
            "AccessDenied", "InvalidAccessKeyId", "SignatureDoesNotMatch", "AllAccessDisabled");

    private final MinioClient client;
    private final Clock clock;
    private final boolean verifyBeforeSigning;

    public MinioObjectStorage(MinioClient client, Clock clock, boolean verifyBeforeSigning) {
        this.client = client;
        this.clock = clock;
        this.verifyBeforeSigning = verifyBeforeSigning;
    }

    @Override
    public StoredObject put(String bucket, String key, byte[] bytes, String contentType) {
        try {
            ObjectWriteResponse response = client.putObject(PutObjectArgs.builder()
                    .bucket(bucket)
                    .object(key)
                    .stream(new ByteArrayInputStream(bytes), bytes.length, -1)
                    .contentType(contentType)
                    .build());
            log.debug("Stored {}/{} ({} bytes)", bucket, key, bytes.length);
            return StoredObject.builder()
                    .bucket(bucket)
                    .key(key)
                    .size(bytes.length)
                    .etag(response.etag())
                    .contentType(contentType)
                    .build();
        } catch (Exception e) {
            throw translate("put", bucket, key, e);
        }
    }

    @Override
    public byte[] get(String bucket, String key) {
        try (GetObjectResponse in = client.getObject(GetObjectArgs.builder().bucket(bucket).object(key).build())) {
            return in.readAllBytes();
        } catch (Exception e) {
            throw translate("get", bucket, key, e);
        }
    }

    @Override
    public void delete(String bucket, String key) {
        try {
            client.removeObject(RemoveObjectArgs.builder().bucket(bucket).object(key).build());
        } catch (Exception e) {
            throw translate("delete", bucket, key, e);
        }
    }

    @Override
    public List<StoredObject> list(String bucket, String prefix) {
        Iterable<Result<Item>> results = client.listObjects(ListObjectsArgs.builder()
                .bucket(bucket)
                .prefix(prefix)
                .recursive(true)
                .build());
        List<StoredObject> objects = new ArrayList<>();
        try {
            for (Result<Item> result : results) {
                Item item = result.get();
                objects.add(StoredObject.builder()
                        .bucket(bucket)
                        .key(item.objectName())
                        .size(item.size())
                        .etag(item.etag())
                        .build());
            }
        } catch (Exception e) {
            throw translate("list", bucket, prefix, e);
        }
        return objects;
    }

    @Override
    public SignedUrl signedUrl(String bucket, String key, long expirySeconds, AccessMode mode) {
        if (expirySeconds < 0 || expirySeconds > MAX_EXPIRY_SECONDS) {
            throw new IllegalArgumentException("Expiry must be between 0 and " + MAX_EXPIRY_SECONDS + " seconds");
        }
        if (verifyBeforeSigning && mode == AccessMode.READ) {
            stat(bucket, key);
        }

        Instant issuedAt = clock.instant();
        try {
            String url = client.getPresignedObjectUrl(GetPresignedObjectUrlArgs.builder()
                    .method(mode.getMethod())
                    .bucket(bucket)
                    .object(key)
                    // SDK minimum; expiresAt below keeps the requested lifetime
                    .expiry((int) Math.max(1, expirySeconds))
                    .build());
            return new SignedUrl(url, mode, issuedAt, issuedAt.plusSeconds(expirySeconds));
        } catch (Exception e) {
            throw translate("sign", bucket, key, e);
        }
    }

    @Override
    public void ensureBucket(String bucket) {
        try {
            if (!client.bucketExists(BucketExistsArgs.builder().bucket(bucket).build())) {
                client.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
                log.info("Created bucket {}", bucket);
            }
        } catch (Exception e) {
            throw translate("ensure bucket", bucket, "", e);
        }
    }

    private void stat(String bucket, String key) {
        try {
            client.statObject(StatObjectArgs.builder().bucket(bucket).object(key).build());
        } catch (Exception e) {
            throw translate("stat", bucket, key, e);
        }
    }

    static StorageException translate(String operation, String bucket, String key, Exception e) {
        String target = operation + " " + bucket + "/" + key;
        if (e instanceof StorageException) {
            return (StorageException) e;
        }
        if (e instanceof ErrorResponseException) {
            String code = ((ErrorResponseException) e).errorResponse().code();
            if (NOT_FOUND_CODES.contains(code)) {
                return new StorageException(StorageException.Kind.NOT_FOUND, target + ": " + code, e);
            }
            if (DENIED_CODES.contains(code)) {
                return new StorageException(StorageException.Kind.PERMISSION_DENIED, target + ": " + code, e);
            }
            return new StorageException(StorageException.Kind.OTHER, target + ": " + code, e);
        }
        if (e instanceof IOException || e instanceof ServerException) {
            log.warn("Object storage unreachable during {}: {}", target, e.getMessage());
            return new StorageException(StorageException.Kind.UNREACHABLE, target + " failed: " + e.getMessage(), e);
        }
        return new StorageException(StorageException.Kind.OTHER, target + " failed: " + e.getMessage(), e);
    }
}
