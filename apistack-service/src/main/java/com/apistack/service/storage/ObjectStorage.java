package com.apistack.service.storage;

import java.util.List;

/**
 * S3-compatible object storage. Failures surface as
 * {@link com.apistack.common.exception.StorageException} with kind UNREACHABLE, NOT_FOUND,
 * PERMISSION_DENIED or OTHER.
 */
public interface ObjectStorage {

    long MAX_EXPIRY_SECONDS = 7 * 24 * 3600;

    /**
     * Upload, replacing any existing object under the same key.
     */
    StoredObject put(String bucket, String key, byte[] bytes, String contentType);

    byte[] get(String bucket, String key);

    void delete(String bucket, String key);

    List<StoredObject> list(String bucket, String prefix);

    /**
     * Sign a URL locally, without contacting the service unless existence verification is enabled.
     *
     * <p>S3 presigning has a one-second minimum, so an expiry of 0 is signed for one second while
     * {@link SignedUrl#getExpiresAt()} equals the issue instant. Consumers must judge validity with
     * {@link SignedUrl#isValidAt}; the storage backend alone would still honour such a URL for up
     * to one second.
     *
     * @param expirySeconds 0..{@value #MAX_EXPIRY_SECONDS}; 0 yields a URL that is already expired
     */
    SignedUrl signedUrl(String bucket, String key, long expirySeconds, AccessMode mode);

    /**
     * Create the bucket when it does not exist yet.
     */
    void ensureBucket(String bucket);
}
