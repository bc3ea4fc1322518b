package com.apistack.service.storage;

import com.apistack.common.exception.StorageException;
import com.apistack.common.util.ManualClock;
import io.minio.BucketExistsArgs;
import io.minio.ListObjectsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.Result;
import io.minio.StatObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.messages.ErrorResponse;
import io.minio.messages.Item;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for URL signing windows and error classification
 */
public class MinioObjectStorageTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    private ManualClock clock;
    private MinioClient client;
    private MinioObjectStorage storage;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(NOW);
        // region is fixed, so signing never touches the network
        client = MinioClient.builder()
                .endpoint("http://localhost:9000")
                .credentials("access", "secret-key-for-tests")
                .region("us-east-1")
                .build();
        storage = new MinioObjectStorage(client, clock, false);
    }

    @Test
    void testSignedUrlValidForRequestedWindow() {
        SignedUrl url = storage.signedUrl("uploads", "reports/q1.pdf", 3600, AccessMode.READ);

        assertEquals(NOW.plusSeconds(3600), url.getExpiresAt());
        assertTrue(url.getUrl().contains("X-Amz-Expires=3600"));
        assertTrue(url.getUrl().contains("reports/q1.pdf"));
        assertTrue(url.isValidAt(NOW.plusSeconds(3599)));
        assertFalse(url.isValidAt(NOW.plusSeconds(3600)));
        assertFalse(url.isValidAt(NOW.plusSeconds(3601)));
    }

    @Test
    void testZeroExpiryIsAlreadyExpired() {
        SignedUrl url = storage.signedUrl("uploads", "a.txt", 0, AccessMode.READ);

        assertEquals(NOW, url.getExpiresAt());
        assertFalse(url.isValidAt(NOW));
    }

    @Test
    void testZeroExpiryIsSignedForBackendMinimum() {
        SignedUrl url = storage.signedUrl("uploads", "a.txt", 0, AccessMode.READ);

        assertTrue(url.getUrl().contains("X-Amz-Expires=1"));
        assertEquals(url.getIssuedAt(), url.getExpiresAt());
        assertFalse(url.isValidAt(url.getIssuedAt()));
        assertFalse(url.isValidAt(NOW.plusMillis(500)));
    }

    @Test
    void testWriteUrlUsesPut() {
        SignedUrl url = storage.signedUrl("uploads", "a.txt", 60, AccessMode.WRITE);

        assertEquals(AccessMode.WRITE, url.getMode());
        assertNotNull(url.getUrl());
    }

    @Test
    void testExpiryOutOfRange() {
        assertThrows(IllegalArgumentException.class,
                () -> storage.signedUrl("uploads", "a.txt", -1, AccessMode.READ));
        assertThrows(IllegalArgumentException.class,
                () -> storage.signedUrl("uploads", "a.txt", ObjectStorage.MAX_EXPIRY_SECONDS + 1, AccessMode.READ));
        assertDoesNotThrow(() -> storage.signedUrl("uploads", "a.txt", ObjectStorage.MAX_EXPIRY_SECONDS, AccessMode.READ));
    }

    @Test
    void testVerifiedSigningReportsMissingObject() throws Exception {
        MinioClient mockClient = mock(MinioClient.class);
        when(mockClient.statObject(any(StatObjectArgs.class))).thenThrow(errorResponse("NoSuchKey"));
        MinioObjectStorage verifying = new MinioObjectStorage(mockClient, clock, true);

        StorageException e = assertThrows(StorageException.class,
                () -> verifying.signedUrl("uploads", "missing.txt", 60, AccessMode.READ));

        assertEquals(StorageException.Kind.NOT_FOUND, e.getKind());
    }

    @Test
    void testErrorClassification() {
        assertEquals(StorageException.Kind.NOT_FOUND,
                MinioObjectStorage.translate("get", "b", "k", errorResponse("NoSuchBucket")).getKind());
        assertEquals(StorageException.Kind.PERMISSION_DENIED,
                MinioObjectStorage.translate("put", "b", "k", errorResponse("AccessDenied")).getKind());
        assertEquals(StorageException.Kind.OTHER,
                MinioObjectStorage.translate("put", "b", "k", errorResponse("EntityTooLarge")).getKind());
        assertEquals(StorageException.Kind.UNREACHABLE,
                MinioObjectStorage.translate("put", "b", "k", new ConnectException("Connection refused")).getKind());
    }

    @Test
    void testPutToUnreachableEndpoint() {
        MinioClient unreachable = MinioClient.builder()
                .endpoint("http://127.0.0.1:1")
                .credentials("access", "secret-key-for-tests")
                .region("us-east-1")
                .build();
        unreachable.setTimeout(Duration.ofSeconds(2).toMillis(), Duration.ofSeconds(2).toMillis(),
                Duration.ofSeconds(2).toMillis());
        MinioObjectStorage offline = new MinioObjectStorage(unreachable, clock, false);

        StorageException e = assertThrows(StorageException.class,
                () -> offline.put("uploads", "a.txt", "hi".getBytes(StandardCharsets.UTF_8), "text/plain"));

        assertEquals(StorageException.Kind.UNREACHABLE, e.getKind());
    }

    private static ErrorResponseException errorResponse(String code) {
        ErrorResponse response = new ErrorResponse(code, "message", "b", "k", "/b/k", "req-1", "host-1");
        return new ErrorResponseException(response, null, null);
    }

    @Test
    void testEnsureBucketCreatesOnlyWhenMissing() throws Exception {
        MinioClient mocked = mock(MinioClient.class);
        when(mocked.bucketExists(any(BucketExistsArgs.class))).thenReturn(false, true);
        MinioObjectStorage mockedStorage = new MinioObjectStorage(mocked, clock, false);

        mockedStorage.ensureBucket("uploads");
        mockedStorage.ensureBucket("uploads");

        verify(mocked, times(1)).makeBucket(any(MakeBucketArgs.class));
    }

    @Test
    void testListMapsObjectMetadata() {
        MinioClient mocked = mock(MinioClient.class);
        Item item = mock(Item.class);
        when(item.objectName()).thenReturn("reports/q1.pdf");
        when(item.size()).thenReturn(2048L);
        when(item.etag()).thenReturn("abc123");
        when(mocked.listObjects(any(ListObjectsArgs.class))).thenReturn(List.of(new Result<>(item)));

        List<StoredObject> objects = new MinioObjectStorage(mocked, clock, false).list("uploads", "reports/");

        assertEquals(1, objects.size());
        assertEquals("uploads", objects.get(0).getBucket());
        assertEquals("reports/q1.pdf", objects.get(0).getKey());
        assertEquals(2048L, objects.get(0).getSize());
    }
}
