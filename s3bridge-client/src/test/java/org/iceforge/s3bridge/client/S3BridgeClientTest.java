package org.iceforge.s3bridge.client;

import org.iceforge.s3bridge.auth.AuthErrorKind;
import org.iceforge.s3bridge.auth.AuthException;
import org.iceforge.s3bridge.cache.CredentialCache;
import org.iceforge.s3bridge.cache.CredentialCacheOptions;
import org.iceforge.s3bridge.client.s3.S3AccessException;
import org.iceforge.s3bridge.client.s3.S3ClientFactory;
import org.iceforge.s3bridge.client.s3.S3Models;
import org.iceforge.s3bridge.credentials.CredentialBundle;
import org.iceforge.s3bridge.credentials.CredentialSource;
import org.iceforge.s3bridge.registry.InMemoryServiceRegistry;
import org.iceforge.s3bridge.registry.PermissionTier;
import org.iceforge.s3bridge.registry.ServiceDefinition;
import org.iceforge.s3bridge.registry.ServiceRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectResponse;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class S3BridgeClientTest {

    private static final List<String> ANALYTICS_PATTERNS = List.of("*-analytics-*", "analytics-*");
    private static final ServiceRegistry SNAPSHOT = InMemoryServiceRegistry.of(new ServiceDefinition(
            "analytics", ANALYTICS_PATTERNS, PermissionTier.READ_ONLY,
            "arn:aws:iam::123456789012:role/service-role/analytics-s3-access-role"));

    @Mock private S3Client s3Client;

    private final AtomicInteger fetches = new AtomicInteger();
    private ExecutorService executor;
    private CredentialCache cache;

    private final CredentialSource source = serviceId -> {
        int n = fetches.incrementAndGet();
        Instant now = Instant.now();
        return new CredentialBundle("ASIA" + n, "secret" + n, "token" + n, now, now.plus(Duration.ofHours(1)),
                serviceId, ANALYTICS_PATTERNS, PermissionTier.READ_ONLY);
    };

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        executor = Executors.newCachedThreadPool();
        CredentialCacheOptions opts = new CredentialCacheOptions(
                Duration.ofMinutes(10), Duration.ofSeconds(5), 0, Duration.ZERO);
        cache = new CredentialCache(source, opts, Clock.systemUTC(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private S3BridgeClient client(ServiceRegistry snapshot) {
        return new S3BridgeClient("analytics", cache, new S3ClientFactory(creds -> s3Client), snapshot);
    }

    private static S3Exception s3Error(int status) {
        return (S3Exception) S3Exception.builder().statusCode(status).message("HTTP " + status).build();
    }

    @Test
    void analyticsService_allowedAndDeniedBuckets() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenReturn(PutObjectResponse.builder().eTag("etag").build());
        S3BridgeClient client = client(SNAPSHOT);

        AuthException denied = assertThrows(AuthException.class, () -> client.putBytes(
                new S3Models.ObjectRef("webapp-data", "k"), "x".getBytes(), "text/plain", Map.of()));
        assertEquals(AuthErrorKind.BUCKET_NOT_AUTHORIZED, denied.kind());
        assertEquals(0, fetches.get());
        verifyNoInteractions(s3Client);

        String etag = client.putBytes(new S3Models.ObjectRef("company-analytics-data", "reports/q1.csv"),
                "a,b".getBytes(), "text/csv", Map.of("owner", "analytics"));

        assertEquals("etag", etag);
        assertEquals(1, fetches.get());
        ArgumentCaptor<PutObjectRequest> cap = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(cap.capture(), any(RequestBody.class));
        assertEquals("company-analytics-data", cap.getValue().bucket());
        assertEquals("reports/q1.csv", cap.getValue().key());
        assertEquals("text/csv", cap.getValue().contentType());
        assertEquals("analytics", cap.getValue().metadata().get("owner"));
    }

    @Test
    void withoutSnapshot_credentialPatternsAreChecked() {
        S3BridgeClient client = client(null);

        AuthException denied = assertThrows(AuthException.class,
                () -> client.list("webapp-data", "", 10));

        assertEquals(AuthErrorKind.BUCKET_NOT_AUTHORIZED, denied.kind());
        assertEquals(1, fetches.get());
        verifyNoInteractions(s3Client);
    }

    @Test
    void serviceMissingFromSnapshotIsUnknown() {
        S3BridgeClient client = new S3BridgeClient("reporting", cache,
                new S3ClientFactory(creds -> s3Client), SNAPSHOT);

        AuthException ex = assertThrows(AuthException.class,
                () -> client.exists(new S3Models.ObjectRef("analytics-raw", "k")));

        assertEquals(AuthErrorKind.UNKNOWN_SERVICE, ex.kind());
        assertEquals(0, fetches.get());
    }

    @Test
    void accessDenied_invalidatesAndRetriesOnce() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(s3Error(403))
                .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), "hello".getBytes()));

        byte[] out = client(SNAPSHOT).getBytes(new S3Models.ObjectRef("analytics-raw", "k"));

        assertArrayEquals("hello".getBytes(), out);
        assertEquals(2, fetches.get());
        verify(s3Client, times(2)).getObjectAsBytes(any(GetObjectRequest.class));
    }

    @Test
    void accessDeniedTwice_surfacesSecondFailure() {
        S3Exception second = s3Error(403);
        when(s3Client.deleteObject(any(DeleteObjectRequest.class)))
                .thenThrow(s3Error(401))
                .thenThrow(second);

        S3AccessException ex = assertThrows(S3AccessException.class,
                () -> client(SNAPSHOT).delete(new S3Models.ObjectRef("analytics-raw", "k")));

        assertSame(second, ex.getCause());
        assertEquals(403, ex.statusCode());
        assertEquals(2, fetches.get());
        verify(s3Client, times(2)).deleteObject(any(DeleteObjectRequest.class));
    }

    @Test
    void otherBackendErrors_areNotRetried() {
        when(s3Client.deleteObject(any(DeleteObjectRequest.class))).thenThrow(s3Error(500));

        S3AccessException ex = assertThrows(S3AccessException.class,
                () -> client(SNAPSHOT).delete(new S3Models.ObjectRef("analytics-raw", "k")));

        assertTrue(ex.getMessage().contains("S3 delete failed"));
        assertEquals(500, ex.statusCode());
        assertEquals(1, fetches.get());
    }

    @Test
    void clientSideSdkErrors_areWrappedAndNotRetried() {
        SdkClientException timeout = SdkClientException.create("Unable to execute HTTP request: Read timed out");
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class))).thenThrow(timeout);

        S3AccessException ex = assertThrows(S3AccessException.class,
                () -> client(SNAPSHOT).getBytes(new S3Models.ObjectRef("analytics-raw", "k")));

        assertSame(timeout, ex.getCause());
        assertEquals(-1, ex.statusCode());
        assertTrue(ex.getMessage().contains("S3 getBytes failed"));
        assertEquals(1, fetches.get());
        verify(s3Client, times(1)).getObjectAsBytes(any(GetObjectRequest.class));
    }

    @Test
    void credentialIsReusedAcrossCalls() {
        when(s3Client.deleteObject(any(DeleteObjectRequest.class))).thenReturn(DeleteObjectResponse.builder().build());
        S3BridgeClient client = client(SNAPSHOT);

        client.delete(new S3Models.ObjectRef("analytics-raw", "a"));
        client.delete(new S3Models.ObjectRef("analytics-raw", "b"));

        assertEquals(1, fetches.get());
        assertEquals(1, cache.hits());
    }

    @Test
    void head_mapsMetadataAndTreats404AsAbsent() {
        Instant lm = Instant.parse("2024-05-01T10:00:00Z");
        when(s3Client.headObject(any(HeadObjectRequest.class)))
                .thenReturn(HeadObjectResponse.builder()
                        .contentLength(42L).eTag("e").contentType("text/plain").lastModified(lm)
                        .metadata(Map.of("m", "v")).build())
                .thenThrow(s3Error(404));
        S3BridgeClient client = client(SNAPSHOT);

        Optional<S3Models.ObjectMetadata> md = client.head(new S3Models.ObjectRef("analytics-raw", "k"));
        assertTrue(md.isPresent());
        assertEquals(42L, md.get().contentLength());
        assertEquals("v", md.get().userMetadata().get("m"));
        assertEquals(lm, md.get().lastModified());

        assertFalse(client.exists(new S3Models.ObjectRef("analytics-raw", "missing")));
    }

    @Test
    void list_mapsObjects() {
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class)))
                .thenReturn(ListObjectsV2Response.builder()
                        .contents(S3Object.builder().key("p/a").size(3L).eTag("e1").build(),
                                S3Object.builder().key("p/b").size(5L).eTag("e2").build())
                        .build());

        List<S3Models.ListItem> items = client(SNAPSHOT).list("prod-analytics-store", "p/", 0);

        assertEquals(List.of("p/a", "p/b"), items.stream().map(S3Models.ListItem::key).toList());
        ArgumentCaptor<ListObjectsV2Request> cap = ArgumentCaptor.forClass(ListObjectsV2Request.class);
        verify(s3Client).listObjectsV2(cap.capture());
        assertEquals(1, cap.getValue().maxKeys());
        assertEquals("p/", cap.getValue().prefix());
    }

    @Test
    void sourceFailureSurfacesAsAuthException() {
        CredentialCache failing = new CredentialCache(id -> {
            throw new AuthException(AuthErrorKind.INVALID_API_KEY, "bad key");
        }, CredentialCacheOptions.defaults(), Clock.systemUTC(), executor);
        S3BridgeClient client = new S3BridgeClient("analytics", failing, new S3ClientFactory(creds -> s3Client), SNAPSHOT);

        AuthException ex = assertThrows(AuthException.class,
                () -> client.exists(new S3Models.ObjectRef("analytics-raw", "k")));

        assertEquals(AuthErrorKind.INVALID_API_KEY, ex.kind());
        verifyNoInteractions(s3Client);
    }
}
