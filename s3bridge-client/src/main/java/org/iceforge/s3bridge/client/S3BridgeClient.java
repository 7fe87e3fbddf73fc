package org.iceforge.s3bridge.client;

import org.iceforge.s3bridge.auth.AuthErrorKind;
import org.iceforge.s3bridge.auth.AuthException;
import org.iceforge.s3bridge.auth.AuthorizationDecision;
import org.iceforge.s3bridge.auth.BucketPatternMatcher;
import org.iceforge.s3bridge.cache.CredentialCache;
import org.iceforge.s3bridge.cache.CredentialCacheOptions;
import org.iceforge.s3bridge.client.s3.S3AccessException;
import org.iceforge.s3bridge.client.s3.S3ClientFactory;
import org.iceforge.s3bridge.client.s3.S3Models;
import org.iceforge.s3bridge.credentials.CredentialBundle;
import org.iceforge.s3bridge.registry.ServiceDefinition;
import org.iceforge.s3bridge.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * S3 operations on behalf of one registered service.
 *
 * <p>Every call first checks the target bucket against the service's patterns: those of the
 * client-side registry snapshot when one is configured (no broker round trip), otherwise those
 * returned with the credential. A bucket outside the scope fails with
 * {@link AuthErrorKind#BUCKET_NOT_AUTHORIZED} before anything is sent to S3.
 *
 * <p>When S3 answers 401 or 403 the cached credential is invalidated and the call is retried once
 * with a newly issued one. A second failure is reported as is. Backend errors surface as
 * {@link S3AccessException}.
 */
public class S3BridgeClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(S3BridgeClient.class);

    private final String serviceId;
    private final CredentialCache cache;
    private final S3ClientFactory clients;
    private final ServiceRegistry registrySnapshot;
    private final boolean ownsResources;

    public S3BridgeClient(String serviceId, CredentialCache cache, S3ClientFactory clients,
                          ServiceRegistry registrySnapshot) {
        this(serviceId, cache, clients, registrySnapshot, false);
    }

    private S3BridgeClient(String serviceId, CredentialCache cache, S3ClientFactory clients,
                           ServiceRegistry registrySnapshot, boolean ownsResources) {
        if (serviceId == null || serviceId.isBlank()) {
            throw new IllegalArgumentException("serviceId is required");
        }
        this.serviceId = serviceId;
        this.cache = Objects.requireNonNull(cache);
        this.clients = Objects.requireNonNull(clients);
        this.registrySnapshot = registrySnapshot;
        this.ownsResources = ownsResources;
    }

    /** Client wired to the issuance endpoint in {@code options}, with default cache settings. */
    public static S3BridgeClient create(String serviceId, ClientOptions options) {
        CredentialCache cache = new CredentialCache(new HttpCredentialSource(options), CredentialCacheOptions.defaults());
        return new S3BridgeClient(serviceId, cache, new S3ClientFactory(options), null, true);
    }

    public String serviceId() {
        return serviceId;
    }

    public String putBytes(S3Models.ObjectRef ref, byte[] bytes, String contentType, Map<String, String> userMetadata) {
        return execute("putBytes", ref.bucket(), ref.toString(), s3 -> {
            PutObjectRequest.Builder req = PutObjectRequest.builder()
                    .bucket(ref.bucket())
                    .key(ref.key());
            if (contentType != null && !contentType.isBlank()) req = req.contentType(contentType);
            if (userMetadata != null && !userMetadata.isEmpty()) req = req.metadata(userMetadata);
            return s3.putObject(req.build(), RequestBody.fromBytes(bytes)).eTag();
        });
    }

    public byte[] getBytes(S3Models.ObjectRef ref) {
        return execute("getBytes", ref.bucket(), ref.toString(), s3 -> s3.getObjectAsBytes(
                GetObjectRequest.builder().bucket(ref.bucket()).key(ref.key()).build()).asByteArray());
    }

    /** Empty when the object does not exist. */
    public Optional<S3Models.ObjectMetadata> head(S3Models.ObjectRef ref) {
        return execute("head", ref.bucket(), ref.toString(), s3 -> {
            try {
                HeadObjectResponse r = s3.headObject(HeadObjectRequest.builder()
                        .bucket(ref.bucket())
                        .key(ref.key())
                        .build());
                return Optional.of(new S3Models.ObjectMetadata(
                        ref.bucket(),
                        ref.key(),
                        r.contentLength() == null ? 0L : r.contentLength(),
                        r.eTag(),
                        r.contentType(),
                        r.lastModified(),
                        r.metadata() == null ? Map.of() : r.metadata()));
            } catch (NoSuchKeyException e) {
                return Optional.empty();
            } catch (S3Exception e) {
                // S3 answers HEAD on a missing key with a bare 404
                if (e.statusCode() == 404) return Optional.empty();
                throw e;
            }
        });
    }

    public boolean exists(S3Models.ObjectRef ref) {
        return head(ref).isPresent();
    }

    public List<S3Models.ListItem> list(String bucket, String prefix, int maxKeys) {
        return execute("list", bucket, "bucket=" + bucket + " prefix=" + prefix, s3 -> {
            ListObjectsV2Response r = s3.listObjectsV2(ListObjectsV2Request.builder()
                    .bucket(bucket)
                    .prefix(prefix == null ? "" : prefix)
                    .maxKeys(Math.max(1, maxKeys))
                    .build());

            List<S3Models.ListItem> out = new ArrayList<>();
            if (r.contents() != null) {
                for (S3Object o : r.contents()) {
                    out.add(new S3Models.ListItem(o.key(), o.size() == null ? 0L : o.size(), o.eTag(), o.lastModified()));
                }
            }
            return out;
        });
    }

    public void delete(S3Models.ObjectRef ref) {
        execute("delete", ref.bucket(), ref.toString(), s3 ->
                s3.deleteObject(DeleteObjectRequest.builder().bucket(ref.bucket()).key(ref.key()).build()));
    }

    private <T> T execute(String op, String bucket, String target, Function<S3Client, T> call) {
        if (registrySnapshot != null) {
            authorize(bucket, snapshotPatterns());
        }

        CredentialBundle bundle = cache.get(serviceId);
        if (registrySnapshot == null) {
            authorize(bucket, bundle.bucketPatterns());
        }
        try (S3ClientFactory.Lease lease = clients.lease(bundle)) {
            return call.apply(lease.client());
        } catch (S3Exception e) {
            if (!isAccessDenied(e)) {
                logger.error("S3 {} failed for {}", op, target, e);
                throw new S3AccessException("S3 " + op + " failed: " + target, e);
            }
            logger.warn("S3 {} on {} was denied with HTTP {}; refreshing credentials for service={} and retrying once",
                    op, target, e.statusCode(), serviceId);
            cache.invalidate(serviceId);
        } catch (SdkException e) {
            logger.error("S3 {} failed for {}", op, target, e);
            throw new S3AccessException("S3 " + op + " failed: " + target, e);
        }

        CredentialBundle retry = cache.get(serviceId);
        if (registrySnapshot == null) {
            authorize(bucket, retry.bucketPatterns());
        }
        try (S3ClientFactory.Lease lease = clients.lease(retry)) {
            return call.apply(lease.client());
        } catch (SdkException e) {
            logger.error("S3 {} failed for {} after credential refresh", op, target, e);
            throw new S3AccessException("S3 " + op + " failed: " + target, e);
        }
    }

    private List<String> snapshotPatterns() {
        return registrySnapshot.lookup(serviceId)
                .map(ServiceDefinition::bucketPatterns)
                .orElseThrow(() -> new AuthException(AuthErrorKind.UNKNOWN_SERVICE,
                        "Service " + serviceId + " is not in the local registry"));
    }

    private void authorize(String bucket, List<String> patterns) {
        AuthorizationDecision d = BucketPatternMatcher.matches(bucket, patterns);
        if (!d.allowed()) {
            logger.warn("Service {} is not authorized for bucket {}", serviceId, bucket);
            throw new AuthException(AuthErrorKind.BUCKET_NOT_AUTHORIZED,
                    "Service " + serviceId + " is not authorized for bucket " + bucket);
        }
        logger.debug("Bucket {} allowed for service={} by pattern {}", bucket, serviceId, d.matchedPattern());
    }

    private static boolean isAccessDenied(S3Exception e) {
        return e.statusCode() == 401 || e.statusCode() == 403;
    }

    @Override
    public void close() {
        if (ownsResources) {
            cache.close();
            clients.close();
        }
    }
}
