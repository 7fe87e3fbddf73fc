package org.iceforge.s3bridge.client.s3;

import org.iceforge.s3bridge.client.ClientOptions;
import org.iceforge.s3bridge.credentials.CredentialBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.util.Objects;
import java.util.function.Function;

/**
 * Builds an {@link S3Client} signed with a bundle's session credentials and keeps it while the
 * bundle stays the same. Callers {@link #lease(CredentialBundle) lease} the client for the
 * duration of one call. A new bundle retires the current client, which is closed once its last
 * lease is released.
 * <br>
 * All clients share one Apache HTTP client owned by the factory.
 */
public class S3ClientFactory implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(S3ClientFactory.class);

    private final Function<AwsCredentialsProvider, S3Client> builder;
    private final SdkHttpClient httpClient;

    // guarded by this
    private Holder current;
    private boolean closed;

    public S3ClientFactory(ClientOptions options) {
        Objects.requireNonNull(options);
        this.httpClient = ApacheHttpClient.builder().build();
        this.builder = credentials -> {
            S3ClientBuilder b = S3Client.builder()
                    .httpClient(httpClient)
                    .credentialsProvider(credentials)
                    .region(Region.of(options.region()));
            if (options.endpointOverride() != null) {
                b = b.endpointOverride(options.endpointOverride()).forcePathStyle(true);
            }
            return b.build();
        };
    }

    /** For callers that configure the SDK client themselves. The factory then owns no HTTP client. */
    public S3ClientFactory(Function<AwsCredentialsProvider, S3Client> builder) {
        this.builder = Objects.requireNonNull(builder);
        this.httpClient = null;
    }

    private static final class Holder {
        private final CredentialBundle bundle;
        private final S3Client client;
        private int leases;
        private boolean retired;

        private Holder(CredentialBundle bundle, S3Client client) {
            this.bundle = bundle;
            this.client = client;
        }
    }

    /** A client in use by one call. Closing the lease never closes a client that is still current. */
    public final class Lease implements AutoCloseable {
        private final Holder holder;
        private boolean released;

        private Lease(Holder holder) {
            this.holder = holder;
        }

        public S3Client client() {
            return holder.client;
        }

        @Override
        public void close() {
            synchronized (S3ClientFactory.this) {
                if (released) return;
                released = true;
                holder.leases--;
                closeIfUnused(holder);
            }
        }
    }

    public synchronized Lease lease(CredentialBundle bundle) {
        Objects.requireNonNull(bundle, "bundle");
        if (closed) {
            throw new IllegalStateException("S3ClientFactory is closed");
        }
        if (current == null || !bundle.equals(current.bundle)) {
            Holder previous = current;
            current = new Holder(bundle, builder.apply(StaticCredentialsProvider.create(
                    AwsSessionCredentials.create(bundle.accessKey(), bundle.secretKey(), bundle.sessionToken()))));
            log.debug("Built S3 client for service={} accessKey={} expiresAt={}",
                    bundle.serviceId(), bundle.accessKey(), bundle.expiresAt());
            if (previous != null) {
                previous.retired = true;
                closeIfUnused(previous);
            }
        }
        current.leases++;
        return new Lease(current);
    }

    // caller holds the factory monitor
    private void closeIfUnused(Holder holder) {
        if (holder.retired && holder.leases == 0) {
            holder.client.close();
        }
    }

    /**
     * Retires the current client and releases the shared HTTP client. Clients still leased are
     * closed when their lease is released.
     */
    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        if (current != null) {
            current.retired = true;
            closeIfUnused(current);
            current = null;
        }
        if (httpClient != null) {
            httpClient.close();
        }
    }
}
