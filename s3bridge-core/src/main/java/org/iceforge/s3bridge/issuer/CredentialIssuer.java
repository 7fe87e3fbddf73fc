package org.iceforge.s3bridge.issuer;

import org.iceforge.s3bridge.auth.AuthErrorKind;
import org.iceforge.s3bridge.auth.AuthException;
import org.iceforge.s3bridge.credentials.CredentialBundle;
import org.iceforge.s3bridge.registry.ServiceDefinition;
import org.iceforge.s3bridge.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Issues temporary credentials for registered services.
 * <br>
 * Every step is a hard gate and any failure denies the whole request:
 * <ol>
 *     <li>API key check (constant time)</li>
 *     <li>registry lookup, read fresh on every request</li>
 *     <li>duration clamp</li>
 *     <li>role assumption, never retried here</li>
 *     <li>expiry stamping</li>
 * </ol>
 * The issuer keeps no state between requests.
 */
public class CredentialIssuer {
    private static final Logger logger = LoggerFactory.getLogger(CredentialIssuer.class);

    private final ApiKeyVerifier apiKeyVerifier;
    private final ServiceRegistry registry;
    private final RoleAssumptionAuthority authority;
    private final IssuerOptions options;
    private final Clock clock;

    public CredentialIssuer(ApiKeyVerifier apiKeyVerifier,
                            ServiceRegistry registry,
                            RoleAssumptionAuthority authority,
                            IssuerOptions options,
                            Clock clock) {
        this.apiKeyVerifier = Objects.requireNonNull(apiKeyVerifier);
        this.registry = Objects.requireNonNull(registry);
        this.authority = Objects.requireNonNull(authority);
        this.options = Objects.requireNonNull(options);
        this.clock = Objects.requireNonNull(clock);
        if (!apiKeyVerifier.isConfigured()) {
            logger.warn("No API key configured; every credential request will be denied");
        }
    }

    public CredentialBundle issue(String apiKey, String serviceId, Integer requestedDurationSeconds) {
        if (!apiKeyVerifier.verify(apiKey)) {
            logger.warn("Credential request denied for service={}: invalid API key", serviceId);
            throw new AuthException(AuthErrorKind.INVALID_API_KEY, "Invalid API key");
        }

        if (serviceId == null || serviceId.isBlank()) {
            throw new AuthException(AuthErrorKind.UNKNOWN_SERVICE, "service parameter required");
        }
        ServiceDefinition service = registry.lookup(serviceId).orElseThrow(() -> {
            logger.warn("Credential request denied: unknown service={}", serviceId);
            return new AuthException(AuthErrorKind.UNKNOWN_SERVICE, "Unknown service: " + serviceId);
        });

        Duration duration = options.clamp(requestedDurationSeconds);
        if (requestedDurationSeconds != null && duration.getSeconds() != requestedDurationSeconds) {
            logger.debug("Clamped requested duration {}s to {}s for service={}",
                    requestedDurationSeconds, duration.getSeconds(), serviceId);
        }

        Instant issuedAt = clock.instant();
        String sessionName = sessionName(serviceId, issuedAt);

        AssumedRole assumed;
        try {
            assumed = authority.assume(service.roleReference(), sessionName, duration);
        } catch (Exception e) {
            logger.error("Role assumption failed for service={} role={}", serviceId, service.roleReference(), e);
            throw new AuthException(AuthErrorKind.UPSTREAM_FAILURE,
                    "Role assumption failed for service " + serviceId + ": " + e.getMessage(), e);
        }
        if (assumed == null) {
            throw new AuthException(AuthErrorKind.UPSTREAM_FAILURE,
                    "Role assumption returned no credentials for service " + serviceId);
        }

        Instant expiresAt = resolveExpiry(issuedAt, duration, assumed, serviceId);
        CredentialBundle bundle = new CredentialBundle(
                assumed.accessKey(),
                assumed.secretKey(),
                assumed.sessionToken(),
                issuedAt,
                expiresAt,
                service.serviceId(),
                service.bucketPatterns(),
                service.permissionTier());

        logger.info("Issued credentials service={} tier={} accessKey={} expiresAt={}",
                serviceId, service.permissionTier().wireName(), bundle.accessKey(), expiresAt);
        return bundle;
    }

    /**
     * The authority's expiry is authoritative when it reports one, including a shorter grant
     * than requested. It is still capped at the granted duration.
     */
    private static Instant resolveExpiry(Instant issuedAt, Duration duration, AssumedRole assumed, String serviceId) {
        Instant ceiling = issuedAt.plus(duration);
        Instant reported = assumed.expiration();
        if (reported == null) return ceiling;
        if (!reported.isAfter(issuedAt)) {
            throw new AuthException(AuthErrorKind.UPSTREAM_FAILURE,
                    "Authority returned an already-expired credential for service " + serviceId);
        }
        if (reported.isBefore(ceiling)) {
            logger.info("Authority granted {}s instead of {}s for service={}",
                    Duration.between(issuedAt, reported).getSeconds(), duration.getSeconds(), serviceId);
            return reported;
        }
        return ceiling;
    }

    static String sessionName(String serviceId, Instant issuedAt) {
        return serviceId + "-session-" + issuedAt.getEpochSecond();
    }
}
