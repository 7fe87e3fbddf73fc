package org.iceforge.s3bridge.credentials;

import org.iceforge.s3bridge.registry.PermissionTier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Temporary storage credential issued for one service, together with the bucket scope the
 * issuer resolved for it.
 * <br>
 * {@code expiresAt} is always strictly after {@code issuedAt}. {@link #toString()} never renders
 * the secret key or session token.
 */
public record CredentialBundle(
        String accessKey,
        String secretKey,
        String sessionToken,
        Instant issuedAt,
        Instant expiresAt,
        String serviceId,
        List<String> bucketPatterns,
        PermissionTier permissionTier
) {
    public CredentialBundle {
        Objects.requireNonNull(accessKey, "accessKey");
        Objects.requireNonNull(secretKey, "secretKey");
        Objects.requireNonNull(sessionToken, "sessionToken");
        Objects.requireNonNull(issuedAt, "issuedAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
        Objects.requireNonNull(serviceId, "serviceId");
        if (!expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("expiresAt " + expiresAt + " must be after issuedAt " + issuedAt);
        }
        bucketPatterns = bucketPatterns == null ? List.of() : List.copyOf(bucketPatterns);
    }

    public Duration lifetime() {
        return Duration.between(issuedAt, expiresAt);
    }

    /** True while {@code now} is before {@code expiresAt - safetyMargin}. */
    public boolean isFresh(Instant now, Duration safetyMargin) {
        return now.isBefore(expiresAt.minus(safetyMargin));
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "CredentialBundle{serviceId=" + serviceId
                + ", accessKey=" + accessKey
                + ", issuedAt=" + issuedAt
                + ", expiresAt=" + expiresAt
                + ", tier=" + (permissionTier == null ? "<unknown>" : permissionTier.wireName())
                + ", buckets=" + bucketPatterns + "}";
    }
}
