package org.iceforge.s3bridge.issuer;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Raw credential returned by a {@link RoleAssumptionAuthority}.
 *
 * @param expiration authority-reported expiry; null when the authority does not report one
 */
public record AssumedRole(
        String accessKey,
        String secretKey,
        String sessionToken,
        Instant expiration
) {
    public AssumedRole {
        Objects.requireNonNull(accessKey, "accessKey");
        Objects.requireNonNull(secretKey, "secretKey");
        Objects.requireNonNull(sessionToken, "sessionToken");
    }

    public Optional<Instant> reportedExpiration() {
        return Optional.ofNullable(expiration);
    }

    @Override
    public String toString() {
        return "AssumedRole{accessKey=" + accessKey + ", expiration=" + expiration + "}";
    }
}
