package org.iceforge.s3bridge.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning for {@link CredentialCache}.
 *
 * @param safetyMargin   lead time before expiry at which a bundle counts as stale
 * @param waitTimeout    how long {@link CredentialCache#get(String)} waits for a refresh
 * @param refreshRetries extra attempts for transient upstream failures inside one refresh
 * @param retryBackoff   first backoff delay; doubles per attempt
 */
public record CredentialCacheOptions(
        Duration safetyMargin,
        Duration waitTimeout,
        int refreshRetries,
        Duration retryBackoff
) {
    public CredentialCacheOptions {
        Objects.requireNonNull(safetyMargin, "safetyMargin");
        Objects.requireNonNull(waitTimeout, "waitTimeout");
        Objects.requireNonNull(retryBackoff, "retryBackoff");
        if (safetyMargin.isNegative()) throw new IllegalArgumentException("safetyMargin must not be negative");
        if (waitTimeout.isZero() || waitTimeout.isNegative()) throw new IllegalArgumentException("waitTimeout must be positive");
        if (refreshRetries < 0) throw new IllegalArgumentException("refreshRetries must not be negative");
        if (retryBackoff.isNegative()) throw new IllegalArgumentException("retryBackoff must not be negative");
    }

    public static CredentialCacheOptions defaults() {
        return new CredentialCacheOptions(Duration.ofMinutes(10), Duration.ofSeconds(30), 2, Duration.ofMillis(200));
    }
}
