package org.iceforge.s3bridge.issuer;

import java.time.Duration;
import java.util.Objects;

/**
 * Duration policy for issued credentials.
 *
 * @param defaultDuration used when the caller does not ask for a duration
 * @param minDuration     floor applied to short, zero or negative requests (STS refuses less than 15 minutes)
 * @param maxDuration     hard ceiling; caller requests above it are clamped
 */
public record IssuerOptions(
        Duration defaultDuration,
        Duration minDuration,
        Duration maxDuration
) {
    public static final Duration MAX_CEILING = Duration.ofHours(1);

    public IssuerOptions {
        Objects.requireNonNull(defaultDuration, "defaultDuration");
        Objects.requireNonNull(minDuration, "minDuration");
        Objects.requireNonNull(maxDuration, "maxDuration");
        if (minDuration.isZero() || minDuration.isNegative()) {
            throw new IllegalArgumentException("minDuration must be positive");
        }
        if (maxDuration.compareTo(MAX_CEILING) > 0) {
            throw new IllegalArgumentException("maxDuration may not exceed " + MAX_CEILING);
        }
        if (minDuration.compareTo(maxDuration) > 0) {
            throw new IllegalArgumentException("minDuration " + minDuration + " exceeds maxDuration " + maxDuration);
        }
        if (defaultDuration.compareTo(minDuration) < 0 || defaultDuration.compareTo(maxDuration) > 0) {
            throw new IllegalArgumentException("defaultDuration must lie within [" + minDuration + ", " + maxDuration + "]");
        }
    }

    public static IssuerOptions defaults() {
        return new IssuerOptions(Duration.ofHours(1), Duration.ofMinutes(15), MAX_CEILING);
    }

    /** Applies default, floor and ceiling to a caller-requested duration in seconds. */
    public Duration clamp(Integer requestedSeconds) {
        if (requestedSeconds == null) return defaultDuration;
        Duration requested = Duration.ofSeconds(requestedSeconds);
        if (requested.compareTo(minDuration) < 0) return minDuration;
        if (requested.compareTo(maxDuration) > 0) return maxDuration;
        return requested;
    }
}
