package org.iceforge.s3bridge.auth;

/**
 * Failure categories surfaced to callers of the broker.
 * <br>
 * Only {@link #UPSTREAM_FAILURE} is transient; every other kind is permanent for the
 * request that produced it and must not be retried as-is.
 */
public enum AuthErrorKind {

    /** Registry miss, or a request that names no service. */
    UNKNOWN_SERVICE(400, false),

    /** API key missing or not equal to the configured key. */
    INVALID_API_KEY(401, false),

    /** Client-side bucket check rejected the target bucket. */
    BUCKET_NOT_AUTHORIZED(403, false),

    /** Role-assumption authority, transport or timeout failure. */
    UPSTREAM_FAILURE(502, true),

    /** Malformed wire input (e.g. a non-numeric duration). */
    INVALID_REQUEST(400, false);

    private final int httpStatus;
    private final boolean retryable;

    AuthErrorKind(int httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public boolean retryable() {
        return retryable;
    }

    /** Lenient parse of a wire name; returns null for anything unrecognised. */
    public static AuthErrorKind fromWireName(String name) {
        if (name == null || name.isBlank()) return null;
        String normalized = name.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(java.util.Locale.ROOT);
        for (AuthErrorKind k : values()) {
            if (k.name().equals(normalized)) return k;
        }
        return null;
    }
}
