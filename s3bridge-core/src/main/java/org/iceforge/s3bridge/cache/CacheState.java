package org.iceforge.s3bridge.cache;

public enum CacheState {
    /** Nothing was ever requested for the service, or it was reset. */
    EMPTY,
    /** A bundle exists and {@code now < expiresAt - safetyMargin}. */
    FRESH,
    /** Past the safety margin, invalidated, or the last refresh failed. */
    STALE,
    /** A refresh call is in flight. */
    REFRESHING
}
