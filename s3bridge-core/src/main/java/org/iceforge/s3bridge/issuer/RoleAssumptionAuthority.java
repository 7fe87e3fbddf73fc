package org.iceforge.s3bridge.issuer;

import java.time.Duration;

/**
 * External system that mints time-boxed secrets for a delegated role (AWS STS in production).
 * <br>
 * Any exception thrown here is reported to the caller as an upstream failure. Implementations
 * must bound their own latency with a timeout.
 */
public interface RoleAssumptionAuthority {

    AssumedRole assume(String roleReference, String sessionName, Duration duration);
}
