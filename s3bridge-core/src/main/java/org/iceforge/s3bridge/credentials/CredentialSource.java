package org.iceforge.s3bridge.credentials;

/**
 * Where the credential cache obtains fresh bundles, normally the issuance endpoint over HTTP.
 * <br>
 * Implementations report failures as {@link org.iceforge.s3bridge.auth.AuthException} and must
 * not retry internally; the cache owns retry policy.
 */
@FunctionalInterface
public interface CredentialSource {

    CredentialBundle fetch(String serviceId);
}
