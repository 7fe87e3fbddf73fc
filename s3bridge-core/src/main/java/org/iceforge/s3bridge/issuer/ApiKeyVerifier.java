package org.iceforge.s3bridge.issuer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks a presented API key against the configured one without leaking timing information.
 * <br>
 * An unconfigured (null or blank) key rejects everything.
 */
public final class ApiKeyVerifier {

    private final byte[] expected;

    public ApiKeyVerifier(String configuredKey) {
        this.expected = configuredKey == null || configuredKey.isBlank()
                ? null
                : configuredKey.getBytes(StandardCharsets.UTF_8);
    }

    public boolean isConfigured() {
        return expected != null;
    }

    public boolean verify(String presentedKey) {
        if (expected == null || presentedKey == null) return false;
        return constantTimeEquals(expected, presentedKey.getBytes(StandardCharsets.UTF_8));
    }

    /** {@link MessageDigest#isEqual} does not short-circuit on the first differing byte. */
    static boolean constantTimeEquals(byte[] a, byte[] b) {
        if (a == null || b == null) return false;
        return MessageDigest.isEqual(a, b);
    }
}
