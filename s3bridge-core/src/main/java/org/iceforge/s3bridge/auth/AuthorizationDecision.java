package org.iceforge.s3bridge.auth;

import java.util.Optional;

/**
 * Outcome of matching one bucket name against a pattern list.
 *
 * @param allowed        true when some pattern matched
 * @param matchedPattern the first matching pattern, kept for audit logging; null on denial
 */
public record AuthorizationDecision(boolean allowed, String matchedPattern) {

    private static final AuthorizationDecision DENIED = new AuthorizationDecision(false, null);

    public AuthorizationDecision {
        if (allowed && matchedPattern == null) {
            throw new IllegalArgumentException("an allowed decision must carry its matched pattern");
        }
        if (!allowed && matchedPattern != null) {
            throw new IllegalArgumentException("a denied decision cannot carry a matched pattern");
        }
    }

    public static AuthorizationDecision allow(String pattern) {
        return new AuthorizationDecision(true, pattern);
    }

    public static AuthorizationDecision deny() {
        return DENIED;
    }

    public Optional<String> matched() {
        return Optional.ofNullable(matchedPattern);
    }
}
