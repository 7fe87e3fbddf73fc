package org.iceforge.s3bridge.auth;

import java.util.List;

/**
 * Glob matching of bucket names against authorization patterns.
 * <br>
 * The only wildcard is {@code *}, which matches any run of characters, including none.
 * Matching is case-sensitive and anchored at both ends. Patterns are tried in order and the
 * first match wins. Anything that cannot be evaluated (null bucket, null or empty pattern
 * list) is a denial.
 */
public final class BucketPatternMatcher {

    private BucketPatternMatcher() {}

    public static AuthorizationDecision matches(String bucketName, List<String> patterns) {
        if (bucketName == null || patterns == null || patterns.isEmpty()) {
            return AuthorizationDecision.deny();
        }
        for (String pattern : patterns) {
            if (pattern != null && globMatches(pattern, bucketName)) {
                return AuthorizationDecision.allow(pattern);
            }
        }
        return AuthorizationDecision.deny();
    }

    public static boolean isAuthorized(String bucketName, List<String> patterns) {
        return matches(bucketName, patterns).allowed();
    }

    /**
     * Iterative wildcard match with single-point backtracking: on a mismatch we resume from
     * the most recent {@code *}, letting it absorb one more character. Linear in practice and
     * never recursive, so hostile patterns like {@code "*a*a*a*b"} stay cheap.
     */
    static boolean globMatches(String pattern, String text) {
        int p = 0;
        int t = 0;
        int star = -1;
        int starText = 0;

        while (t < text.length()) {
            if (p < pattern.length() && pattern.charAt(p) == '*') {
                star = p++;
                starText = t;
            } else if (p < pattern.length() && pattern.charAt(p) == text.charAt(t)) {
                p++;
                t++;
            } else if (star >= 0) {
                p = star + 1;
                t = ++starText;
            } else {
                return false;
            }
        }
        while (p < pattern.length() && pattern.charAt(p) == '*') p++;
        return p == pattern.length();
    }
}
