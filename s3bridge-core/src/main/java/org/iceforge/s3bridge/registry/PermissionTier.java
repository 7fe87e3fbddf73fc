package org.iceforge.s3bridge.registry;

import java.util.List;

/**
 * Coarse action set a service's delegated role may exercise. The broker only uses the tier to
 * describe a service; the role-assumption authority enforces it.
 */
public enum PermissionTier {
    READ_ONLY("read-only", List.of("s3:GetObject", "s3:ListBucket")),
    READ_WRITE("read-write", List.of("s3:GetObject", "s3:PutObject", "s3:DeleteObject", "s3:ListBucket")),
    ADMIN("admin", List.of("s3:*"));

    private final String wireName;
    private final List<String> actions;

    PermissionTier(String wireName, List<String> actions) {
        this.wireName = wireName;
        this.actions = actions;
    }

    public String wireName() {
        return wireName;
    }

    public List<String> actions() {
        return actions;
    }

    /** Accepts the wire name ({@code read-only}) or the enum name ({@code READ_ONLY}). */
    public static PermissionTier parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("permission tier is required");
        }
        String v = value.trim();
        for (PermissionTier t : values()) {
            if (t.wireName.equalsIgnoreCase(v) || t.name().equalsIgnoreCase(v)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown permission tier '" + value + "'. Expected one of read-only, read-write, admin");
    }
}
