package org.iceforge.s3bridge.registry;

import java.util.List;
import java.util.Objects;

/**
 * Registry entry binding a service identity to its bucket scope and delegated role.
 *
 * @param serviceId      logical caller name; not a secret
 * @param bucketPatterns ordered glob patterns, never empty
 * @param permissionTier action set of the delegated role
 * @param roleReference  opaque role handle passed to the role-assumption authority (an IAM role ARN for STS)
 */
public record ServiceDefinition(
        String serviceId,
        List<String> bucketPatterns,
        PermissionTier permissionTier,
        String roleReference
) {
    public ServiceDefinition {
        if (serviceId == null || serviceId.isBlank()) {
            throw new IllegalArgumentException("serviceId is required");
        }
        Objects.requireNonNull(bucketPatterns, "bucketPatterns");
        if (bucketPatterns.isEmpty()) {
            throw new IllegalArgumentException("Service '" + serviceId + "' must declare at least one bucket pattern");
        }
        bucketPatterns = List.copyOf(bucketPatterns);
        Objects.requireNonNull(permissionTier, "permissionTier");
        if (roleReference == null || roleReference.isBlank()) {
            throw new IllegalArgumentException("Service '" + serviceId + "' has no role reference");
        }
    }
}
