package org.iceforge.s3bridge.registry;

import java.util.Optional;

/**
 * Read path of the service registry. Provisioning tooling owns writes; the broker only looks up.
 * <br>
 * An empty result means the service is unknown. Callers must treat that as a denial and never
 * fall back to a default scope.
 */
public interface ServiceRegistry {

    Optional<ServiceDefinition> lookup(String serviceId);
}
