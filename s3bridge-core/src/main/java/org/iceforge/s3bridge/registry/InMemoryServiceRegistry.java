package org.iceforge.s3bridge.registry;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable registry snapshot. Used as the client-side copy for the facade's bucket check and
 * as the registry in tests.
 */
public final class InMemoryServiceRegistry implements ServiceRegistry {

    private final Map<String, ServiceDefinition> services;

    public InMemoryServiceRegistry(Collection<ServiceDefinition> definitions) {
        Map<String, ServiceDefinition> m = new LinkedHashMap<>();
        for (ServiceDefinition d : definitions) {
            if (m.putIfAbsent(d.serviceId(), d) != null) {
                throw new IllegalArgumentException("Duplicate service id '" + d.serviceId() + "'");
            }
        }
        this.services = Map.copyOf(m);
    }

    public static InMemoryServiceRegistry of(ServiceDefinition... definitions) {
        return new InMemoryServiceRegistry(List.of(definitions));
    }

    @Override
    public Optional<ServiceDefinition> lookup(String serviceId) {
        if (serviceId == null) return Optional.empty();
        return Optional.ofNullable(services.get(serviceId));
    }

    public int size() {
        return services.size();
    }
}
