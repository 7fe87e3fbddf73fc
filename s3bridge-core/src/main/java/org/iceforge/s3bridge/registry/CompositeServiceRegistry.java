package org.iceforge.s3bridge.registry;

import java.util.List;
import java.util.Optional;

/** Consults delegates in order; the first registry that knows the service wins. */
public final class CompositeServiceRegistry implements ServiceRegistry {

    private final List<ServiceRegistry> delegates;

    public CompositeServiceRegistry(List<ServiceRegistry> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public Optional<ServiceDefinition> lookup(String serviceId) {
        for (ServiceRegistry r : delegates) {
            Optional<ServiceDefinition> found = r.lookup(serviceId);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }
}
