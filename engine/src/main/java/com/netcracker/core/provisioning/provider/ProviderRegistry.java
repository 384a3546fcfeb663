package com.netcracker.core.provisioning.provider;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Looks up {@link ResourceProvider} beans by resource type.
 */
@ApplicationScoped
@Slf4j
public class ProviderRegistry {
    private final Map<String, ResourceProvider> providers = new TreeMap<>();

    @Inject
    public ProviderRegistry(Instance<ResourceProvider> providers) {
        this(providers.stream().toList());
    }

    public ProviderRegistry(Collection<? extends ResourceProvider> providers) {
        for (ResourceProvider provider : providers) {
            ResourceProvider previous = this.providers.putIfAbsent(provider.type(), provider);
            if (previous != null) {
                throw new IllegalStateException("Several providers registered for resource type '" + provider.type() + "'");
            }
        }
        log.info("Registered providers for resource types {}", this.providers.keySet());
    }

    public Optional<ResourceProvider> find(String type) {
        return Optional.ofNullable(providers.get(type));
    }

    public ResourceProvider get(String type) {
        return find(type).orElseThrow(() -> new ProviderException("No provider registered for resource type '" + type + "'"));
    }

    public boolean supports(String type) {
        return providers.containsKey(type);
    }
}
