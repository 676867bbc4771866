package com.smartservice.core.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Registry mapping provider tags to {@link ProviderStrategy} implementations.
 */
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderStrategy> strategies = new LinkedHashMap<>();

    /**
     * Creates a registry from explicit strategies.
     *
     * @param strategies strategies to register
     * @throws IllegalArgumentException if two strategies share an ID
     */
    public ProviderRegistry(List<ProviderStrategy> strategies) {
        for (ProviderStrategy strategy : strategies) {
            String id = strategy.getId().toLowerCase(Locale.ROOT);
            ProviderStrategy existing = this.strategies.putIfAbsent(id, strategy);
            if (existing != null) {
                throw new IllegalArgumentException("Duplicate provider strategy ID '" + id + "': "
                    + existing.getClass().getName() + " and " + strategy.getClass().getName());
            }
        }
    }

    /**
     * Discovers all strategies registered via {@link ServiceLoader}.
     *
     * @return registry of discovered strategies
     */
    public static ProviderRegistry load() {
        List<ProviderStrategy> discovered = new ArrayList<>();
        ServiceLoader.load(ProviderStrategy.class).forEach(discovered::add);
        log.debug("Discovered {} provider strategies", discovered.size());
        return new ProviderRegistry(discovered);
    }

    /**
     * Looks up the strategy for a provider tag, ignoring case.
     *
     * @param providerTag tag declared by a data source (e.g. "Fiware")
     * @return strategy, or empty if none is registered
     */
    public Optional<ProviderStrategy> find(String providerTag) {
        return Optional.ofNullable(strategies.get(providerTag.toLowerCase(Locale.ROOT)));
    }

    public List<ProviderStrategy> strategies() {
        return List.copyOf(strategies.values());
    }

    public List<String> ids() {
        return List.copyOf(strategies.keySet());
    }
}
