package com.smartservice.core.visualization;

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
 * Registry mapping visualization types to {@link VisualizationContract} implementations.
 */
public class VisualizationContractRegistry {

    private static final Logger log = LoggerFactory.getLogger(VisualizationContractRegistry.class);

    private final List<VisualizationContract> contracts;
    private final Map<String, VisualizationContract> contractsByType = new LinkedHashMap<>();

    /**
     * Creates a registry from explicit contracts.
     *
     * @param contracts contracts to register
     * @throws IllegalArgumentException if two contracts claim the same type
     */
    public VisualizationContractRegistry(List<VisualizationContract> contracts) {
        this.contracts = List.copyOf(contracts);
        for (VisualizationContract contract : contracts) {
            for (String type : contract.getSupportedTypes()) {
                VisualizationContract existing = contractsByType.putIfAbsent(type.toLowerCase(Locale.ROOT), contract);
                if (existing != null) {
                    throw new IllegalArgumentException("Visualization type '" + type + "' claimed by both "
                        + existing.getId() + " and " + contract.getId());
                }
            }
        }
    }

    public static VisualizationContractRegistry load() {
        List<VisualizationContract> discovered = new ArrayList<>();
        ServiceLoader.load(VisualizationContract.class).forEach(discovered::add);
        log.debug("Discovered {} visualization contracts", discovered.size());
        return new VisualizationContractRegistry(discovered);
    }

    /**
     * Looks up the contract for a visualization type, ignoring case.
     *
     * @param type visualization type tag (e.g. "Map")
     * @return contract, or empty if the type is unsupported
     */
    public Optional<VisualizationContract> find(String type) {
        return Optional.ofNullable(contractsByType.get(type.toLowerCase(Locale.ROOT)));
    }

    public List<VisualizationContract> contracts() {
        return contracts;
    }

    /**
     * Returns all supported type tags, sorted.
     *
     * @return supported visualization types
     */
    public List<String> supportedTypes() {
        return contractsByType.keySet().stream().sorted().toList();
    }
}
