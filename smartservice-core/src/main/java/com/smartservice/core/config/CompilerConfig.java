package com.smartservice.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.smartservice.core.model.SemanticVersion;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Compiler configuration: the version support matrix, enabled providers and the entity-type
 * attribute catalog.
 *
 * <p>Passed into the pipeline at construction time, so compilers with different
 * configurations can run side by side in one process (e.g. during a migration window that
 * supports two major versions).
 *
 * <p><b>Example YAML ({@code smartservice.yaml}):</b>
 * <pre>{@code
 * compilerVersion: "1.0.0"
 * supportedMajorVersions: [1]
 *
 * providers:
 *   enabled:
 *     - fiware
 *     - dataskop
 *
 * entityTypes:
 *   AirQualityObserved: [location, address, dateObserved, NOx, O3]
 *
 * geoAttributes: [location]
 * timeAttributes: [dateObserved]
 * parallelism: 4
 * }</pre>
 *
 * <p>Any omitted setting falls back to the value of {@link #defaults()}.
 *
 * @param compilerVersion version of the descriptor grammar this compiler implements
 * @param supportedMajorVersions descriptor major versions accepted by the version gate
 * @param providers provider strategy selection
 * @param entityTypes known attributes per queried entity type
 * @param geoAttributes attribute names carrying geometry
 * @param timeAttributes attribute names carrying observation time
 * @param parallelism worker count for extraction and resolution (1 = sequential)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompilerConfig(
    @JsonProperty("compilerVersion") String compilerVersion,
    @JsonProperty("supportedMajorVersions") List<Integer> supportedMajorVersions,
    @JsonProperty("providers") ProviderSettings providers,
    @JsonProperty("entityTypes") Map<String, List<String>> entityTypes,
    @JsonProperty("geoAttributes") List<String> geoAttributes,
    @JsonProperty("timeAttributes") List<String> timeAttributes,
    @JsonProperty("parallelism") Integer parallelism
) {
    public static final String DEFAULT_COMPILER_VERSION = "1.0.0";

    /**
     * Compact constructor filling omitted settings with defaults.
     */
    public CompilerConfig {
        if (compilerVersion == null) {
            compilerVersion = DEFAULT_COMPILER_VERSION;
        }
        SemanticVersion.parse(compilerVersion);
        if (supportedMajorVersions == null || supportedMajorVersions.isEmpty()) {
            supportedMajorVersions = List.of(SemanticVersion.parse(compilerVersion).major());
        }
        if (providers == null) {
            providers = new ProviderSettings(List.of());
        }
        if (entityTypes == null) {
            entityTypes = EntityTypeCatalog.DEFAULT_ENTITY_TYPES;
        }
        if (geoAttributes == null) {
            geoAttributes = EntityTypeCatalog.DEFAULT_GEO_ATTRIBUTES;
        }
        if (timeAttributes == null) {
            timeAttributes = EntityTypeCatalog.DEFAULT_TIME_ATTRIBUTES;
        }
        if (parallelism == null || parallelism < 1) {
            parallelism = 1;
        }
        supportedMajorVersions = List.copyOf(supportedMajorVersions);
        entityTypes = Map.copyOf(entityTypes);
        geoAttributes = List.copyOf(geoAttributes);
        timeAttributes = List.copyOf(timeAttributes);
    }

    /**
     * Creates the default configuration: compiler version 1.0.0, major 1 supported, all
     * registered providers enabled, the built-in entity-type catalog, sequential execution.
     *
     * @return default configuration
     */
    public static CompilerConfig defaults() {
        return new CompilerConfig(null, null, null, null, null, null, null);
    }

    /**
     * Returns a copy with a different parallelism.
     *
     * @param workers worker count
     * @return new configuration
     */
    public CompilerConfig withParallelism(int workers) {
        return new CompilerConfig(compilerVersion, supportedMajorVersions, providers,
            entityTypes, geoAttributes, timeAttributes, workers);
    }

    public SemanticVersion compilerSemanticVersion() {
        return SemanticVersion.parse(compilerVersion);
    }

    public boolean supportsMajor(int major) {
        return supportedMajorVersions.contains(major);
    }

    /**
     * Returns the known attributes of an entity type.
     *
     * @param entityType queried entity type (e.g. AirQualityObserved)
     * @return attribute list, or empty if the type is not catalogued
     */
    public Optional<List<String>> attributesOf(String entityType) {
        return Optional.ofNullable(entityTypes.get(entityType));
    }

    /**
     * Provider strategy selection.
     *
     * @param enabled enabled provider IDs; empty or null enables every registered provider
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProviderSettings(
        @JsonProperty("enabled") List<String> enabled
    ) {
        public ProviderSettings {
            enabled = enabled == null ? List.of() : List.copyOf(enabled);
        }

        /**
         * Checks if a provider strategy is enabled.
         *
         * @param providerId provider ID, compared case-insensitively
         * @return true if enabled
         */
        public boolean isEnabled(String providerId) {
            if (enabled.isEmpty()) {
                return true;
            }
            String normalized = providerId.toLowerCase(Locale.ROOT);
            return enabled.stream().anyMatch(id -> id.toLowerCase(Locale.ROOT).equals(normalized));
        }
    }
}
