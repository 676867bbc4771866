package com.smartservice.core.model;

import java.util.Objects;

/**
 * Service preamble of a descriptor.
 *
 * @param name service name, non-empty
 * @param scope application domain (e.g. Environment, Transportation)
 * @param version declared descriptor version
 */
public record ServiceMeta(
    String name,
    String scope,
    SemanticVersion version
) {
    /**
     * Compact constructor with validation.
     */
    public ServiceMeta {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(version, "version must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (scope == null) {
            scope = "Service";
        }
    }
}
