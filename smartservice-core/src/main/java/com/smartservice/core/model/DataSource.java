package com.smartservice.core.model;

import java.net.URI;
import java.util.Objects;

/**
 * A named data source yielding records from an external provider.
 *
 * @param name unique name across all data source categories
 * @param category grouping key under {@code data_sources} (e.g. measurements)
 * @param provider provider tag selecting the query compilation strategy
 * @param type entity-type tag describing the records it yields (e.g. Sensor)
 * @param uri absolute provider endpoint
 * @param query abstract query
 */
public record DataSource(
    String name,
    String category,
    String provider,
    String type,
    URI uri,
    Query query
) {
    /**
     * Compact constructor with validation.
     */
    public DataSource {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(uri, "uri must not be null");
        Objects.requireNonNull(query, "query must not be null");
        if (!uri.isAbsolute()) {
            throw new IllegalArgumentException("uri must be absolute: " + uri);
        }
    }

    /**
     * Dotted descriptor path of this data source.
     *
     * @return e.g. {@code data_sources.measurements.Measurements}
     */
    public String path() {
        return "data_sources." + category + "." + name;
    }
}
