package com.smartservice.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A visualization of records from one data source.
 *
 * @param name unique visualization name
 * @param type visualization type tag (Map, Line, Bar, Pie, Table, ...)
 * @param source name of the data source it displays
 * @param data ordered field names it wants to display
 * @param extra visualization-specific settings, in declaration order
 * @param roles roles allowed to see the visualization (empty = everyone)
 */
public record Visualization(
    String name,
    String type,
    String source,
    List<String> data,
    Map<String, ScalarValue> extra,
    List<String> roles
) {
    /**
     * Compact constructor with validation.
     */
    public Visualization {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(source, "source must not be null");
        data = data == null ? List.of() : List.copyOf(data);
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    /**
     * Dotted descriptor path of this visualization.
     *
     * @return e.g. {@code application.visualizations.Air Quality Visualization}
     */
    public String path() {
        return "application.visualizations." + name;
    }
}
