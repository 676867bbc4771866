package com.smartservice.core.resolve;

import com.smartservice.core.model.DataSource;
import com.smartservice.core.model.Visualization;

import java.util.List;
import java.util.Objects;

/**
 * A visualization linked to its data source, with every data field classified.
 *
 * @param visualization the visualization
 * @param source the data source named by {@link Visualization#source()}
 * @param fields field bindings, in {@link Visualization#data()} order
 */
public record ResolvedVisualization(
    Visualization visualization,
    DataSource source,
    List<FieldBinding> fields
) {
    /**
     * Compact constructor with validation.
     */
    public ResolvedVisualization {
        Objects.requireNonNull(visualization, "visualization must not be null");
        Objects.requireNonNull(source, "source must not be null");
        if (!visualization.source().equals(source.name())) {
            throw new IllegalArgumentException("Visualization " + visualization.name()
                + " references " + visualization.source() + ", not " + source.name());
        }
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public String name() {
        return visualization.name();
    }

    public String type() {
        return visualization.type();
    }

    public List<String> projectedFields() {
        return fields.stream().filter(FieldBinding::isProjected).map(FieldBinding::name).toList();
    }

    public List<String> derivedFields() {
        return fields.stream().filter(field -> !field.isProjected()).map(FieldBinding::name).toList();
    }
}
