package com.smartservice.core.visualization.impl;

import com.smartservice.core.config.CompilerConfig;
import com.smartservice.core.diagnostic.DiagnosticCollector;
import com.smartservice.core.diagnostic.DiagnosticKind;
import com.smartservice.core.resolve.FieldBinding;
import com.smartservice.core.resolve.ResolvedVisualization;
import com.smartservice.core.visualization.VisualizationContract;

import java.util.Set;

/**
 * Maps place records by a geo field, which has to be projected by the source query.
 */
public class MapContract implements VisualizationContract {

    @Override
    public String getId() {
        return "map";
    }

    @Override
    public String getDisplayName() {
        return "Map";
    }

    @Override
    public Set<String> getSupportedTypes() {
        return Set.of("map");
    }

    @Override
    public void check(ResolvedVisualization visualization, CompilerConfig config, String path,
                      DiagnosticCollector diagnostics) {
        boolean hasGeoField = visualization.fields().stream()
            .filter(FieldBinding::isProjected)
            .anyMatch(field -> config.geoAttributes().contains(field.name()));
        if (!hasGeoField) {
            diagnostics.report(DiagnosticKind.VISUALIZATION_CONTRACT, path + ".data",
                "map visualization '" + visualization.name() + "' has no projected geo field (expected one of "
                    + String.join(", ", config.geoAttributes()) + ")");
        }
    }
}
