package com.smartservice.core.visualization.impl;

import com.smartservice.core.config.CompilerConfig;
import com.smartservice.core.diagnostic.DiagnosticCollector;
import com.smartservice.core.diagnostic.DiagnosticKind;
import com.smartservice.core.resolve.ResolvedVisualization;
import com.smartservice.core.visualization.VisualizationContract;

import java.util.Set;

/**
 * Tables render any fields, but at least one column. Visualizations of type {@code Other}
 * fall back to a table.
 */
public class TableContract implements VisualizationContract {

    @Override
    public String getId() {
        return "table";
    }

    @Override
    public String getDisplayName() {
        return "Table";
    }

    @Override
    public Set<String> getSupportedTypes() {
        return Set.of("table", "other");
    }

    @Override
    public void check(ResolvedVisualization visualization, CompilerConfig config, String path,
                      DiagnosticCollector diagnostics) {
        if (visualization.fields().isEmpty()) {
            diagnostics.report(DiagnosticKind.VISUALIZATION_CONTRACT, path + ".data",
                visualization.type() + " '" + visualization.name() + "' declares no columns");
        }
    }
}
