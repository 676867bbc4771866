package com.smartservice.core.visualization.impl;

import com.smartservice.core.config.CompilerConfig;
import com.smartservice.core.diagnostic.DiagnosticCollector;
import com.smartservice.core.diagnostic.DiagnosticKind;
import com.smartservice.core.resolve.ResolvedVisualization;
import com.smartservice.core.visualization.VisualizationContract;

import java.util.Locale;
import java.util.Set;

/**
 * Charts plot values against an axis, so they need at least two fields.
 * Line charts additionally expect a time field for their axis.
 */
public class ChartContract implements VisualizationContract {

    static final int MIN_FIELDS = 2;

    @Override
    public String getId() {
        return "chart";
    }

    @Override
    public String getDisplayName() {
        return "Chart (line, bar, pie)";
    }

    @Override
    public Set<String> getSupportedTypes() {
        return Set.of("chart", "line", "bar", "pie");
    }

    @Override
    public void check(ResolvedVisualization visualization, CompilerConfig config, String path,
                      DiagnosticCollector diagnostics) {
        if (visualization.fields().size() < MIN_FIELDS) {
            diagnostics.report(DiagnosticKind.VISUALIZATION_CONTRACT, path + ".data",
                visualization.type() + " chart '" + visualization.name() + "' needs at least "
                    + MIN_FIELDS + " fields but declares " + visualization.fields().size());
        }
        if ("line".equals(visualization.type().toLowerCase(Locale.ROOT))
            && visualization.visualization().data().stream().noneMatch(config.timeAttributes()::contains)) {
            diagnostics.report(DiagnosticKind.VISUALIZATION_CONTRACT, path + ".data",
                "line chart '" + visualization.name() + "' has no time field (expected one of "
                    + String.join(", ", config.timeAttributes()) + ")");
        }
    }
}
