package com.smartservice.core.visualization;

import com.smartservice.core.config.CompilerConfig;
import com.smartservice.core.diagnostic.DiagnosticCollector;
import com.smartservice.core.resolve.ResolvedVisualization;

import java.util.Set;

/**
 * Rendering contract for a family of visualization types.
 *
 * <p>A contract states what a renderer needs from a visualization (a geo field for a map,
 * at least two series for a chart, ...). Violations are reported as
 * {@link com.smartservice.core.diagnostic.DiagnosticKind#VISUALIZATION_CONTRACT} warnings;
 * the renderer decides how to degrade.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.smartservice.core.visualization.VisualizationContract}
 *
 * @see VisualizationContractRegistry
 */
public interface VisualizationContract {

    /**
     * Returns unique identifier for this contract.
     *
     * @return contract ID (e.g. "map", "chart")
     */
    String getId();

    /**
     * Returns human-readable display name.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns visualization type tags this contract covers, lowercase.
     *
     * @return supported types
     */
    Set<String> getSupportedTypes();

    /**
     * Checks a resolved visualization against this contract.
     *
     * @param visualization resolved visualization
     * @param config compiler configuration (geo and time attribute names)
     * @param path descriptor path of the visualization
     * @param diagnostics collector receiving contract warnings
     */
    void check(ResolvedVisualization visualization, CompilerConfig config, String path,
               DiagnosticCollector diagnostics);
}
