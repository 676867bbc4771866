package com.smartservice.core.ir;

import com.smartservice.core.diagnostic.Diagnostic;
import com.smartservice.core.model.ApplicationSettings;
import com.smartservice.core.model.DeploymentEnv;
import com.smartservice.core.model.Role;
import com.smartservice.core.resolve.ResolvedVisualization;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Compiled intermediate representation of a service descriptor.
 *
 * <p>Immutable; maps keep declaration order. Exists only for descriptors without fatal
 * diagnostics: every visualization resolves to a data source of this IR, every data source
 * has a query plan and all remaining diagnostics are warnings.
 *
 * @param service service preamble with version compatibility
 * @param application application settings
 * @param dataSources compiled data sources keyed by name
 * @param visualizations resolved visualizations keyed by name
 * @param roles declared roles
 * @param deploymentEnvs deployment environments keyed by name
 * @param warnings non-fatal diagnostics, in report order
 */
public record CompiledDescriptor(
    CompiledService service,
    ApplicationSettings application,
    Map<String, CompiledDataSource> dataSources,
    Map<String, ResolvedVisualization> visualizations,
    List<Role> roles,
    Map<String, DeploymentEnv> deploymentEnvs,
    List<Diagnostic> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public CompiledDescriptor {
        Objects.requireNonNull(service, "service must not be null");
        Objects.requireNonNull(application, "application must not be null");
        dataSources = frozen(dataSources);
        visualizations = frozen(visualizations);
        roles = roles == null ? List.of() : List.copyOf(roles);
        deploymentEnvs = frozen(deploymentEnvs);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);

        for (ResolvedVisualization visualization : visualizations.values()) {
            if (!dataSources.containsKey(visualization.source().name())) {
                throw new IllegalArgumentException("Visualization " + visualization.name()
                    + " references data source " + visualization.source().name() + " missing from the IR");
            }
        }
        for (Diagnostic warning : warnings) {
            if (warning.isFatal()) {
                throw new IllegalArgumentException("Compiled descriptor cannot carry fatal diagnostic: "
                    + warning.format());
            }
        }
    }

    public Optional<CompiledDataSource> findDataSource(String name) {
        return Optional.ofNullable(dataSources.get(name));
    }

    public Optional<ResolvedVisualization> findVisualization(String name) {
        return Optional.ofNullable(visualizations.get(name));
    }

    private static <V> Map<String, V> frozen(Map<String, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
