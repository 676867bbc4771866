package com.smartservice.core.ir;

import com.smartservice.core.diagnostic.Diagnostic;
import com.smartservice.core.diagnostic.DiagnosticCollector;
import com.smartservice.core.model.DataSource;
import com.smartservice.core.model.DeploymentEnv;
import com.smartservice.core.model.Descriptor;
import com.smartservice.core.query.QueryPlan;
import com.smartservice.core.resolve.ResolvedVisualization;
import com.smartservice.core.version.VersionCompatibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assembles the {@link CompiledDescriptor} once every stage has run.
 */
public class IrEmitter {

    private static final Logger log = LoggerFactory.getLogger(IrEmitter.class);

    /**
     * Emits the IR.
     *
     * @param descriptor extracted descriptor
     * @param compatibility version gate outcome
     * @param visualizations resolved visualizations
     * @param plans query plans keyed by data source name
     * @param diagnostics everything reported so far
     * @return the IR, or empty if any diagnostic is fatal
     */
    public Optional<CompiledDescriptor> emit(Descriptor descriptor,
                                             VersionCompatibility compatibility,
                                             List<ResolvedVisualization> visualizations,
                                             Map<String, QueryPlan> plans,
                                             DiagnosticCollector diagnostics) {
        if (diagnostics.hasFatal()) {
            log.debug("Not emitting IR for {}: fatal diagnostics present", descriptor.service().name());
            return Optional.empty();
        }

        Map<String, CompiledDataSource> dataSources = new LinkedHashMap<>();
        for (DataSource dataSource : descriptor.dataSources()) {
            dataSources.put(dataSource.name(), new CompiledDataSource(dataSource, plans.get(dataSource.name())));
        }
        Map<String, ResolvedVisualization> resolved = new LinkedHashMap<>();
        for (ResolvedVisualization visualization : visualizations) {
            resolved.put(visualization.name(), visualization);
        }
        Map<String, DeploymentEnv> envs = new LinkedHashMap<>();
        for (DeploymentEnv env : descriptor.deploymentEnvs()) {
            envs.put(env.name(), env);
        }

        List<Diagnostic> warnings = diagnostics.toList();
        return Optional.of(new CompiledDescriptor(
            new CompiledService(descriptor.service(), compatibility),
            descriptor.application(),
            dataSources,
            resolved,
            descriptor.roles(),
            envs,
            warnings));
    }
}
