package com.smartservice.core.resolve;

import com.smartservice.core.config.CompilerConfig;
import com.smartservice.core.diagnostic.Diagnostic;
import com.smartservice.core.diagnostic.DiagnosticCollector;
import com.smartservice.core.diagnostic.DiagnosticKind;
import com.smartservice.core.model.DataSource;
import com.smartservice.core.model.DeploymentEnv;
import com.smartservice.core.model.Descriptor;
import com.smartservice.core.model.Role;
import com.smartservice.core.model.Visualization;
import com.smartservice.core.parser.DescriptorPath;
import com.smartservice.core.util.OrderedFanOut;
import com.smartservice.core.visualization.VisualizationContract;
import com.smartservice.core.visualization.VisualizationContractRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves cross-section references of an extracted descriptor.
 *
 * <p>For each visualization, in declaration order:
 * <ol>
 *   <li>its {@code source} must name a data source ({@link DiagnosticKind#DANGLING_REFERENCE})</li>
 *   <li>each data field is classified {@link FieldOrigin#PROJECTED} when the source query
 *       selects it verbatim, {@link FieldOrigin#DERIVED} otherwise</li>
 *   <li>its roles must be declared ({@link DiagnosticKind#UNDECLARED_ROLE})</li>
 *   <li>its type must have a rendering contract
 *       ({@link DiagnosticKind#UNSUPPORTED_VISUALIZATION_TYPE}), which may add warnings</li>
 * </ol>
 * Deployment environment roles are checked afterwards.
 */
public class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    private final CompilerConfig config;
    private final VisualizationContractRegistry contracts;

    public ReferenceResolver(CompilerConfig config, VisualizationContractRegistry contracts) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.contracts = Objects.requireNonNull(contracts, "contracts must not be null");
    }

    /**
     * Resolves all references of a descriptor.
     *
     * @param descriptor extracted descriptor
     * @param diagnostics collector receiving reference diagnostics
     * @return visualizations whose source resolved, in declaration order
     */
    public List<ResolvedVisualization> resolve(Descriptor descriptor, DiagnosticCollector diagnostics) {
        Map<String, DataSource> sourcesByName = new HashMap<>();
        for (DataSource dataSource : descriptor.dataSources()) {
            sourcesByName.putIfAbsent(dataSource.name(), dataSource);
        }
        Set<String> declaredRoles = new HashSet<>();
        for (Role role : descriptor.roles()) {
            declaredRoles.add(role.name());
        }

        List<Resolution> resolutions = OrderedFanOut.map(
            descriptor.visualizations(),
            visualization -> resolveOne(visualization, sourcesByName, declaredRoles),
            config.parallelism());

        List<ResolvedVisualization> resolved = new ArrayList<>(resolutions.size());
        for (Resolution resolution : resolutions) {
            diagnostics.addAll(resolution.diagnostics());
            resolution.visualization().ifPresent(resolved::add);
        }

        for (DeploymentEnv env : descriptor.deploymentEnvs()) {
            checkRoles(env.roles(), env.path(), "deployment environment '" + env.name() + "'",
                declaredRoles, diagnostics);
        }

        log.debug("Resolved {} of {} visualizations", resolved.size(), descriptor.visualizations().size());
        return resolved;
    }

    private Resolution resolveOne(Visualization visualization, Map<String, DataSource> sourcesByName,
                                  Set<String> declaredRoles) {
        DiagnosticCollector local = new DiagnosticCollector();
        DataSource source = sourcesByName.get(visualization.source());
        if (source == null) {
            local.report(DiagnosticKind.DANGLING_REFERENCE, visualization.path() + ".source",
                "visualization '" + visualization.name() + "' references unknown data source '"
                    + visualization.source() + "'");
        }

        checkRoles(visualization.roles(), visualization.path(),
            "visualization '" + visualization.name() + "'", declaredRoles, local);

        Optional<VisualizationContract> contract = contracts.find(visualization.type());
        if (contract.isEmpty()) {
            local.report(DiagnosticKind.UNSUPPORTED_VISUALIZATION_TYPE, visualization.path() + ".type",
                "no rendering contract for visualization type '" + visualization.type()
                    + "' (supported: " + String.join(", ", contracts.supportedTypes()) + ")");
        }

        if (source == null) {
            return new Resolution(Optional.empty(), local.toList());
        }

        List<FieldBinding> fields = new ArrayList<>(visualization.data().size());
        for (String field : visualization.data()) {
            FieldOrigin origin = source.query().selects(field) ? FieldOrigin.PROJECTED : FieldOrigin.DERIVED;
            fields.add(new FieldBinding(field, origin));
        }
        ResolvedVisualization resolved = new ResolvedVisualization(visualization, source, fields);
        contract.ifPresent(c -> c.check(resolved, config, visualization.path(), local));
        return new Resolution(Optional.of(resolved), local.toList());
    }

    private static void checkRoles(List<String> roles, String path, String owner, Set<String> declaredRoles,
                                   DiagnosticCollector diagnostics) {
        for (int i = 0; i < roles.size(); i++) {
            String role = roles.get(i);
            if (!declaredRoles.contains(role)) {
                diagnostics.report(DiagnosticKind.UNDECLARED_ROLE,
                    DescriptorPath.index(path + ".roles", i),
                    owner + " references undeclared role '" + role + "'");
            }
        }
    }

    private record Resolution(Optional<ResolvedVisualization> visualization, List<Diagnostic> diagnostics) {}
}
