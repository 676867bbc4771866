package com.smartservice.core.extract;

import com.smartservice.core.config.CompilerConfig;
import com.smartservice.core.diagnostic.Diagnostic;
import com.smartservice.core.diagnostic.DiagnosticCollector;
import com.smartservice.core.diagnostic.DiagnosticKind;
import com.smartservice.core.model.ApplicationSettings;
import com.smartservice.core.model.DataSource;
import com.smartservice.core.model.DeploymentEnv;
import com.smartservice.core.model.Descriptor;
import com.smartservice.core.model.Query;
import com.smartservice.core.model.Role;
import com.smartservice.core.model.RoleHierarchy;
import com.smartservice.core.model.ServiceMeta;
import com.smartservice.core.model.Visualization;
import com.smartservice.core.parser.DescriptorTree;
import com.smartservice.core.parser.DescriptorTree.DataSourceNode;
import com.smartservice.core.parser.DescriptorTree.EnvNode;
import com.smartservice.core.parser.DescriptorTree.RoleNode;
import com.smartservice.core.parser.DescriptorTree.VisualizationNode;
import com.smartservice.core.util.OrderedFanOut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Projects a parsed {@link DescriptorTree} into typed entities.
 *
 * <p>Checks intra-section integrity only:
 * <ul>
 *   <li>a data source, visualization or deployment environment whose map key differs from its
 *       {@code name} raises {@link DiagnosticKind#INCONSISTENT_KEY}</li>
 *   <li>a tag outside its {@link KnownTags} vocabulary (scope, source type, application type
 *       and layout, deployment type) raises {@link DiagnosticKind#UNKNOWN_VALUE}</li>
 *   <li>two entities of one section with the same name (data sources across categories,
 *       declared roles, ...) raise {@link DiagnosticKind#DUPLICATE_KEY} at the later
 *       occurrence; the later entity is dropped, never overwrites the first</li>
 * </ul>
 *
 * <p>Entity conversion fans out over {@link CompilerConfig#parallelism()} workers; duplicate
 * detection runs afterwards, in declaration order.
 */
public class EntityExtractor {

    private static final Logger log = LoggerFactory.getLogger(EntityExtractor.class);

    private final CompilerConfig config;

    public EntityExtractor(CompilerConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Extracts all entities of a descriptor.
     *
     * @param tree parsed descriptor
     * @param diagnostics collector receiving integrity diagnostics
     * @return extracted descriptor (first occurrence wins for duplicate names)
     */
    public Descriptor extract(DescriptorTree tree, DiagnosticCollector diagnostics) {
        Objects.requireNonNull(tree, "tree must not be null");

        ServiceMeta service = extractService(tree.service(), diagnostics);

        List<DataSource> dataSources = unique("data source",
            convertAll(tree.dataSources(), this::toDataSource), diagnostics);
        ApplicationSettings application = extractApplication(tree.application(), diagnostics);
        List<Visualization> visualizations = unique("visualization",
            convertAll(tree.application().visualizations(), this::toVisualization), diagnostics);
        List<Role> roles = unique("role",
            convertAll(tree.application().roles(), this::toRole), diagnostics);
        List<DeploymentEnv> envs = unique("deployment environment",
            convertAll(tree.deploymentEnvs(), this::toDeploymentEnv), diagnostics);

        log.debug("Extracted {} data sources, {} visualizations, {} roles, {} deployment environments",
            dataSources.size(), visualizations.size(), roles.size(), envs.size());
        return new Descriptor(service, application, dataSources, visualizations, roles, envs);
    }

    private ServiceMeta extractService(DescriptorTree.ServiceNode node, DiagnosticCollector diagnostics) {
        checkTag(KnownTags.SCOPES, "scope", node.scope(), "service.scope", diagnostics);
        return new ServiceMeta(node.name(), node.scope(), node.version());
    }

    private ApplicationSettings extractApplication(DescriptorTree.ApplicationNode node, DiagnosticCollector diagnostics) {
        checkTag(KnownTags.APPLICATION_TYPES, "application type", node.type(), "application.type", diagnostics);
        checkTag(KnownTags.LAYOUTS, "layout", node.layout(), "application.layout", diagnostics);
        return new ApplicationSettings(node.type(), node.layout());
    }

    private static void checkTag(Set<String> known, String tag, String value, String path,
                                 DiagnosticCollector diagnostics) {
        if (!known.contains(value)) {
            diagnostics.report(DiagnosticKind.UNKNOWN_VALUE, path, "unrecognised " + tag + " '" + value + "'");
        }
    }

    // ==================== Per-entity conversion ====================

    private Extracted<DataSource> toDataSource(DataSourceNode node) {
        DiagnosticCollector local = new DiagnosticCollector();
        checkKey("data source", node.path(), node.key(), node.name(), local);
        checkTag(KnownTags.SOURCE_TYPES, "source type", node.type(), node.path() + ".type", local);
        DataSource dataSource = new DataSource(
            node.name(),
            node.category(),
            node.provider(),
            node.type(),
            node.uri(),
            new Query(node.queryType(), node.select()));
        return new Extracted<>(node.path(), node.name(), dataSource, local.toList());
    }

    private Extracted<Visualization> toVisualization(VisualizationNode node) {
        DiagnosticCollector local = new DiagnosticCollector();
        checkKey("visualization", node.path(), node.key(), node.name(), local);
        Visualization visualization = new Visualization(
            node.name(), node.type(), node.source(), node.data(), node.extra(), node.roles());
        return new Extracted<>(node.path(), node.name(), visualization, local.toList());
    }

    private Extracted<Role> toRole(RoleNode node) {
        RoleHierarchy hierarchy = node.hierarchy() != null
            ? node.hierarchy()
            : RoleHierarchy.fromLabel(node.name()).orElse(RoleHierarchy.USER);
        return new Extracted<>(node.path(), node.name(), new Role(node.name(), hierarchy), List.of());
    }

    private Extracted<DeploymentEnv> toDeploymentEnv(EnvNode node) {
        DiagnosticCollector local = new DiagnosticCollector();
        checkKey("deployment environment", node.path(), node.key(), node.name(), local);
        checkTag(KnownTags.DEPLOYMENT_TYPES, "deployment type", node.type(), node.path() + ".type", local);
        DeploymentEnv env = new DeploymentEnv(node.name(), node.uri(), node.port(), node.type(), node.roles(),
            node.credentials());
        return new Extracted<>(node.path(), node.name(), env, local.toList());
    }

    private static void checkKey(String section, String path, String key, String name, DiagnosticCollector local) {
        if (!key.equals(name)) {
            local.report(DiagnosticKind.INCONSISTENT_KEY, path + ".name",
                section + " key '" + key + "' does not match its name '" + name + "'");
        }
    }

    // ==================== Fan-out / fan-in ====================

    private <N, E> List<Extracted<E>> convertAll(List<N> nodes, Function<N, Extracted<E>> converter) {
        return OrderedFanOut.map(nodes, converter, config.parallelism());
    }

    private static <E> List<E> unique(String section, List<Extracted<E>> extracted, DiagnosticCollector diagnostics) {
        Map<String, String> firstPathByName = new HashMap<>();
        List<E> result = new ArrayList<>(extracted.size());
        for (Extracted<E> item : extracted) {
            diagnostics.addAll(item.diagnostics());
            String firstPath = firstPathByName.putIfAbsent(item.name(), item.path());
            if (firstPath != null) {
                diagnostics.report(DiagnosticKind.DUPLICATE_KEY, item.path(),
                    "duplicate " + section + " name '" + item.name() + "' (first declared at " + firstPath + ")");
                continue;
            }
            result.add(item.entity());
        }
        return result;
    }

    /**
     * One converted entity with the diagnostics its worker produced.
     */
    private record Extracted<E>(String path, String name, E entity, List<Diagnostic> diagnostics) {}
}
