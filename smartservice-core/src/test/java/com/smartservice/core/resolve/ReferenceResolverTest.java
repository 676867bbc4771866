package com.smartservice.core.resolve;

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
import com.smartservice.core.model.SemanticVersion;
import com.smartservice.core.model.ServiceMeta;
import com.smartservice.core.model.Visualization;
import com.smartservice.core.visualization.VisualizationContractRegistry;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ReferenceResolver}.
 */
class ReferenceResolverTest {

    private static final DataSource MEASUREMENTS = new DataSource(
        "Measurements", "measurements", "Fiware", "Sensor", URI.create("https://broker.example.org"),
        new Query("AirQualityObserved", List.of("location", "Nox", "O3", "dateObserved")));

    private final ReferenceResolver resolver =
        new ReferenceResolver(CompilerConfig.defaults(), VisualizationContractRegistry.load());

    private static Descriptor descriptor(List<Visualization> visualizations, List<DeploymentEnv> envs) {
        return new Descriptor(
            new ServiceMeta("Test", "Service", new SemanticVersion(1, 0, 0)),
            new ApplicationSettings("Web", "SinglePage"),
            List.of(MEASUREMENTS),
            visualizations,
            List.of(new Role("User", RoleHierarchy.USER), new Role("Admin", RoleHierarchy.ADMIN)),
            envs);
    }

    private static Visualization visualization(String name, String type, String source, List<String> data,
                                               List<String> roles) {
        return new Visualization(name, type, source, data, Map.of(), roles);
    }

    @Test
    void resolve_classifiesFieldsByVerbatimSelectMembership() {
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        List<ResolvedVisualization> resolved = resolver.resolve(descriptor(
            List.of(visualization("Air", "Map", "Measurements", List.of("location", "address", "NOx", "O3"), List.of())),
            List.of()), diagnostics);

        assertThat(diagnostics.isEmpty()).isTrue();
        assertThat(resolved).singleElement().satisfies(vis -> {
            assertThat(vis.source()).isSameAs(MEASUREMENTS);
            assertThat(vis.fields()).containsExactly(
                new FieldBinding("location", FieldOrigin.PROJECTED),
                new FieldBinding("address", FieldOrigin.DERIVED),
                new FieldBinding("NOx", FieldOrigin.DERIVED),
                new FieldBinding("O3", FieldOrigin.PROJECTED));
        });
    }

    @Test
    void resolve_unknownSource_reportsDanglingReferenceNamingBoth() {
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        List<ResolvedVisualization> resolved = resolver.resolve(descriptor(
            List.of(visualization("Air", "Map", "Measurements2", List.of("location"), List.of())),
            List.of()), diagnostics);

        assertThat(resolved).isEmpty();
        assertThat(diagnostics.toList()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.DANGLING_REFERENCE);
            assertThat(d.path()).isEqualTo("application.visualizations.Air.source");
            assertThat(d.message()).contains("'Air'").contains("'Measurements2'");
        });
    }

    @Test
    void resolve_undeclaredRoles_reportedForVisualizationsThenEnvironments() {
        DiagnosticCollector diagnostics = new DiagnosticCollector();
        DeploymentEnv env = new DeploymentEnv("prod", URI.create("https://prod.example.org"), 443, "Kubernetes",
            List.of("Admin", "Operator"));

        resolver.resolve(descriptor(
            List.of(visualization("Air", "Table", "Measurements", List.of("O3"), List.of("User", "Guest"))),
            List.of(env)), diagnostics);

        assertThat(diagnostics.toList()).extracting(Diagnostic::path).containsExactly(
            "application.visualizations.Air.roles[1]",
            "deployment.env.prod.roles[1]");
        assertThat(diagnostics.toList()).allMatch(d -> d.kind() == DiagnosticKind.UNDECLARED_ROLE);
    }

    @Test
    void resolve_unsupportedType_reportsFatalError() {
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        resolver.resolve(descriptor(
            List.of(visualization("Air", "Hologram", "Measurements", List.of("O3"), List.of())),
            List.of()), diagnostics);

        assertThat(diagnostics.toList()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.UNSUPPORTED_VISUALIZATION_TYPE);
            assertThat(d.path()).isEqualTo("application.visualizations.Air.type");
            assertThat(d.message()).contains("Hologram").contains("map");
        });
    }

    @Test
    void resolve_visualizationTypeIsCaseInsensitive() {
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        resolver.resolve(descriptor(
            List.of(visualization("Air", "TABLE", "Measurements", List.of("O3"), List.of())),
            List.of()), diagnostics);

        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    void resolve_mapWithoutGeoField_warnsOnly() {
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        List<ResolvedVisualization> resolved = resolver.resolve(descriptor(
            List.of(visualization("Air", "Map", "Measurements", List.of("O3"), List.of())),
            List.of()), diagnostics);

        assertThat(resolved).hasSize(1);
        assertThat(diagnostics.hasFatal()).isFalse();
        assertThat(diagnostics.toList()).singleElement()
            .extracting(Diagnostic::kind).isEqualTo(DiagnosticKind.VISUALIZATION_CONTRACT);
    }
}
