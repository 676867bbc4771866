package com.smartservice.core.extract;

import com.smartservice.core.Descriptors;
import com.smartservice.core.config.CompilerConfig;
import com.smartservice.core.diagnostic.Diagnostic;
import com.smartservice.core.diagnostic.DiagnosticCollector;
import com.smartservice.core.diagnostic.DiagnosticKind;
import com.smartservice.core.model.DataSource;
import com.smartservice.core.model.Descriptor;
import com.smartservice.core.model.Role;
import com.smartservice.core.model.RoleHierarchy;
import com.smartservice.core.parser.DescriptorReadException;
import com.smartservice.core.parser.DescriptorReader;
import com.smartservice.core.parser.DescriptorTree;
import com.smartservice.core.parser.StructuralParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * Tests for {@link EntityExtractor}.
 */
class EntityExtractorTest {

    private final EntityExtractor extractor = new EntityExtractor(CompilerConfig.defaults());

    private static DescriptorTree tree(String yaml) throws DescriptorReadException {
        DescriptorTree tree = new StructuralParser()
            .parse(new DescriptorReader().read(yaml, DescriptorReader.Format.YAML).root())
            .tree();
        assertThat(tree).as("fixture must parse").isNotNull();
        return tree;
    }

    @Test
    void extract_sample_buildsEntities() throws DescriptorReadException {
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        Descriptor descriptor = extractor.extract(tree(Descriptors.sample()), diagnostics);

        assertThat(diagnostics.isEmpty()).isTrue();
        assertThat(descriptor.service().scope()).isEqualTo("Environment");
        DataSource measurements = descriptor.findDataSource("Measurements").orElseThrow();
        assertThat(measurements.provider()).isEqualTo("Fiware");
        assertThat(measurements.query().type()).isEqualTo("AirQualityObserved");
        assertThat(descriptor.roles()).containsExactly(
            new Role("User", RoleHierarchy.USER),
            new Role("Superuser", RoleHierarchy.SUPERUSER),
            new Role("Admin", RoleHierarchy.ADMIN));
        assertThat(descriptor.deploymentEnvs()).singleElement()
            .satisfies(env -> assertThat(env.type()).isEqualTo("Docker"));
    }

    @Test
    void extract_customRoleWithoutHierarchy_defaultsToUser() throws DescriptorReadException {
        Descriptor descriptor = extractor.extract(
            tree(Descriptors.sampleWith("roles: [User, Superuser, Admin]", "roles: [Analyst]")),
            new DiagnosticCollector());

        assertThat(descriptor.findRole("Analyst")).contains(new Role("Analyst", RoleHierarchy.USER));
    }

    @Test
    void extract_keyDifferentFromName_reportsInconsistentKey() throws DescriptorReadException {
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        extractor.extract(tree(Descriptors.sampleWith("      name: local", "      name: production")), diagnostics);

        assertThat(diagnostics.toList()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.INCONSISTENT_KEY);
            assertThat(d.path()).isEqualTo("deployment.env.local.name");
            assertThat(d.message()).contains("'local'").contains("'production'");
        });
    }

    @Test
    void extract_duplicateNames_keepsFirstAndReportsLater() throws DescriptorReadException {
        String yaml = Descriptors.sampleWith("application:", """
              archive:
                Measurements:
                  provider: Fotec
                  type: Sensor
                  uri: https://archive.example.org
                  query: {type: AirQualityObserved, select: [O3]}
            application:""")
            .replace("roles: [User, Superuser, Admin]", "roles: [User, Admin, User]");
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        Descriptor descriptor = extractor.extract(tree(yaml), diagnostics);

        assertThat(descriptor.dataSources()).singleElement()
            .satisfies(ds -> assertThat(ds.provider()).isEqualTo("Fiware"));
        assertThat(descriptor.roles()).extracting(Role::name).containsExactly("User", "Admin");
        assertThat(diagnostics.toList()).extracting(Diagnostic::path).containsExactly(
            "data_sources.archive.Measurements",
            "application.roles[2]");
        assertThat(diagnostics.toList()).allMatch(d -> d.kind() == DiagnosticKind.DUPLICATE_KEY);
        assertThat(diagnostics.toList().get(0).message())
            .contains("first declared at data_sources.measurements.Measurements");
    }

    @Test
    void extract_unknownScope_warns() throws DescriptorReadException {
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        extractor.extract(tree(Descriptors.sampleWith("scope: Environment", "scope: Astrology")), diagnostics);

        assertThat(diagnostics.toList()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.UNKNOWN_VALUE);
            assertThat(d.isFatal()).isFalse();
        });
    }

    @Test
    void extract_unknownTags_warnInDeclarationOrder() throws DescriptorReadException {
        String yaml = Descriptors.sampleWith("type: Sensor", "type: Satellite")
            .replace("type: Web", "type: Kiosk")
            .replace("layout: SinglePage", "layout: Carousel")
            .replace("type: Docker", "type: Podman");
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        extractor.extract(tree(yaml), diagnostics);

        assertThat(diagnostics.toList()).extracting(Diagnostic::path).containsExactly(
            "data_sources.measurements.Measurements.type",
            "application.type",
            "application.layout",
            "deployment.env.local.type");
        assertThat(diagnostics.toList()).allMatch(d -> d.kind() == DiagnosticKind.UNKNOWN_VALUE && !d.isFatal());
        assertThat(diagnostics.toList().get(3).message()).isEqualTo("unrecognised deployment type 'Podman'");
    }

    @Test
    void extract_alternativeTagSpellings_areRecognised() throws DescriptorReadException {
        String yaml = Descriptors.sampleWith("type: Web", "type: MobileApp")
            .replace("layout: SinglePage", "layout: Pwa")
            .replace("type: Docker", "type: DockerCompose");
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        extractor.extract(tree(yaml), diagnostics);

        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    void extract_deploymentCredentials_areKeptInOrder() throws DescriptorReadException {
        String yaml = Descriptors.sampleWith("      type: Docker\n",
            "      type: Docker\n      credentials:\n        user: admin\n        token: s3cr3t\n");

        Descriptor descriptor = extractor.extract(tree(yaml), new DiagnosticCollector());

        assertThat(descriptor.deploymentEnvs().get(0).credentials())
            .containsExactly(entry("user", "admin"), entry("token", "s3cr3t"));
    }

    @Test
    void extract_withWorkers_matchesSequentialRun() throws DescriptorReadException {
        DescriptorTree tree = tree(Descriptors.sampleWith("      name: local", "      name: staging"));
        DiagnosticCollector sequential = new DiagnosticCollector();
        DiagnosticCollector parallel = new DiagnosticCollector();

        Descriptor first = extractor.extract(tree, sequential);
        Descriptor second = new EntityExtractor(CompilerConfig.defaults().withParallelism(4)).extract(tree, parallel);

        assertThat(second).isEqualTo(first);
        assertThat(parallel.toList()).isEqualTo(sequential.toList());
    }
}
