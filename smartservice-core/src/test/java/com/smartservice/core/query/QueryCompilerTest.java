package com.smartservice.core.query;

import com.smartservice.core.config.CompilerConfig;
import com.smartservice.core.diagnostic.Diagnostic;
import com.smartservice.core.diagnostic.DiagnosticCollector;
import com.smartservice.core.diagnostic.DiagnosticKind;
import com.smartservice.core.model.DataSource;
import com.smartservice.core.model.Query;
import com.smartservice.core.query.impl.FiwareProviderStrategy;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link QueryCompiler}.
 */
class QueryCompilerTest {

    private static DataSource source(String name, String provider, String entityType, List<String> select) {
        return new DataSource(name, "sensors", provider, "Sensor", URI.create("https://data.example.org"),
            new Query(entityType, select));
    }

    private final QueryCompiler compiler = new QueryCompiler(CompilerConfig.defaults(), ProviderRegistry.load());

    @Test
    void compile_knownProviders_plansEverySourceInOrder() {
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        Map<String, QueryPlan> plans = compiler.compile(List.of(
            source("B", "FIWARE", "AirQualityObserved", List.of("location", "O3")),
            source("A", "dataskop", "WeatherObserved", List.of("temperature")),
            source("C", "Fotec", "NoiseLevelObserved", List.of("LAeq"))), diagnostics);

        assertThat(diagnostics.isEmpty()).isTrue();
        assertThat(plans).containsOnlyKeys("B", "A", "C");
        assertThat(plans.keySet()).containsExactly("B", "A", "C");
        assertThat(plans.get("B").provider()).isEqualTo("fiware");
        assertThat(plans.get("A").provider()).isEqualTo("dataskop");
        assertThat(plans.get("C").provider()).isEqualTo("fotec");
    }

    @Test
    void compile_unknownProvider_reportsFatalErrorAndSkipsSource() {
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        Map<String, QueryPlan> plans = compiler.compile(List.of(
            source("S", "Orion", "AirQualityObserved", List.of("O3"))), diagnostics);

        assertThat(plans).isEmpty();
        assertThat(diagnostics.toList()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.UNSUPPORTED_PROVIDER);
            assertThat(d.path()).isEqualTo("data_sources.sensors.S.provider");
            assertThat(d.message()).contains("'Orion'").contains("fiware, dataskop, fotec");
        });
    }

    @Test
    void compile_disabledProvider_isUnsupported() {
        CompilerConfig config = new CompilerConfig(null, null,
            new CompilerConfig.ProviderSettings(List.of("Dataskop")), null, null, null, null);
        QueryCompiler restricted = new QueryCompiler(config, ProviderRegistry.load());
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        Map<String, QueryPlan> plans = restricted.compile(List.of(
            source("F", "Fiware", "AirQualityObserved", List.of("O3")),
            source("D", "Dataskop", "AirQualityObserved", List.of("O3"))), diagnostics);

        assertThat(plans).containsOnlyKeys("D");
        assertThat(diagnostics.toList()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.UNSUPPORTED_PROVIDER);
            assertThat(d.message()).endsWith("(available: dataskop)");
        });
    }

    @Test
    void compile_unknownAttributes_warnWithCaseInsensitiveHint() {
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        Map<String, QueryPlan> plans = compiler.compile(List.of(
            source("S", "Fiware", "AirQualityObserved", List.of("location", "Nox", "Ozone"))), diagnostics);

        assertThat(plans).containsKey("S");
        assertThat(diagnostics.hasFatal()).isFalse();
        assertThat(diagnostics.toList()).extracting(Diagnostic::path).containsExactly(
            "data_sources.sensors.S.query.select[1]",
            "data_sources.sensors.S.query.select[2]");
        assertThat(diagnostics.toList().get(0).message()).endsWith("(did you mean 'NOx'?)");
        assertThat(diagnostics.toList().get(1).message()).doesNotContain("did you mean");
    }

    @Test
    void compile_uncataloguedEntityType_skipsAttributeCheck() {
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        compiler.compile(List.of(source("S", "Fiware", "ParkingSpot", List.of("status"))), diagnostics);

        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    void compile_explicitRegistry_usesOnlyGivenStrategies() {
        QueryCompiler fiwareOnly = new QueryCompiler(CompilerConfig.defaults(),
            new ProviderRegistry(List.of(new FiwareProviderStrategy())));
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        fiwareOnly.compile(List.of(source("S", "Fotec", "AirQualityObserved", List.of("O3"))), diagnostics);

        assertThat(diagnostics.toList()).singleElement()
            .extracting(Diagnostic::kind).isEqualTo(DiagnosticKind.UNSUPPORTED_PROVIDER);
    }
}
