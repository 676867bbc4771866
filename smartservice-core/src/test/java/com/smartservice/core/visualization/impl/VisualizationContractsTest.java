package com.smartservice.core.visualization.impl;

import com.smartservice.core.config.CompilerConfig;
import com.smartservice.core.diagnostic.DiagnosticCollector;
import com.smartservice.core.diagnostic.DiagnosticKind;
import com.smartservice.core.model.DataSource;
import com.smartservice.core.model.Query;
import com.smartservice.core.model.Visualization;
import com.smartservice.core.resolve.FieldBinding;
import com.smartservice.core.resolve.FieldOrigin;
import com.smartservice.core.resolve.ResolvedVisualization;
import com.smartservice.core.visualization.VisualizationContract;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the built-in visualization contracts.
 */
class VisualizationContractsTest {

    private static final CompilerConfig CONFIG = CompilerConfig.defaults();
    private static final String PATH = "application.visualizations.V";

    private static ResolvedVisualization resolved(String type, List<String> select, String... data) {
        DataSource source = new DataSource("S", "sensors", "Fiware", "Sensor", URI.create("https://x.example"),
            new Query("AirQualityObserved", select));
        Visualization visualization = new Visualization("V", type, "S", List.of(data), Map.of(), List.of());
        List<FieldBinding> fields = visualization.data().stream()
            .map(f -> new FieldBinding(f, source.query().selects(f) ? FieldOrigin.PROJECTED : FieldOrigin.DERIVED))
            .toList();
        return new ResolvedVisualization(visualization, source, fields);
    }

    private static DiagnosticCollector check(VisualizationContract contract, ResolvedVisualization visualization) {
        DiagnosticCollector diagnostics = new DiagnosticCollector();
        contract.check(visualization, CONFIG, PATH, diagnostics);
        return diagnostics;
    }

    @Test
    void map_withProjectedGeoField_passes() {
        assertThat(check(new MapContract(), resolved("Map", List.of("location", "O3"), "location", "O3")).isEmpty())
            .isTrue();
    }

    @Test
    void map_withDerivedGeoFieldOnly_warns() {
        DiagnosticCollector diagnostics = check(new MapContract(), resolved("Map", List.of("O3"), "location", "O3"));

        assertThat(diagnostics.toList()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.VISUALIZATION_CONTRACT);
            assertThat(d.path()).isEqualTo(PATH + ".data");
            assertThat(d.message()).contains("location, geometry, coordinates");
        });
    }

    @Test
    void chart_withSingleField_warns() {
        DiagnosticCollector diagnostics = check(new ChartContract(), resolved("Bar", List.of("O3"), "O3"));

        assertThat(diagnostics.toList()).singleElement()
            .satisfies(d -> assertThat(d.message()).contains("at least 2 fields"));
    }

    @Test
    void lineChart_withoutTimeField_warns() {
        DiagnosticCollector diagnostics = check(new ChartContract(), resolved("Line", List.of("O3", "NO2"), "O3", "NO2"));

        assertThat(diagnostics.toList()).singleElement()
            .satisfies(d -> assertThat(d.message()).contains("no time field"));
    }

    @Test
    void lineChart_withTimeField_passes() {
        DiagnosticCollector diagnostics = check(new ChartContract(),
            resolved("line", List.of("dateObserved", "O3"), "dateObserved", "O3"));

        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    void pieChart_doesNotNeedTimeField() {
        assertThat(check(new ChartContract(), resolved("Pie", List.of("O3", "NO2"), "O3", "NO2")).isEmpty()).isTrue();
    }

    @Test
    void table_withoutColumns_warns() {
        DiagnosticCollector diagnostics = check(new TableContract(), resolved("Table", List.of("O3")));

        assertThat(diagnostics.toList()).singleElement()
            .satisfies(d -> assertThat(d.isFatal()).isFalse());
    }

    @Test
    void otherType_isCheckedLikeATable() {
        DiagnosticCollector diagnostics = check(new TableContract(), resolved("Other", List.of("O3")));

        assertThat(diagnostics.toList()).singleElement()
            .satisfies(d -> assertThat(d.message()).isEqualTo("Other 'V' declares no columns"));
        assertThat(check(new TableContract(), resolved("Other", List.of("O3"), "O3")).isEmpty()).isTrue();
    }
}
