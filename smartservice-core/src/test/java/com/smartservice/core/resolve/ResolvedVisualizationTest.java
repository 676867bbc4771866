package com.smartservice.core.resolve;

import com.smartservice.core.model.DataSource;
import com.smartservice.core.model.Query;
import com.smartservice.core.model.Visualization;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ResolvedVisualization}.
 */
class ResolvedVisualizationTest {

    @Test
    void constructor_sourceMismatch_throwsException() {
        DataSource other = new DataSource("Other", "c", "Fiware", "Sensor", URI.create("https://x.example"),
            new Query("T", List.of("a")));
        Visualization visualization = new Visualization("V", "Table", "Measurements", List.of("a"), Map.of(), List.of());

        assertThatThrownBy(() -> new ResolvedVisualization(visualization, other, List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Measurements");
    }
}
