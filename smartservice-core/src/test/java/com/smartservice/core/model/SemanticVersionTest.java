package com.smartservice.core.model;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SemanticVersion}.
 */
class SemanticVersionTest {

    @Test
    void parse_triple_returnsVersion() {
        assertThat(SemanticVersion.parse("1.10.3")).isEqualTo(new SemanticVersion(1, 10, 3));
        assertThat(SemanticVersion.parse("2.0.1")).hasToString("2.0.1");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "1", "1.0", "1.0.0.0", "v1.0.0", "1.x.0", "-1.0.0"})
    void parse_malformed_throwsException(String text) {
        assertThatThrownBy(() -> SemanticVersion.parse(text)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void compareTo_ordersNumerically() {
        assertThat(SemanticVersion.parse("1.10.0")).isGreaterThan(SemanticVersion.parse("1.9.9"));
        assertThat(SemanticVersion.parse("2.0.0")).isGreaterThan(SemanticVersion.parse("1.99.99"));
        assertThat(SemanticVersion.parse("1.0.1")).isEqualByComparingTo(new SemanticVersion(1, 0, 1));
    }

    @Test
    void constructor_negativeComponent_throwsException() {
        assertThatThrownBy(() -> new SemanticVersion(1, -1, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
