package com.smartservice.core.query.impl;

import com.smartservice.core.config.CompilerConfig;
import com.smartservice.core.model.DataSource;
import com.smartservice.core.model.Query;
import com.smartservice.core.query.ProviderCapability;
import com.smartservice.core.query.QueryPlan;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * Tests for the built-in provider strategies.
 */
class ProviderStrategiesTest {

    private static final CompilerConfig CONFIG = CompilerConfig.defaults();

    private static DataSource source(String uri, String entityType, String... select) {
        return new DataSource("S", "sensors", "any", "Sensor", URI.create(uri), new Query(entityType, List.of(select)));
    }

    @Test
    void fiware_compilesNgsiV2EntitiesQuery() {
        QueryPlan plan = new FiwareProviderStrategy().compile(
            source("https://broker.example.org/", "AirQualityObserved", "location", "NOx", "dateObserved"), CONFIG);

        assertThat(plan.method()).isEqualTo("GET");
        assertThat(plan.endpoint()).hasToString("https://broker.example.org/v2/entities");
        assertThat(plan.parameters()).containsExactly(
            entry("type", "AirQualityObserved"),
            entry("attrs", "location,NOx,dateObserved"),
            entry("options", "keyValues"));
        assertThat(plan.attributes()).containsExactly("location", "NOx", "dateObserved");
        assertThat(plan.geoAttribute()).isEqualTo("location");
        assertThat(plan.timeAttribute()).isEqualTo("dateObserved");
    }

    @Test
    void fiware_withoutGeoOrTimeField_leavesThemUnset() {
        QueryPlan plan = new FiwareProviderStrategy().compile(
            source("https://broker.example.org", "AirQualityObserved", "O3"), CONFIG);

        assertThat(plan.geoAttribute()).isNull();
        assertThat(plan.timeAttribute()).isNull();
        assertThat(plan.supports(ProviderCapability.GEO_FILTER)).isTrue();
    }

    @Test
    void dataskop_compilesMeasurementsQueryWithoutGeoFilter() {
        QueryPlan plan = new DataskopProviderStrategy().compile(
            source("https://dataskop.example.org/api", "WeatherObserved", "location", "temperature", "dateObserved"),
            CONFIG);

        assertThat(plan.endpoint()).hasToString("https://dataskop.example.org/api/measurements");
        assertThat(plan.parameters()).containsExactly(
            entry("entityType", "WeatherObserved"),
            entry("fields", "location,temperature,dateObserved"));
        assertThat(plan.capabilities())
            .containsExactly(ProviderCapability.TIME_RANGE, ProviderCapability.ATTRIBUTE_PROJECTION);
        assertThat(plan.geoAttribute()).isNull();
        assertThat(plan.timeAttribute()).isEqualTo("dateObserved");
    }

    @Test
    void fotec_addressesEntityTypeByEncodedPath() {
        QueryPlan plan = new FotecProviderStrategy().compile(
            source("https://fotec.example.org", "Noise Level", "LAeq", "LAmax"), CONFIG);

        assertThat(plan.endpoint()).hasToString("https://fotec.example.org/api/Noise%20Level");
        assertThat(plan.parameters()).containsExactly(entry("select", "LAeq,LAmax"));
        assertThat(plan.capabilities()).containsExactly(ProviderCapability.ATTRIBUTE_PROJECTION);
        assertThat(plan.timeAttribute()).isNull();
    }

    @Test
    void fiware_uriWithQueryAndFragment_appendsEndpointToPath() {
        QueryPlan plan = new FiwareProviderStrategy().compile(
            source("https://data.iiss.at/dataskop/fiwarenosec?tenant=madrid#frag", "AirQualityObserved", "O3"),
            CONFIG);

        assertThat(plan.endpoint())
            .hasToString("https://data.iiss.at/dataskop/fiwarenosec/v2/entities?tenant=madrid#frag");
        assertThat(plan.endpoint().getPath()).isEqualTo("/dataskop/fiwarenosec/v2/entities");
        assertThat(plan.endpoint().getQuery()).isEqualTo("tenant=madrid");
    }

    @Test
    void fotec_uriWithTrailingSlashAndQuery_keepsEncodedSegment() {
        QueryPlan plan = new FotecProviderStrategy().compile(
            source("https://fotec.example.org/base/?key=a%20b", "Noise Level", "LAeq"), CONFIG);

        assertThat(plan.endpoint()).hasToString("https://fotec.example.org/base/api/Noise%20Level?key=a%20b");
    }
}
