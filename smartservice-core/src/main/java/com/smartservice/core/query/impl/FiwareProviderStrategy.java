package com.smartservice.core.query.impl;

import com.smartservice.core.model.Query;
import com.smartservice.core.query.AbstractProviderStrategy;
import com.smartservice.core.query.ProviderCapability;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Compiles queries for FIWARE context brokers speaking NGSI-v2.
 *
 * <p>{@code {type: AirQualityObserved, select: [location, O3]}} against
 * {@code https://broker.example} becomes
 * {@code GET https://broker.example/v2/entities?type=AirQualityObserved&attrs=location,O3&options=keyValues}.
 */
public class FiwareProviderStrategy extends AbstractProviderStrategy {

    @Override
    public String getId() {
        return "fiware";
    }

    @Override
    public String getDisplayName() {
        return "FIWARE NGSI-v2 Context Broker";
    }

    @Override
    public Set<ProviderCapability> getCapabilities() {
        return EnumSet.of(
            ProviderCapability.GEO_FILTER,
            ProviderCapability.TIME_RANGE,
            ProviderCapability.ATTRIBUTE_PROJECTION);
    }

    @Override
    protected String endpointPath(Query query) {
        return "/v2/entities";
    }

    @Override
    protected void addParameters(Query query, Map<String, String> parameters) {
        parameters.put("type", query.type());
        parameters.put("attrs", joined(query.select()));
        parameters.put("options", "keyValues");
    }
}
