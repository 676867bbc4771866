package com.smartservice.core.query.impl;

import com.smartservice.core.model.Query;
import com.smartservice.core.query.AbstractProviderStrategy;
import com.smartservice.core.query.ProviderCapability;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Compiles queries for the FOTEC sensor data API, which addresses entity types by path.
 */
public class FotecProviderStrategy extends AbstractProviderStrategy {

    @Override
    public String getId() {
        return "fotec";
    }

    @Override
    public String getDisplayName() {
        return "FOTEC Sensor Data API";
    }

    @Override
    public Set<ProviderCapability> getCapabilities() {
        return EnumSet.of(ProviderCapability.ATTRIBUTE_PROJECTION);
    }

    @Override
    protected String endpointPath(Query query) {
        return "/api/" + encodeSegment(query.type());
    }

    @Override
    protected void addParameters(Query query, Map<String, String> parameters) {
        parameters.put("select", joined(query.select()));
    }
}
