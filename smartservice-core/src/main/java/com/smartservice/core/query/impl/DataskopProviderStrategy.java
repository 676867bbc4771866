package com.smartservice.core.query.impl;

import com.smartservice.core.model.Query;
import com.smartservice.core.query.AbstractProviderStrategy;
import com.smartservice.core.query.ProviderCapability;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Compiles queries for the DataSkop measurement API.
 */
public class DataskopProviderStrategy extends AbstractProviderStrategy {

    @Override
    public String getId() {
        return "dataskop";
    }

    @Override
    public String getDisplayName() {
        return "DataSkop Measurement API";
    }

    @Override
    public Set<ProviderCapability> getCapabilities() {
        return EnumSet.of(ProviderCapability.TIME_RANGE, ProviderCapability.ATTRIBUTE_PROJECTION);
    }

    @Override
    protected String endpointPath(Query query) {
        return "/measurements";
    }

    @Override
    protected void addParameters(Query query, Map<String, String> parameters) {
        parameters.put("entityType", query.type());
        parameters.put("fields", joined(query.select()));
    }
}
