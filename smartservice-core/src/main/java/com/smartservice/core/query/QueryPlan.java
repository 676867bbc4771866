package com.smartservice.core.query;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Provider-specific compiled form of a data source query.
 *
 * <p>Opaque to the compiler: handed to the query-execution collaborator, which issues the
 * request and streams back records shaped per {@link #attributes()}.
 *
 * @param provider ID of the strategy that compiled the plan
 * @param entityType queried entity type
 * @param method request method
 * @param endpoint request endpoint
 * @param attributes requested attributes, in select order
 * @param parameters request parameters, in insertion order
 * @param capabilities capabilities the executor may use, in declaration order
 * @param geoAttribute selected attribute usable for geo filtering, or null
 * @param timeAttribute selected attribute usable for time-range filtering, or null
 */
public record QueryPlan(
    String provider,
    String entityType,
    String method,
    URI endpoint,
    List<String> attributes,
    Map<String, String> parameters,
    List<ProviderCapability> capabilities,
    String geoAttribute,
    String timeAttribute
) {
    /**
     * Compact constructor with validation.
     */
    public QueryPlan {
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(entityType, "entityType must not be null");
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }

    public boolean supports(ProviderCapability capability) {
        return capabilities.contains(capability);
    }
}
