package com.smartservice.core.query;

import com.smartservice.core.config.CompilerConfig;
import com.smartservice.core.model.DataSource;
import com.smartservice.core.model.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Base class for provider strategies.
 *
 * <p>Concrete strategies supply the endpoint path and request parameters; this class
 * resolves the endpoint against the data source URI and picks the geo and time attributes
 * according to the provider's capabilities.
 */
public abstract class AbstractProviderStrategy implements ProviderStrategy {

    protected final Logger log;

    protected AbstractProviderStrategy() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public QueryPlan compile(DataSource source, CompilerConfig config) {
        Query query = source.query();
        Set<ProviderCapability> capabilities = EnumSet.noneOf(ProviderCapability.class);
        capabilities.addAll(getCapabilities());

        Map<String, String> parameters = new LinkedHashMap<>();
        addParameters(query, parameters);

        String geoAttribute = capabilities.contains(ProviderCapability.GEO_FILTER)
            ? firstSelected(query, config.geoAttributes())
            : null;
        String timeAttribute = capabilities.contains(ProviderCapability.TIME_RANGE)
            ? firstSelected(query, config.timeAttributes())
            : null;

        QueryPlan plan = new QueryPlan(
            getId(),
            query.type(),
            method(),
            appendPath(source.uri(), endpointPath(query)),
            query.select(),
            parameters,
            List.copyOf(capabilities),
            geoAttribute,
            timeAttribute);
        log.debug("Compiled {} query for {}: {}", getId(), source.name(), plan.endpoint());
        return plan;
    }

    /**
     * Returns the endpoint path appended to the data source URI, starting with {@code /}.
     *
     * @param query query being compiled
     * @return endpoint path
     */
    protected abstract String endpointPath(Query query);

    /**
     * Adds the provider's request parameters.
     *
     * @param query query being compiled
     * @param parameters insertion-ordered parameter map to fill
     */
    protected abstract void addParameters(Query query, Map<String, String> parameters);

    protected String method() {
        return "GET";
    }

    protected static String joined(List<String> fields) {
        return String.join(",", fields);
    }

    protected static String encodeSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /**
     * Appends an endpoint path to the path component of {@code base}, keeping its query and
     * fragment after the new path. Opaque URIs get the path appended to their text.
     */
    static URI appendPath(URI base, String path) {
        if (base.isOpaque()) {
            return URI.create(stripTrailingSlashes(base.toString()) + path);
        }
        StringBuilder uri = new StringBuilder();
        uri.append(base.getScheme()).append(':');
        if (base.getRawAuthority() != null) {
            uri.append("//").append(base.getRawAuthority());
        }
        uri.append(stripTrailingSlashes(base.getRawPath() == null ? "" : base.getRawPath())).append(path);
        if (base.getRawQuery() != null) {
            uri.append('?').append(base.getRawQuery());
        }
        if (base.getRawFragment() != null) {
            uri.append('#').append(base.getRawFragment());
        }
        return URI.create(uri.toString());
    }

    private static String stripTrailingSlashes(String text) {
        String result = text;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static String firstSelected(Query query, List<String> candidates) {
        return query.select().stream()
            .filter(candidates::contains)
            .findFirst()
            .orElse(null);
    }
}
