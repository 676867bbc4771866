package com.smartservice.core.query;

import com.smartservice.core.config.CompilerConfig;
import com.smartservice.core.diagnostic.DiagnosticCollector;
import com.smartservice.core.diagnostic.DiagnosticKind;
import com.smartservice.core.model.DataSource;
import com.smartservice.core.parser.DescriptorPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Compiles every data source query into a provider-specific {@link QueryPlan}.
 *
 * <p>A provider tag without a registered (and enabled) strategy raises
 * {@link DiagnosticKind#UNSUPPORTED_PROVIDER}. Selected fields missing from the configured
 * attribute catalog of the queried entity type raise {@link DiagnosticKind#UNKNOWN_ATTRIBUTE}
 * warnings only, since provider schemas evolve independently of descriptors.
 */
public class QueryCompiler {

    private static final Logger log = LoggerFactory.getLogger(QueryCompiler.class);

    private final CompilerConfig config;
    private final ProviderRegistry registry;

    public QueryCompiler(CompilerConfig config, ProviderRegistry registry) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Compiles the queries of all data sources, in declaration order.
     *
     * @param dataSources extracted data sources
     * @param diagnostics collector receiving provider errors and attribute warnings
     * @return plans keyed by data source name; sources with an unsupported provider are absent
     */
    public Map<String, QueryPlan> compile(List<DataSource> dataSources, DiagnosticCollector diagnostics) {
        Map<String, QueryPlan> plans = new LinkedHashMap<>();
        for (DataSource source : dataSources) {
            Optional<ProviderStrategy> strategy = registry.find(source.provider())
                .filter(s -> config.providers().isEnabled(s.getId()));
            if (strategy.isEmpty()) {
                diagnostics.report(DiagnosticKind.UNSUPPORTED_PROVIDER, source.path() + ".provider",
                    "no query compilation strategy for provider '" + source.provider()
                        + "' (available: " + availableProviders() + ")");
                continue;
            }
            checkAttributes(source, diagnostics);
            plans.put(source.name(), strategy.get().compile(source, config));
        }
        log.debug("Compiled {} of {} data source queries", plans.size(), dataSources.size());
        return plans;
    }

    private void checkAttributes(DataSource source, DiagnosticCollector diagnostics) {
        String entityType = source.query().type();
        Optional<List<String>> known = config.attributesOf(entityType);
        if (known.isEmpty()) {
            log.debug("No attribute catalog for entity type {}; skipping attribute check of {}",
                entityType, source.name());
            return;
        }
        List<String> select = source.query().select();
        for (int i = 0; i < select.size(); i++) {
            String field = select.get(i);
            if (known.get().contains(field)) {
                continue;
            }
            String hint = known.get().stream()
                .filter(attribute -> attribute.equalsIgnoreCase(field))
                .findFirst()
                .map(attribute -> " (did you mean '" + attribute + "'?)")
                .orElse("");
            diagnostics.report(DiagnosticKind.UNKNOWN_ATTRIBUTE,
                DescriptorPath.index(source.path() + ".query.select", i),
                "field '" + field + "' is not a known attribute of " + entityType + hint);
        }
    }

    private String availableProviders() {
        List<String> enabled = registry.ids().stream()
            .filter(id -> config.providers().isEnabled(id))
            .toList();
        return enabled.isEmpty() ? "none" : String.join(", ", enabled);
    }
}
