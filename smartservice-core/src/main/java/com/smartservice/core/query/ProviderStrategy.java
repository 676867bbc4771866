package com.smartservice.core.query;

import com.smartservice.core.config.CompilerConfig;
import com.smartservice.core.model.DataSource;

import java.util.Set;

/**
 * Query compilation strategy for one data provider.
 *
 * <p>Strategies are discovered via Java Service Provider Interface (SPI) and selected by the
 * data source's {@code provider} tag, compared case-insensitively with {@link #getId()}.
 * Adding a provider means adding a strategy, not another branch in the compiler.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.smartservice.core.query.ProviderStrategy}
 *
 * @see ProviderRegistry
 * @see QueryPlan
 */
public interface ProviderStrategy {

    /**
     * Returns the provider tag this strategy compiles for.
     *
     * <p>Lowercase (e.g. "fiware", "dataskop").
     *
     * @return unique provider identifier
     */
    String getId();

    /**
     * Returns human-readable display name, used in CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the query features of this provider.
     *
     * @return supported capabilities
     */
    Set<ProviderCapability> getCapabilities();

    /**
     * Translates a data source query into a provider-specific plan.
     *
     * <p>Syntactic translation only: no network access and no validation beyond what the
     * translation needs.
     *
     * @param source data source to compile
     * @param config compiler configuration (geo and time attribute names)
     * @return compiled plan
     */
    QueryPlan compile(DataSource source, CompilerConfig config);
}
