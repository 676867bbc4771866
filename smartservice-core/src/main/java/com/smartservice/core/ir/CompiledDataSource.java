package com.smartservice.core.ir;

import com.smartservice.core.model.DataSource;
import com.smartservice.core.query.QueryPlan;

import java.util.Objects;

/**
 * A data source with its compiled query plan.
 *
 * @param dataSource declared data source
 * @param plan provider-specific plan for {@link DataSource#query()}
 */
public record CompiledDataSource(DataSource dataSource, QueryPlan plan) {

    public CompiledDataSource {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        Objects.requireNonNull(plan, "plan must not be null");
    }

    public String name() {
        return dataSource.name();
    }
}
