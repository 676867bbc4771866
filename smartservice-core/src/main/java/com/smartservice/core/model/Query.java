package com.smartservice.core.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Abstract query of a data source: the record kind requested from the provider and the
 * ordered field projection.
 *
 * @param type record kind requested from the provider (e.g. AirQualityObserved)
 * @param select ordered, non-empty, duplicate-free field projection
 */
public record Query(
    String type,
    List<String> select
) {
    /**
     * Compact constructor with validation.
     */
    public Query {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(select, "select must not be null");
        if (select.isEmpty()) {
            throw new IllegalArgumentException("select must not be empty");
        }
        Set<String> seen = new HashSet<>();
        for (String field : select) {
            if (!seen.add(field)) {
                throw new IllegalArgumentException("duplicate select field: " + field);
            }
        }
        select = List.copyOf(select);
    }

    /**
     * Returns true if the projection contains the field, compared verbatim.
     *
     * @param field field name
     * @return true if selected
     */
    public boolean selects(String field) {
        return select.contains(field);
    }
}
