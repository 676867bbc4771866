package com.smartservice.core.resolve;

import java.util.Objects;

/**
 * One visualization data field and its origin.
 *
 * @param name field name as declared in the visualization
 * @param origin projected or derived
 */
public record FieldBinding(String name, FieldOrigin origin) {

    public FieldBinding {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(origin, "origin must not be null");
    }

    public boolean isProjected() {
        return origin == FieldOrigin.PROJECTED;
    }
}
