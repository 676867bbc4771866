package com.smartservice.core.model;

import java.util.Objects;

/**
 * Application-wide settings of a descriptor.
 *
 * @param type application type tag (Web, Mobile, Desktop)
 * @param layout layout tag (SinglePage, Pwa)
 */
public record ApplicationSettings(
    String type,
    String layout
) {
    /**
     * Compact constructor with validation.
     */
    public ApplicationSettings {
        Objects.requireNonNull(type, "type must not be null");
        if (layout == null) {
            layout = "SinglePage";
        }
    }
}
