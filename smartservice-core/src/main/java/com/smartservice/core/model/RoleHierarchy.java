package com.smartservice.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Privilege level of a declared role.
 */
public enum RoleHierarchy {
    USER("User"),
    SUPERUSER("Superuser"),
    ADMIN("Admin");

    private final String label;

    RoleHierarchy(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Looks up a hierarchy level by label, ignoring case.
     *
     * @param text label such as {@code "Admin"}
     * @return matching level, or empty
     */
    public static Optional<RoleHierarchy> fromLabel(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        for (RoleHierarchy hierarchy : values()) {
            if (hierarchy.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(hierarchy);
            }
        }
        return Optional.empty();
    }
}
