package com.smartservice.core.model;

import java.util.Objects;

/**
 * A declared application role.
 *
 * @param name role name, referenced elsewhere by membership
 * @param hierarchy privilege level
 */
public record Role(
    String name,
    RoleHierarchy hierarchy
) {
    /**
     * Compact constructor with validation.
     */
    public Role {
        Objects.requireNonNull(name, "name must not be null");
        if (hierarchy == null) {
            hierarchy = RoleHierarchy.USER;
        }
    }

    /**
     * Whether this role is one of the built-in roles (User, Superuser, Admin) rather than
     * a custom role.
     *
     * @return true if built in
     */
    public boolean isBuiltIn() {
        return RoleHierarchy.fromLabel(name).filter(h -> h == hierarchy).isPresent();
    }
}
