package com.smartservice.core.version;

/**
 * How a descriptor version relates to the version the compiler implements.
 */
public enum VersionCompatibility {
    /** Identical major, minor and patch. */
    EXACT,
    /** Supported major; the descriptor is ahead in minor or patch. */
    NEWER_MINOR_OR_PATCH,
    /** Supported major; the descriptor is behind in minor or patch. */
    OLDER_MINOR_OR_PATCH,
    /** Major version not supported. */
    INCOMPATIBLE;

    public boolean isCompatible() {
        return this != INCOMPATIBLE;
    }
}
