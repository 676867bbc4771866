package com.smartservice.core.query;

/**
 * Query features a provider supports.
 */
public enum ProviderCapability {
    /** Results can be filtered by geometry at execution time. */
    GEO_FILTER,
    /** Results can be restricted to an observation time range. */
    TIME_RANGE,
    /** The provider returns only the requested attributes. */
    ATTRIBUTE_PROJECTION
}
