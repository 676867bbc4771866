package com.smartservice.core.resolve;

/**
 * Where a visualization field's values come from.
 */
public enum FieldOrigin {
    /** Selected verbatim by the data source query. */
    PROJECTED,
    /** Not selected by the query; the rendering layer has to compute or look it up. */
    DERIVED
}
