package com.smartservice.core.diagnostic;

/**
 * Severity level of a compiler diagnostic.
 *
 * @since 1.0.0
 */
public enum Severity {
    /**
     * Warning - reported and attached to the IR, compilation still succeeds.
     */
    WARNING,

    /**
     * Fatal - prevents IR emission.
     */
    FATAL
}
