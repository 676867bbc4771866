package com.smartservice.cli;

import com.smartservice.core.pipeline.CompilationResult;

/**
 * Process exit codes of the compiler commands.
 */
public final class ExitCodes {

    /** Descriptor compiled (warnings allowed). */
    public static final int OK = 0;

    /** Descriptor is well-formed but has errors. */
    public static final int INVALID = 1;

    /** Descriptor could not be read or is structurally malformed. */
    public static final int MALFORMED = 2;

    private ExitCodes() {
        // Utility class
    }

    public static int of(CompilationResult result) {
        if (result.succeeded()) {
            return OK;
        }
        return result.hasParseErrors() ? MALFORMED : INVALID;
    }
}
