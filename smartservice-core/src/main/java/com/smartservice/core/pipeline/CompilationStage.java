package com.smartservice.core.pipeline;

/**
 * Stages of one compilation attempt.
 *
 * <p>{@code INIT → PARSED → VERSION_CHECKED → EXTRACTED → RESOLVED → COMPILED → EMITTED};
 * any stage may move to {@link #FAILED}.
 */
public enum CompilationStage {
    INIT,
    PARSED,
    VERSION_CHECKED,
    EXTRACTED,
    RESOLVED,
    COMPILED,
    EMITTED,
    FAILED;

    public boolean isTerminal() {
        return this == EMITTED || this == FAILED;
    }
}
