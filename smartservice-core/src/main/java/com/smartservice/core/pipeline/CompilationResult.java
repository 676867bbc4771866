package com.smartservice.core.pipeline;

import com.smartservice.core.diagnostic.CompilationFailedException;
import com.smartservice.core.diagnostic.Diagnostic;
import com.smartservice.core.diagnostic.DiagnosticKind;
import com.smartservice.core.ir.CompiledDescriptor;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one compilation attempt: the IR on success, and every diagnostic in report
 * order either way.
 */
public final class CompilationResult {

    private final CompilationStage stage;
    private final CompilationStage lastCompletedStage;
    private final CompiledDescriptor descriptor;
    private final List<Diagnostic> diagnostics;

    private CompilationResult(CompilationStage stage, CompilationStage lastCompletedStage,
                              CompiledDescriptor descriptor, List<Diagnostic> diagnostics) {
        this.stage = stage;
        this.lastCompletedStage = lastCompletedStage;
        this.descriptor = descriptor;
        this.diagnostics = List.copyOf(diagnostics);
    }

    static CompilationResult success(CompiledDescriptor descriptor, List<Diagnostic> diagnostics) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        return new CompilationResult(CompilationStage.EMITTED, CompilationStage.EMITTED, descriptor, diagnostics);
    }

    static CompilationResult failure(CompilationStage lastCompletedStage, List<Diagnostic> diagnostics) {
        return new CompilationResult(CompilationStage.FAILED, lastCompletedStage, null, diagnostics);
    }

    /**
     * Returns the terminal stage: {@link CompilationStage#EMITTED} or {@link CompilationStage#FAILED}.
     *
     * @return terminal stage
     */
    public CompilationStage stage() {
        return stage;
    }

    /**
     * Returns the last stage that completed before the attempt stopped.
     *
     * @return {@link CompilationStage#INIT} when parsing failed, {@link CompilationStage#EMITTED} on success
     */
    public CompilationStage lastCompletedStage() {
        return lastCompletedStage;
    }

    public boolean succeeded() {
        return stage == CompilationStage.EMITTED;
    }

    public Optional<CompiledDescriptor> descriptor() {
        return Optional.ofNullable(descriptor);
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> fatalDiagnostics() {
        return diagnostics.stream().filter(Diagnostic::isFatal).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isFatal()).toList();
    }

    /**
     * Whether the descriptor was structurally malformed.
     *
     * @return true if any {@link DiagnosticKind#PARSE_ERROR} was reported
     */
    public boolean hasParseErrors() {
        return diagnostics.stream().anyMatch(d -> d.kind() == DiagnosticKind.PARSE_ERROR);
    }

    /**
     * Returns the IR or throws.
     *
     * @return compiled descriptor
     * @throws CompilationFailedException if compilation failed
     */
    public CompiledDescriptor orElseThrow() {
        if (descriptor == null) {
            throw new CompilationFailedException(diagnostics);
        }
        return descriptor;
    }
}
