package com.smartservice.core.diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a caller demands an IR from a failed compilation.
 *
 * <p>Carries the full aggregated diagnostic list, never just the first entry.
 */
public class CompilationFailedException extends RuntimeException {

    private final transient List<Diagnostic> diagnostics;

    public CompilationFailedException(List<Diagnostic> diagnostics) {
        super(buildMessage(diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    private static String buildMessage(List<Diagnostic> diagnostics) {
        long fatal = diagnostics.stream().filter(Diagnostic::isFatal).count();
        return "Compilation failed with " + fatal + " error(s):" + System.lineSeparator()
            + diagnostics.stream()
                .filter(Diagnostic::isFatal)
                .map(Diagnostic::format)
                .collect(Collectors.joining(System.lineSeparator()));
    }
}
