package com.smartservice.core.diagnostic;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Accumulates diagnostics in the order they are reported.
 *
 * <p>Not thread-safe. Concurrent workers each own a private collector which is merged
 * into the stage collector afterwards, in declaration order.
 */
public class DiagnosticCollector {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public DiagnosticCollector report(DiagnosticKind kind, String path, String message) {
        diagnostics.add(Diagnostic.of(kind, path, message));
        return this;
    }

    public DiagnosticCollector add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        return this;
    }

    public DiagnosticCollector addAll(Collection<Diagnostic> other) {
        diagnostics.addAll(other);
        return this;
    }

    public DiagnosticCollector merge(DiagnosticCollector other) {
        diagnostics.addAll(other.diagnostics);
        return this;
    }

    public boolean hasFatal() {
        return diagnostics.stream().anyMatch(Diagnostic::isFatal);
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public int size() {
        return diagnostics.size();
    }

    /**
     * Returns an immutable snapshot of the collected diagnostics.
     *
     * @return diagnostics in report order
     */
    public List<Diagnostic> toList() {
        return List.copyOf(diagnostics);
    }
}
