package com.smartservice.core.diagnostic;

import java.util.Objects;

/**
 * A single finding raised by one of the compiler stages.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Diagnostic d = Diagnostic.of(
 *     DiagnosticKind.DANGLING_REFERENCE,
 *     "application.visualizations.Air Quality Visualization.source",
 *     "Visualization 'Air Quality Visualization' references unknown data source 'Measurements2'"
 * );
 * }</pre>
 *
 * @param kind diagnostic kind (determines severity)
 * @param path dotted path of the offending descriptor element
 * @param message human-readable description
 */
public record Diagnostic(
    DiagnosticKind kind,
    String path,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public Diagnostic {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Creates a diagnostic.
     *
     * @param kind diagnostic kind
     * @param path descriptor path
     * @param message message
     * @return new diagnostic
     */
    public static Diagnostic of(DiagnosticKind kind, String path, String message) {
        return new Diagnostic(kind, path, message);
    }

    public Severity severity() {
        return kind.severity();
    }

    public boolean isFatal() {
        return kind.isFatal();
    }

    /**
     * Formats the diagnostic for terminal output, e.g.
     * {@code ERROR [ParseError] deployment.env.local.port: ...}.
     *
     * @return single-line representation
     */
    public String format() {
        String level = isFatal() ? "ERROR" : "WARN ";
        return level + " [" + kind.displayName() + "] " + path + ": " + message;
    }
}
