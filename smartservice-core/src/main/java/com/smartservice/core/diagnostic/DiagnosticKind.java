package com.smartservice.core.diagnostic;

/**
 * Every kind of diagnostic the compiler can raise, with its fixed severity.
 *
 * <p>The display name is what users see in CLI output and in the serialized IR
 * (e.g. {@code DanglingReferenceError}).
 */
public enum DiagnosticKind {
    /** Structurally invalid input: missing keys, wrong types, out-of-range values. */
    PARSE_ERROR("ParseError", Severity.FATAL),
    /** Descriptor major version is not supported by this compiler. */
    UNSUPPORTED_VERSION("UnsupportedVersionError", Severity.FATAL),
    /** Two entities of one section share a name. */
    DUPLICATE_KEY("DuplicateKeyError", Severity.FATAL),
    /** An entity's map key differs from its own name field. */
    INCONSISTENT_KEY("InconsistentKeyError", Severity.FATAL),
    /** A visualization names a data source that does not exist. */
    DANGLING_REFERENCE("DanglingReferenceError", Severity.FATAL),
    /** A role is referenced but not declared in application.roles. */
    UNDECLARED_ROLE("UndeclaredRoleError", Severity.FATAL),
    /** No query compilation strategy is registered for a provider tag. */
    UNSUPPORTED_PROVIDER("UnsupportedProviderError", Severity.FATAL),
    /** No rendering contract is registered for a visualization type. */
    UNSUPPORTED_VISUALIZATION_TYPE("UnsupportedVisualizationTypeError", Severity.FATAL),
    /** A selected field is not a known attribute of the queried entity type. */
    UNKNOWN_ATTRIBUTE("UnknownAttributeWarning", Severity.WARNING),
    /** Minor or patch version differs from the compiler's own. */
    VERSION_WARNING("VersionWarning", Severity.WARNING),
    /** A key inside a known entity was ignored. */
    UNKNOWN_KEY("UnknownKeyWarning", Severity.WARNING),
    /** A tag value is outside the recognised vocabulary. */
    UNKNOWN_VALUE("UnknownValueWarning", Severity.WARNING),
    /** A visualization does not fully meet its rendering contract. */
    VISUALIZATION_CONTRACT("VisualizationContractWarning", Severity.WARNING);

    private final String displayName;
    private final Severity severity;

    DiagnosticKind(String displayName, Severity severity) {
        this.displayName = displayName;
        this.severity = severity;
    }

    public String displayName() {
        return displayName;
    }

    public Severity severity() {
        return severity;
    }

    public boolean isFatal() {
        return severity == Severity.FATAL;
    }
}
