package com.smartservice.core.version;

import com.smartservice.core.config.CompilerConfig;
import com.smartservice.core.diagnostic.DiagnosticCollector;
import com.smartservice.core.diagnostic.DiagnosticKind;
import com.smartservice.core.model.SemanticVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Checks a declared descriptor version against the compiler's support matrix.
 *
 * <p>A major version outside {@link CompilerConfig#supportedMajorVersions()} is fatal
 * ({@link DiagnosticKind#UNSUPPORTED_VERSION}); a minor or patch difference to
 * {@link CompilerConfig#compilerVersion()} only raises a {@link DiagnosticKind#VERSION_WARNING}.
 * Pure comparison, no I/O.
 */
public class VersionGate {

    private static final Logger log = LoggerFactory.getLogger(VersionGate.class);

    static final String VERSION_PATH = "service.version";

    private final CompilerConfig config;

    public VersionGate(CompilerConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Checks a descriptor version.
     *
     * @param declared version declared in {@code service.version}
     * @param diagnostics collector receiving the error or warning
     * @return compatibility of the declared version
     */
    public VersionCompatibility check(SemanticVersion declared, DiagnosticCollector diagnostics) {
        Objects.requireNonNull(declared, "declared must not be null");
        SemanticVersion compiler = config.compilerSemanticVersion();

        if (!config.supportsMajor(declared.major())) {
            diagnostics.report(DiagnosticKind.UNSUPPORTED_VERSION, VERSION_PATH,
                "descriptor version " + declared + " has unsupported major version " + declared.major()
                    + " (supported: " + config.supportedMajorVersions() + ")");
            log.debug("Rejected descriptor version {}", declared);
            return VersionCompatibility.INCOMPATIBLE;
        }

        if (declared.minor() == compiler.minor() && declared.patch() == compiler.patch()) {
            return VersionCompatibility.EXACT;
        }

        SemanticVersion sameMajor = new SemanticVersion(declared.major(), compiler.minor(), compiler.patch());
        boolean newer = declared.compareTo(sameMajor) > 0;
        diagnostics.report(DiagnosticKind.VERSION_WARNING, VERSION_PATH,
            "descriptor version " + declared + " is " + (newer ? "newer" : "older")
                + " than compiler version " + compiler + "; compiling in compatibility mode");
        return newer ? VersionCompatibility.NEWER_MINOR_OR_PATCH : VersionCompatibility.OLDER_MINOR_OR_PATCH;
    }
}
