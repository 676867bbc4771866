package com.smartservice.core.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.smartservice.core.diagnostic.Diagnostic;

import java.util.List;
import java.util.Objects;

/**
 * A descriptor document as read from text.
 *
 * @param root document root (a missing node for empty documents)
 * @param diagnostics findings of the reader itself, i.e. repeated mapping keys
 */
public record DescriptorDocument(
    JsonNode root,
    List<Diagnostic> diagnostics
) {
    public DescriptorDocument {
        Objects.requireNonNull(root, "root must not be null");
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }
}
