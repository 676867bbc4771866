package com.smartservice.core.parser;

import com.smartservice.core.diagnostic.Diagnostic;

import java.util.List;
import java.util.Optional;

/**
 * Result of structural parsing.
 *
 * @param tree parsed tree, or null when any parse error was reported
 * @param diagnostics every parse error and warning of the document
 */
public record ParseOutcome(
    DescriptorTree tree,
    List<Diagnostic> diagnostics
) {
    public ParseOutcome {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public boolean succeeded() {
        return tree != null;
    }

    public Optional<DescriptorTree> treeOptional() {
        return Optional.ofNullable(tree);
    }
}
