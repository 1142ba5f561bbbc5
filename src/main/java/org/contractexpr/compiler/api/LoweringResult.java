package org.contractexpr.compiler.api;

import org.contractexpr.compiler.diagnostics.Diagnostic;
import org.contractexpr.compiler.frontend.declaration.DeclarationNode;

import java.util.List;

/**
 * The outcome of a successful lowering run.
 *
 * @param fileName The name the source was lowered under.
 * @param declarations The declarations in source order, with lowered contracts.
 * @param diagnostics Non-error diagnostics, e.g. warnings.
 */
public record LoweringResult(String fileName, List<DeclarationNode> declarations, List<Diagnostic> diagnostics) {

    public LoweringResult {
        declarations = List.copyOf(declarations);
        diagnostics = List.copyOf(diagnostics);
    }
}
