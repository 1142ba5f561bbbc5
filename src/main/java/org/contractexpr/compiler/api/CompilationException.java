package org.contractexpr.compiler.api;

import org.contractexpr.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * An exception that is thrown when one or more errors occur while lowering contracts.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 */
public class CompilationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception carrying the diagnostics that caused it.
     * @param message The detail message, usually the diagnostics summary.
     * @param diagnostics The diagnostics reported during lowering.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Returns the diagnostics that caused this exception.
     * @return An unmodifiable list of the reported diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
