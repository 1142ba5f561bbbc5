package org.contractexpr.compiler.diagnostics;

import org.contractexpr.compiler.api.CompilerErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur while contracts are parsed and lowered.
 * <p>
 * This decouples error reporting from the actual parser logic. One instance belongs to
 * exactly one lowering run and is not shared between threads.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Records an already built diagnostic.
     *
     * @param diagnostic The diagnostic.
     */
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /**
     * Reports an error.
     *
     * @param code         The error code.
     * @param message      The error message.
     * @param fileName     The file in which the error occurred.
     * @param lineNumber   The line number of the error.
     * @param columnNumber The column of the offending token.
     */
    public void reportError(CompilerErrorCode code, String message, String fileName, int lineNumber, int columnNumber) {
        report(new Diagnostic(Diagnostic.Type.ERROR, code, message, fileName, lineNumber, columnNumber));
    }

    /**
     * Reports a warning.
     *
     * @param code         The code classifying the warning.
     * @param message      The warning message.
     * @param fileName     The file in which the warning occurred.
     * @param lineNumber   The line number of the warning.
     * @param columnNumber The column of the token the warning refers to.
     */
    public void reportWarning(CompilerErrorCode code, String message, String fileName, int lineNumber, int columnNumber) {
        report(new Diagnostic(Diagnostic.Type.WARNING, code, message, fileName, lineNumber, columnNumber));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
