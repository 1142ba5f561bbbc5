package org.contractexpr.compiler.diagnostics;

import org.contractexpr.compiler.api.CompilerErrorCode;

/**
 * Represents a single diagnostic message (error, warning, info)
 * produced while recognizing or lowering contracts.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The error code, usable by tests and tooling independent of the message text.
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue.
 * @param columnNumber The column of the token the issue starts at.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents lowering. */
        ERROR,
        /** A warning that does not prevent lowering. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s (%s)", type, fileName, lineNumber, columnNumber, message, code);
    }
}
