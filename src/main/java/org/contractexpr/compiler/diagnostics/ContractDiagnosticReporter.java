package org.contractexpr.compiler.diagnostics;

import org.contractexpr.compiler.api.SourceInfo;
import org.contractexpr.compiler.frontend.parser.ContractParseError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns parse and lowering failures into structured {@link Diagnostic}s carrying the error
 * code, the start position of the offending token and the explanatory message.
 */
public class ContractDiagnosticReporter {

    private static final Logger LOG = LoggerFactory.getLogger(ContractDiagnosticReporter.class);

    private final DiagnosticsEngine diagnostics;

    /**
     * Creates a reporter writing into the given engine.
     * @param diagnostics The engine that collects the diagnostics of one run.
     */
    public ContractDiagnosticReporter(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Records the failure as an error diagnostic.
     * @param error The failure.
     * @return The diagnostic that was recorded.
     */
    public Diagnostic report(ContractParseError error) {
        SourceInfo at = error.getSourceInfo();
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Type.ERROR, error.getCode(), error.getMessage(),
                at.fileName(), at.lineNumber(), at.columnNumber());
        diagnostics.report(diagnostic);
        LOG.debug("Reported {} at {}: {}", error.getCode(), at, error.getMessage());
        return diagnostic;
    }

    /**
     * @return The engine this reporter writes into.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
