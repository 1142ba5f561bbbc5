package org.contractexpr.compiler.diagnostics;

import org.contractexpr.compiler.api.CompilerErrorCode;
import org.contractexpr.compiler.frontend.lexer.Token;
import org.contractexpr.compiler.frontend.lexer.TokenType;
import org.contractexpr.compiler.frontend.parser.ContractParseError;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class ContractDiagnosticReporterTest {

    @Mock
    private DiagnosticsEngine mockEngine;

    @Test
    void report_shouldRecordErrorAtTokenStart() {
        final Token token = new Token(TokenType.IDENTIFIER, "out", null, 7, 12, "stack.d");
        final ContractParseError error = new ContractParseError(CompilerErrorCode.AMBIGUOUS_OUT_EXPRESSION, "ambiguous", token);
        final ContractDiagnosticReporter reporter = new ContractDiagnosticReporter(mockEngine);

        final Diagnostic diagnostic = reporter.report(error);

        verify(mockEngine).report(diagnostic);
        assertThat(diagnostic).isEqualTo(new Diagnostic(Diagnostic.Type.ERROR,
                CompilerErrorCode.AMBIGUOUS_OUT_EXPRESSION, "ambiguous", "stack.d", 7, 12));
        assertThat(reporter.getDiagnostics()).isSameAs(mockEngine);
    }

    @Test
    void report_shouldMakeEngineFailTheRun() {
        final DiagnosticsEngine engine = new DiagnosticsEngine();
        final Token token = new Token(TokenType.RIGHT_PAREN, ")", null, 1, 4, "<memory>");

        new ContractDiagnosticReporter(engine)
                .report(new ContractParseError(CompilerErrorCode.MALFORMED_CONTRACT_PARAMETERS, "in(...) expects a condition", token));

        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.summary())
                .isEqualTo("[ERROR] <memory>:1:4: in(...) expects a condition (MALFORMED_CONTRACT_PARAMETERS)");
    }
}
