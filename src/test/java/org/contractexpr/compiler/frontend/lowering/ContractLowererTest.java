package org.contractexpr.compiler.frontend.lowering;

import org.contractexpr.compiler.api.CompilerErrorCode;
import org.contractexpr.compiler.diagnostics.DiagnosticsEngine;
import org.contractexpr.compiler.frontend.contracts.ContractContext;
import org.contractexpr.compiler.frontend.contracts.ContractExpressionRecognizer;
import org.contractexpr.compiler.frontend.contracts.ContractGroup;
import org.contractexpr.compiler.frontend.contracts.ContractKind;
import org.contractexpr.compiler.frontend.contracts.LegacyContractParser;
import org.contractexpr.compiler.frontend.lexer.Lexer;
import org.contractexpr.compiler.frontend.lexer.Token;
import org.contractexpr.compiler.frontend.parser.ContractParseError;
import org.contractexpr.compiler.frontend.parser.TokenCursor;
import org.contractexpr.compiler.frontend.parser.ast.AssertStatementNode;
import org.contractexpr.config.ContractOptions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the {@link ContractLowerer}.
 * Source snippets are recognized first, so these tests exercise the merge rules on
 * realistic groups.
 */
public class ContractLowererTest {

    private final ContractOptions options = ContractOptions.defaults();
    private final ContractExpressionRecognizer recognizer = new ContractExpressionRecognizer(options);
    private final ContractLowerer lowerer = new ContractLowerer(options);

    private static TokenCursor cursorFor(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();
        assertThat(diagnostics.hasErrors()).isFalse();
        return new TokenCursor(tokens, diagnostics);
    }

    private List<LoweredContract> lower(String source, ContractContext context) {
        return lowerer.lower(recognizer.parseContracts(cursorFor(source), context));
    }

    /**
     * Verifies that two in expressions become one in block with two asserts in source order.
     */
    @Test
    @Tag("unit")
    void testInExpressionsMergeInOrder() {
        // Act
        List<LoweredContract> lowered = lower("in(a > 0) in(b >= 0, \"msg\") { }", ContractContext.FUNCTION);

        // Assert
        assertThat(lowered).singleElement().satisfies(contract -> {
            assertThat(contract.kind()).isEqualTo(ContractKind.IN);
            assertThat(contract.returnIdentifier()).isEmpty();
            assertThat(contract.body()).hasSize(2).allMatch(s -> s instanceof AssertStatementNode);
        });
        assertThat(SourcePrinter.print(lowered.get(0))).isEqualTo("in { assert(a > 0); assert(b >= 0, \"msg\"); }");
    }

    /**
     * Verifies that out expressions merge under the declared return identifier.
     */
    @Test
    @Tag("unit")
    void testOutExpressionsMergeUnderBinding() {
        // Act
        List<LoweredContract> lowered = lower("out(r; r > 0) out(; a != 0);", ContractContext.INTERFACE);

        // Assert
        assertThat(lowered).hasSize(1);
        assertThat(lowered.get(0).returnIdentifier()).map(Token::text).contains("r");
        assertThat(SourcePrinter.print(lowered.get(0))).isEqualTo("out(r) { assert(r > 0); assert(a != 0); }");
    }

    /**
     * Verifies the kind order of the result and that expression conditions precede
     * legacy statements of the same kind.
     */
    @Test
    @Tag("unit")
    void testExpressionConditionsPrecedeLegacyStatements() {
        // Act
        List<LoweredContract> lowered = lower(
                "out(; ok) in(a > 0) out(r) { assert(r != 0); } in { assert(b); } { }", ContractContext.FUNCTION);

        // Assert
        assertThat(lowered).extracting(LoweredContract::kind).containsExactly(ContractKind.IN, ContractKind.OUT);
        assertThat(SourcePrinter.printAll(lowered)).isEqualTo(String.join("\n",
                "in { assert(a > 0); assert(b); }",
                "out(r) { assert(ok); assert(r != 0); }"));
    }

    /**
     * Verifies that the synthesized assert sits at the position of its condition and uses
     * the configured function name.
     */
    @Test
    @Tag("unit")
    void testSynthesizedAssertPositionAndName() {
        // Arrange
        ContractOptions custom = new ContractOptions(true, "check", 2);
        ContractGroup group = new ContractExpressionRecognizer(custom)
                .parseContracts(cursorFor("in(\n   a > 0) { }"), ContractContext.FUNCTION);

        // Act
        List<LoweredContract> lowered = new ContractLowerer(custom).lower(group);

        // Assert
        AssertStatementNode assertion = (AssertStatementNode) lowered.get(0).body().get(0);
        assertThat(assertion.keyword()).extracting(Token::text, Token::line, Token::column)
                .containsExactly("check", 2, 4);
        assertThat(SourcePrinter.print(assertion)).isEqualTo("check(a > 0);");
    }

    /**
     * Verifies that two different return identifiers are a conflict reported at the second one.
     */
    @Test
    @Tag("unit")
    void testConflictingReturnIdentifiers() {
        // Arrange
        ContractGroup group = recognizer.parseContracts(cursorFor("out(r; r > 0) out(x; x > 0) { }"), ContractContext.FUNCTION);

        // Act
        ContractParseError error = catchThrowableOfType(() -> lowerer.lower(group), ContractParseError.class);

        // Assert
        assertThat(error.getCode()).isEqualTo(CompilerErrorCode.CONFLICTING_RETURN_IDENTIFIER);
        assertThat(error.getToken().text()).isEqualTo("x");
        assertThat(error.getMessage()).contains("'x'", "'r'", "1:5");
    }

    /**
     * Verifies that a binding conflicting with a legacy {@code out(x)} block is also a conflict,
     * while agreeing names merge.
     */
    @Test
    @Tag("unit")
    void testReturnIdentifierAgainstLegacyBlock() {
        // Arrange
        ContractGroup conflicting = recognizer.parseContracts(
                cursorFor("out(r; r > 0) out(x) { assert(x); } { }"), ContractContext.FUNCTION);
        ContractGroup agreeing = recognizer.parseContracts(
                cursorFor("out(r; r > 0) out(r) { assert(r < 9); } { }"), ContractContext.FUNCTION);

        // Act
        ContractParseError error = catchThrowableOfType(() -> lowerer.lower(conflicting), ContractParseError.class);
        List<LoweredContract> lowered = lowerer.lower(agreeing);

        // Assert
        assertThat(error.getCode()).isEqualTo(CompilerErrorCode.CONFLICTING_RETURN_IDENTIFIER);
        assertThat(SourcePrinter.print(lowered.get(0))).isEqualTo("out(r) { assert(r > 0); assert(r < 9); }");
    }

    /**
     * Verifies that kinds without conditions produce no contract, including empty legacy blocks.
     */
    @Test
    @Tag("unit")
    void testAbsenceStaysAbsence() {
        // Act
        List<LoweredContract> none = lowerer.lower(ContractGroup.empty());
        List<LoweredContract> emptyBlock = lower("in { } { }", ContractContext.FUNCTION);

        // Assert
        assertThat(none).isEmpty();
        assertThat(emptyBlock).isEmpty();
    }

    /**
     * Verifies that lowering the output again as legacy blocks passes it through unchanged.
     */
    @Test
    @Tag("unit")
    void testLoweringIsIdempotent() {
        // Arrange
        List<LoweredContract> first = lower(
                "in(a > 0, \"a\") out(r; r > 0) out(r) { if (r) assert(r != 1); } { }", ContractContext.FUNCTION);

        // Act
        List<LoweredContract> second = lowerer.lower(
                ContractGroup.ofLegacy(first.stream().map(LoweredContract::toLegacyBlock).toList()));

        // Assert
        assertThat(second).isEqualTo(first);
    }

    /**
     * Verifies idempotence through source text: printed output parsed as legacy blocks
     * and lowered again prints identically.
     */
    @Test
    @Tag("unit")
    void testPrintedOutputRelowersToSameText() {
        // Arrange
        String printed = SourcePrinter.printAll(lower(
                "in(a > 0) in(b >= 0, \"msg\") out(r; r > -1) { }", ContractContext.FUNCTION));
        TokenCursor cursor = cursorFor(printed);

        // Act
        ContractGroup reparsed = ContractGroup.ofLegacy(new LegacyContractParser().parseBlocks(cursor, ContractContext.FUNCTION));
        String reprinted = SourcePrinter.printAll(lowerer.lower(reparsed));

        // Assert
        assertThat(cursor.isAtEnd()).isTrue();
        assertThat(reprinted).isEqualTo(printed);
    }
}
