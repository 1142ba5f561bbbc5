package org.contractexpr.compiler.frontend.lowering;

import org.contractexpr.compiler.diagnostics.DiagnosticsEngine;
import org.contractexpr.compiler.frontend.lexer.Lexer;
import org.contractexpr.compiler.frontend.parser.ExpressionParser;
import org.contractexpr.compiler.frontend.parser.StatementParser;
import org.contractexpr.compiler.frontend.parser.TokenCursor;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link SourcePrinter}.
 */
public class SourcePrinterTest {

    private static TokenCursor cursorFor(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        return new TokenCursor(new Lexer(source, diagnostics).scanTokens(), diagnostics);
    }

    private static String reprintExpression(String source) {
        return SourcePrinter.print(new ExpressionParser(cursorFor(source)).parseAssignExpression());
    }

    /**
     * Verifies that expressions are normalized to single spaces around infix operators
     * while keeping parentheses, calls and literals as written.
     */
    @Test
    @Tag("unit")
    void testExpressionNormalization() {
        // Act & Assert
        assertThat(reprintExpression("a>0&&(b||c)")).isEqualTo("a > 0 && (b || c)");
        assertThat(reprintExpression("x?y:z")).isEqualTo("x ? y : z");
        assertThat(reprintExpression("f( a ,b )[0].len")).isEqualTo("f(a, b)[0].len");
        assertThat(reprintExpression("s ~= \"x\"")).isEqualTo("s ~= \"x\"");
        assertThat(reprintExpression("i++ + 'c'")).isEqualTo("i++ + 'c'");
    }

    /**
     * Verifies that nested prefix operators stay separated where joining them would
     * lex as a different operator.
     */
    @Test
    @Tag("unit")
    void testNestedPrefixOperators() {
        // Act & Assert
        assertThat(reprintExpression("- -a")).isEqualTo("- -a");
        assertThat(reprintExpression("!a")).isEqualTo("!a");
        assertThat(reprintExpression("-(a)")).isEqualTo("-(a)");
    }

    /**
     * Verifies statement printing for the statement kinds of contract blocks.
     */
    @Test
    @Tag("unit")
    void testStatements() {
        // Arrange
        StatementParser parser = new StatementParser(cursorFor("if(a){assert(a,\"m\");}else;{}"));

        // Act
        String ifStatement = SourcePrinter.print(parser.parseStatement());
        String emptyBlock = SourcePrinter.print(parser.parseStatement());

        // Assert
        assertThat(ifStatement).isEqualTo("if (a) { assert(a, \"m\"); } else ;");
        assertThat(emptyBlock).isEqualTo("{ }");
    }
}
