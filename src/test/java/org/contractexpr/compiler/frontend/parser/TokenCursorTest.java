package org.contractexpr.compiler.frontend.parser;

import org.contractexpr.compiler.api.CompilerErrorCode;
import org.contractexpr.compiler.diagnostics.DiagnosticsEngine;
import org.contractexpr.compiler.frontend.lexer.Lexer;
import org.contractexpr.compiler.frontend.lexer.Token;
import org.contractexpr.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link TokenCursor}, in particular for mark and reset,
 * which the contract recognizer uses to backtrack.
 */
public class TokenCursorTest {

    private static TokenCursor cursorFor(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();
        return new TokenCursor(tokens, diagnostics);
    }

    /**
     * Verifies that resetting to a mark restores the exact position, so that lookahead
     * consumes nothing.
     */
    @Test
    @Tag("unit")
    void testResetRestoresPosition() {
        // Arrange
        TokenCursor cursor = cursorFor("out(i) { }");
        int mark = cursor.mark();

        // Act
        cursor.advance();
        cursor.advance();
        cursor.advance();
        cursor.reset(mark);

        // Assert
        assertThat(cursor.mark()).isZero();
        assertThat(cursor.peek().text()).isEqualTo("out");
    }

    /**
     * Verifies that looking past the end yields the end-of-file token instead of failing,
     * and that advancing at the end stays there.
     */
    @Test
    @Tag("unit")
    void testPeekAndAdvancePastEnd() {
        // Arrange
        TokenCursor cursor = cursorFor("a");

        // Act
        Token far = cursor.peek(10);
        cursor.advance();
        cursor.advance();

        // Assert
        assertThat(far.type()).isEqualTo(TokenType.END_OF_FILE);
        assertThat(cursor.isAtEnd()).isTrue();
        assertThat(cursor.previous().text()).isEqualTo("a");
    }

    /**
     * Verifies that match only consumes a token of one of the given types.
     */
    @Test
    @Tag("unit")
    void testMatchAndCheckKeyword() {
        // Arrange
        TokenCursor cursor = cursorFor("in ( x");

        // Act & Assert
        assertThat(cursor.checkKeyword("in")).isTrue();
        assertThat(cursor.checkNext(TokenType.LEFT_PAREN)).isTrue();
        assertThat(cursor.match(TokenType.LEFT_PAREN)).isFalse();
        cursor.advance();
        assertThat(cursor.match(TokenType.SEMICOLON, TokenType.LEFT_PAREN)).isTrue();
        assertThat(cursor.peek().text()).isEqualTo("x");
    }

    /**
     * Verifies that consume fails with the given code at the current token.
     */
    @Test
    @Tag("unit")
    void testConsumeFailsAtCurrentToken() {
        // Arrange
        TokenCursor cursor = cursorFor("a b");

        // Act & Assert
        assertThatThrownBy(() -> cursor.consume(TokenType.SEMICOLON, CompilerErrorCode.UNEXPECTED_TOKEN, "Expected ';'."))
                .isInstanceOf(ContractParseError.class)
                .hasMessage("Expected ';'.")
                .satisfies(e -> assertThat(((ContractParseError) e).getToken().text()).isEqualTo("a"));
        assertThat(cursor.mark()).isZero();
    }

    /**
     * Verifies that the cursor rejects token lists without an end-of-file token and invalid marks.
     */
    @Test
    @Tag("unit")
    void testRejectsInvalidInput() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        TokenCursor cursor = cursorFor("a");

        // Act & Assert
        assertThatThrownBy(() -> new TokenCursor(List.of(), diagnostics))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cursor.reset(5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
