package org.contractexpr.compiler.frontend.parser;

import org.contractexpr.compiler.api.CompilerErrorCode;
import org.contractexpr.compiler.diagnostics.DiagnosticsEngine;
import org.contractexpr.compiler.frontend.lexer.Token;
import org.contractexpr.compiler.frontend.lexer.TokenType;

/**
 * An interface that encapsulates the cursor state during parsing.
 * It provides the recognizer, the expression parser and the declaration parser with
 * access to the token stream without coupling them to a specific implementation.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Checks the type of the token after the current one without consuming anything.
     * @param type The token type to check.
     * @return true if the next token is of the given type, false otherwise.
     */
    boolean checkNext(TokenType type);

    /**
     * Checks if the current token is an identifier spelled like the given keyword.
     * @param keyword The keyword text.
     * @return true if the current token is that keyword.
     */
    boolean checkKeyword(String keyword);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the token {@code offset} positions ahead without consuming anything.
     * Offsets past the end yield the end-of-file token.
     * @param offset 0 for the current token, 1 for the next one, and so on.
     * @return The token at that offset.
     */
    Token peek(int offset);

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type, otherwise fails.
     * @param type The expected token type.
     * @param code The error code to fail with.
     * @param errorMessage The error message to fail with.
     * @return The consumed token.
     * @throws ContractParseError if the current token is of another type.
     */
    Token consume(TokenType type, CompilerErrorCode code, String errorMessage);

    /**
     * Takes a snapshot of the cursor position.
     * @return A mark that can be passed to {@link #reset(int)}.
     */
    int mark();

    /**
     * Restores the cursor to a previously taken mark. Nothing consumed after the mark
     * is lost; the tokens are read again from the buffer.
     * @param mark A value returned by {@link #mark()} on this context.
     */
    void reset(int mark);

    /**
     * Gets the diagnostics engine for reporting errors and warnings.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();
}
