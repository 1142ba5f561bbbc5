package org.contractexpr.compiler.frontend.parser;

import org.contractexpr.compiler.api.CompilerErrorCode;
import org.contractexpr.compiler.diagnostics.DiagnosticsEngine;
import org.contractexpr.compiler.frontend.lexer.Token;
import org.contractexpr.compiler.frontend.lexer.TokenType;

import java.util.List;

/**
 * A {@link ParsingContext} over an immutable token buffer. The cursor state is a single
 * index, so backtracking is a save and restore of that index.
 */
public class TokenCursor implements ParsingContext {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;

    /**
     * Creates a cursor positioned at the first token.
     * @param tokens The tokens, terminated by {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public TokenCursor(List<Token> tokens, DiagnosticsEngine diagnostics) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.END_OF_FILE) {
            throw new IllegalArgumentException("Token list must be terminated by END_OF_FILE.");
        }
        this.tokens = List.copyOf(tokens);
        this.diagnostics = diagnostics;
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        return peek().type() == type;
    }

    @Override
    public boolean checkNext(TokenType type) {
        return peek(1).type() == type;
    }

    @Override
    public boolean checkKeyword(String keyword) {
        return peek().isKeyword(keyword);
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token peek(int offset) {
        int index = current + offset;
        if (index >= tokens.size()) return tokens.get(tokens.size() - 1);
        return tokens.get(index);
    }

    @Override
    public Token previous() {
        if (current == 0) return tokens.get(0);
        return tokens.get(current - 1);
    }

    @Override
    public Token consume(TokenType type, CompilerErrorCode code, String errorMessage) {
        if (check(type)) return advance();
        throw new ContractParseError(code, errorMessage, peek());
    }

    @Override
    public int mark() {
        return current;
    }

    @Override
    public void reset(int mark) {
        if (mark < 0 || mark >= tokens.size()) {
            throw new IllegalArgumentException("Invalid cursor mark: " + mark);
        }
        current = mark;
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
