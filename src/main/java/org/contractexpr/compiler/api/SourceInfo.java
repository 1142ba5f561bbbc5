package org.contractexpr.compiler.api;

import org.contractexpr.compiler.frontend.lexer.Token;

/**
 * A pure data class representing a position in the source code.
 *
 * @param fileName The file where the code is located.
 * @param lineNumber The line number.
 * @param columnNumber The column the position starts at.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    /**
     * Creates the source position at which a token starts.
     * @param token The token.
     * @return The token's start position.
     */
    public static SourceInfo of(Token token) {
        return new SourceInfo(token.fileName(), token.line(), token.column());
    }

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
