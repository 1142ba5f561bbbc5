package org.contractexpr.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., Identifier, Operator, Number).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token (e.g., the integer value of a number).
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name from which this token originates.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {

    /**
     * Checks whether this token is an identifier with exactly the given text.
     * Contract keywords such as {@code in} and {@code out} are lexed as identifiers
     * and classified by the parser, so this is the usual way to test for them.
     * @param keyword The keyword text.
     * @return true if this is an identifier spelled {@code keyword}.
     */
    public boolean isKeyword(String keyword) {
        return type == TokenType.IDENTIFIER && text.equals(keyword);
    }

    /**
     * Checks whether this token is an operator with exactly the given text.
     * @param operator The operator text, e.g. {@code "!="}.
     * @return true if this is the given operator.
     */
    public boolean isOperator(String operator) {
        return type == TokenType.OPERATOR && text.equals(operator);
    }
}
