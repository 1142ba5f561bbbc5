package org.contractexpr.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    /** The '(' character. */
    LEFT_PAREN,
    /** The ')' character. */
    RIGHT_PAREN,
    /** The '{' character. */
    LEFT_BRACE,
    /** The '}' character. */
    RIGHT_BRACE,
    /** The '[' character. */
    LEFT_BRACKET,
    /** The ']' character. */
    RIGHT_BRACKET,
    /** The ',' character, separating contract parameters and call arguments. */
    COMMA,
    /** The ';' character, terminating statements and separating an out binding. */
    SEMICOLON,

    // Operators.
    /** Any operator, such as '!=', '&&', '+', '=' or '?'. The text identifies which one. */
    OPERATOR,

    // Literals.
    /** An identifier. Keywords like {@code in}, {@code out} and {@code invariant} are identifiers too. */
    IDENTIFIER,
    /** A numeric literal. */
    NUMBER,
    /** A string literal. */
    STRING,
    /** A character literal. */
    CHARACTER,

    // Miscellaneous.
    /** Represents the end of the source file. */
    END_OF_FILE
}
