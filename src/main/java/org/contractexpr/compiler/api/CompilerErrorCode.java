package org.contractexpr.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur while recognizing
 * and lowering contracts. This decouples the test logic from the translated error messages.
 */
public enum CompilerErrorCode {
    // region Lexer Errors
    /** A character that starts no token. */
    UNEXPECTED_CHARACTER,
    /** A string or character literal that is not closed. */
    UNTERMINATED_STRING,
    /** A block comment that is not closed before the end of the file. */
    UNTERMINATED_COMMENT,
    // endregion

    // region Contract Errors
    /** A contract parameter list has zero or more than two expressions, or is followed by a stray token. */
    MALFORMED_CONTRACT_PARAMETERS,
    /** A single-identifier {@code out(i)} was deferred to the block form, and no block followed. */
    AMBIGUOUS_OUT_EXPRESSION,
    /** Two out contracts of one function declare different return identifiers. */
    CONFLICTING_RETURN_IDENTIFIER,
    /** A declaration without a body ends its contract expressions without {@code ;}. */
    MISSING_CONTRACT_TERMINATOR,
    /** Warning: a legacy contract block without statements, which lowers to no contract. */
    EMPTY_CONTRACT_BLOCK,
    // endregion

    // region General Errors
    /** A token that does not fit the expression, statement or declaration grammar. */
    UNEXPECTED_TOKEN
    // endregion
}
