package org.contractexpr.compiler.frontend.parser;

import org.contractexpr.compiler.api.CompilerErrorCode;
import org.contractexpr.compiler.api.SourceInfo;
import org.contractexpr.compiler.frontend.lexer.Token;

/**
 * Thrown by the parsers and the lowering step at the first malformed input.
 * <p>
 * No partial result is kept once this is thrown. The enclosing declaration parser
 * decides whether to report it and resynchronize.
 */
public class ContractParseError extends RuntimeException {

    private final CompilerErrorCode code;
    private final transient Token token;

    /**
     * Creates a new parse error.
     * @param code The error code classifying the failure.
     * @param message The explanatory message.
     * @param token The token at which the failure was detected.
     */
    public ContractParseError(CompilerErrorCode code, String message, Token token) {
        super(message);
        this.code = code;
        this.token = token;
    }

    /**
     * @return The error code.
     */
    public CompilerErrorCode getCode() {
        return code;
    }

    /**
     * @return The token the failure was detected at.
     */
    public Token getToken() {
        return token;
    }

    /**
     * @return The start position of the offending token.
     */
    public SourceInfo getSourceInfo() {
        return SourceInfo.of(token);
    }
}
