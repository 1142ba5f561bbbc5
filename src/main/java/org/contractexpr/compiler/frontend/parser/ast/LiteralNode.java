package org.contractexpr.compiler.frontend.parser.ast;

import org.contractexpr.compiler.frontend.lexer.Token;

/**
 * A number, string or character literal. The token keeps the original spelling, so
 * a message like {@code "cannot be 0"} is reproduced exactly when printed.
 *
 * @param literalToken The literal token.
 */
public record LiteralNode(Token literalToken) implements ExpressionNode {

    /**
     * @return The processed value of the literal (a Long, Double or String).
     */
    public Object getValue() {
        return literalToken.value();
    }

    @Override
    public Token firstToken() {
        return literalToken;
    }
}
