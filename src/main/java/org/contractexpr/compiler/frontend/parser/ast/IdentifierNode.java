package org.contractexpr.compiler.frontend.parser.ast;

import org.contractexpr.compiler.frontend.lexer.Token;

/**
 * An AST node that represents an identifier, e.g. a parameter or a return binding name.
 *
 * @param identifierToken The token of the identifier.
 */
public record IdentifierNode(
        Token identifierToken
) implements ExpressionNode {
    // This node has no children and inherits the empty list from getChildren().

    @Override
    public Token firstToken() {
        return identifierToken;
    }
}
