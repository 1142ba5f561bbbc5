package org.contractexpr.compiler.frontend.parser.ast;

import org.contractexpr.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An expression written in parentheses. Kept as a node so printing reproduces the source grouping.
 *
 * @param openParen The opening parenthesis.
 * @param inner The enclosed expression.
 */
public record ParenthesizedNode(Token openParen, ExpressionNode inner) implements ExpressionNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(inner);
    }

    @Override
    public Token firstToken() {
        return openParen;
    }
}
