package org.contractexpr.compiler.frontend.parser.ast;

import org.contractexpr.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A binary operation such as {@code a != 0} or {@code x && y}.
 *
 * @param left The left operand.
 * @param operator The operator token.
 * @param right The right operand.
 */
public record BinaryExpressionNode(ExpressionNode left, Token operator, ExpressionNode right) implements ExpressionNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public Token firstToken() {
        return left.firstToken();
    }
}
