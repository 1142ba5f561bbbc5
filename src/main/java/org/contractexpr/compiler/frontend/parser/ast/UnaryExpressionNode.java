package org.contractexpr.compiler.frontend.parser.ast;

import org.contractexpr.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A prefix ({@code !a}, {@code -a}) or postfix ({@code a++}) unary expression.
 *
 * @param operator The operator token.
 * @param operand The operand.
 * @param postfix true if the operator follows the operand.
 */
public record UnaryExpressionNode(Token operator, ExpressionNode operand, boolean postfix) implements ExpressionNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }

    @Override
    public Token firstToken() {
        return postfix ? operand.firstToken() : operator;
    }
}
