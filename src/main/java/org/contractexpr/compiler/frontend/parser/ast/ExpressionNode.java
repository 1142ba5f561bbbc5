package org.contractexpr.compiler.frontend.parser.ast;

import org.contractexpr.compiler.frontend.lexer.Token;

/**
 * An expression as produced by the {@link org.contractexpr.compiler.frontend.parser.ExpressionParser}.
 * Contract conditions and messages are expressions; lowering moves them around unchanged.
 */
public sealed interface ExpressionNode extends AstNode
        permits IdentifierNode, LiteralNode, UnaryExpressionNode, BinaryExpressionNode,
        ConditionalExpressionNode, AssignExpressionNode, CallExpressionNode, IndexExpressionNode,
        MemberAccessNode, ParenthesizedNode {

    /**
     * Returns the first token of the expression, used for source positions.
     * @return The leftmost token.
     */
    Token firstToken();
}
