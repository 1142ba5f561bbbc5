package org.contractexpr.compiler.frontend.parser.ast;

import org.contractexpr.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An assignment such as {@code x = 1} or {@code x += 1}. Contract parameters are
 * AssignExpressions, so this is the top of the expression grammar.
 *
 * @param target The assigned expression.
 * @param operator The assignment operator token.
 * @param value The assigned value.
 */
public record AssignExpressionNode(ExpressionNode target, Token operator, ExpressionNode value) implements ExpressionNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(target, value);
    }

    @Override
    public Token firstToken() {
        return target.firstToken();
    }
}
