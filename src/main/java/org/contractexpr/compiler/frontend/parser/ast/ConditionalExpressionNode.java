package org.contractexpr.compiler.frontend.parser.ast;

import org.contractexpr.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * The ternary {@code condition ? thenBranch : elseBranch}.
 */
public record ConditionalExpressionNode(ExpressionNode condition, ExpressionNode thenBranch, ExpressionNode elseBranch)
        implements ExpressionNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, thenBranch, elseBranch);
    }

    @Override
    public Token firstToken() {
        return condition.firstToken();
    }
}
