package org.contractexpr.compiler.frontend.parser.ast;

import org.contractexpr.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * A call {@code callee(arg, ...)}.
 *
 * @param callee The called expression.
 * @param arguments The arguments in source order.
 */
public record CallExpressionNode(ExpressionNode callee, List<ExpressionNode> arguments) implements ExpressionNode {

    public CallExpressionNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(callee);
        children.addAll(arguments);
        return children;
    }

    @Override
    public Token firstToken() {
        return callee.firstToken();
    }
}
