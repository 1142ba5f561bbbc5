package org.contractexpr.compiler.frontend.parser.ast;

import org.contractexpr.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * An index or slice-free subscript {@code target[i, ...]}.
 */
public record IndexExpressionNode(ExpressionNode target, List<ExpressionNode> indices) implements ExpressionNode {

    public IndexExpressionNode {
        indices = List.copyOf(indices);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(target);
        children.addAll(indices);
        return children;
    }

    @Override
    public Token firstToken() {
        return target.firstToken();
    }
}
