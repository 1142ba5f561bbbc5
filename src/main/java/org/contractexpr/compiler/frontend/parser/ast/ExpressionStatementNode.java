package org.contractexpr.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An expression followed by {@code ;}.
 */
public record ExpressionStatementNode(ExpressionNode expression) implements StatementNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
