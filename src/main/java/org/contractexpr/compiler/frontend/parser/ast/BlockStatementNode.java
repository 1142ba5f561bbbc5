package org.contractexpr.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A nested {@code { ... }} block.
 */
public record BlockStatementNode(List<StatementNode> statements) implements StatementNode {

    public BlockStatementNode {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(statements);
    }
}
