package org.contractexpr.compiler.frontend.parser.ast;

import org.contractexpr.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code if (condition) thenBranch [else elseBranch]}.
 */
public record IfStatementNode(Token keyword, ExpressionNode condition, StatementNode thenBranch,
                              Optional<StatementNode> elseBranch) implements StatementNode {

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(condition);
        children.add(thenBranch);
        elseBranch.ifPresent(children::add);
        return children;
    }
}
