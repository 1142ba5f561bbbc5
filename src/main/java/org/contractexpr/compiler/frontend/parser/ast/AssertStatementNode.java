package org.contractexpr.compiler.frontend.parser.ast;

import org.contractexpr.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An {@code assert(condition, message);} statement, either written in a legacy block or
 * synthesized from a contract expression. The message is never evaluated or rewritten.
 *
 * @param keyword The {@code assert} token (synthesized asserts carry the condition's position).
 * @param condition The asserted condition.
 * @param message The optional message expression.
 */
public record AssertStatementNode(Token keyword, ExpressionNode condition, Optional<ExpressionNode> message)
        implements StatementNode {

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(condition);
        message.ifPresent(children::add);
        return children;
    }
}
