package org.contractexpr.compiler.frontend.parser.ast;

import org.contractexpr.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A member access {@code target.member}.
 */
public record MemberAccessNode(ExpressionNode target, Token member) implements ExpressionNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(target);
    }

    @Override
    public Token firstToken() {
        return target.firstToken();
    }
}
