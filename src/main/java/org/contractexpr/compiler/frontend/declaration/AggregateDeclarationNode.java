package org.contractexpr.compiler.frontend.declaration;

import org.contractexpr.compiler.frontend.lexer.Token;
import org.contractexpr.compiler.frontend.lowering.LoweredContract;

import java.util.List;

/**
 * A class, struct or interface with its lowered invariant and its members.
 *
 * @param keyword The {@code class}, {@code struct} or {@code interface} token.
 * @param name The aggregate name.
 * @param invariants The lowered invariant; at most one entry, merged from every invariant in the body.
 * @param members Methods and nested aggregates in source order. Fields are not kept.
 */
public record AggregateDeclarationNode(Token keyword, Token name, List<LoweredContract> invariants,
                                       List<DeclarationNode> members) implements DeclarationNode {

    public AggregateDeclarationNode {
        invariants = List.copyOf(invariants);
        members = List.copyOf(members);
    }
}
