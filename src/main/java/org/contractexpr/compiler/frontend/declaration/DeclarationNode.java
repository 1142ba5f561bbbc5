package org.contractexpr.compiler.frontend.declaration;

import org.contractexpr.compiler.frontend.lexer.Token;

/**
 * A declaration whose contracts have been lowered.
 */
public sealed interface DeclarationNode permits FunctionDeclarationNode, AggregateDeclarationNode {

    /**
     * @return The declared name.
     */
    Token name();
}
