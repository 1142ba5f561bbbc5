package org.contractexpr.compiler.frontend.declaration;

import org.contractexpr.compiler.frontend.contracts.ContractContext;
import org.contractexpr.compiler.frontend.lexer.Token;
import org.contractexpr.compiler.frontend.lowering.LoweredContract;

import java.util.List;

/**
 * A function or method declarator with its lowered contracts.
 *
 * @param name The function name.
 * @param context {@link ContractContext#INTERFACE} for interface and abstract members, otherwise {@link ContractContext#FUNCTION}.
 * @param contracts The lowered contracts, at most one per kind.
 * @param hasBody false for declarations ending in {@code ;}.
 */
public record FunctionDeclarationNode(Token name, ContractContext context, List<LoweredContract> contracts,
                                      boolean hasBody) implements DeclarationNode {

    public FunctionDeclarationNode {
        contracts = List.copyOf(contracts);
    }
}
