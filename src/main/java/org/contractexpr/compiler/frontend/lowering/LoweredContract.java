package org.contractexpr.compiler.frontend.lowering;

import org.contractexpr.compiler.frontend.contracts.ContractKind;
import org.contractexpr.compiler.frontend.contracts.LegacyContractBlock;
import org.contractexpr.compiler.frontend.lexer.Token;
import org.contractexpr.compiler.frontend.parser.ast.StatementNode;

import java.util.List;
import java.util.Optional;

/**
 * A contract in canonical block form: all conditions of one kind merged into one body.
 *
 * @param kind The contract kind.
 * @param keyword The keyword of the first contract that contributed to this one.
 * @param returnIdentifier The name bound to the return value, only ever present for {@link ContractKind#OUT}.
 * @param body The statements: synthesized asserts first, then legacy statements verbatim.
 */
public record LoweredContract(ContractKind kind, Token keyword, Optional<Token> returnIdentifier, List<StatementNode> body) {

    public LoweredContract {
        body = List.copyOf(body);
    }

    /**
     * Views this contract as a legacy block, the form it is equivalent to.
     * @return A legacy block with the same kind, return identifier and statements.
     */
    public LegacyContractBlock toLegacyBlock() {
        return new LegacyContractBlock(kind, keyword, returnIdentifier, body);
    }
}
