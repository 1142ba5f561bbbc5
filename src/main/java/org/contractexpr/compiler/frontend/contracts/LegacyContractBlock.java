package org.contractexpr.compiler.frontend.contracts;

import org.contractexpr.compiler.frontend.lexer.Token;
import org.contractexpr.compiler.frontend.parser.ast.StatementNode;

import java.util.List;
import java.util.Optional;

/**
 * A contract in the braced block form, e.g. {@code out(r) { assert(r > 0); }}.
 *
 * @param kind The contract kind.
 * @param keyword The introducing keyword token.
 * @param returnIdentifier The {@code out(r)} identifier, if any. Always empty for other kinds.
 * @param statements The block statements in source order.
 */
public record LegacyContractBlock(ContractKind kind, Token keyword, Optional<Token> returnIdentifier,
                                  List<StatementNode> statements) {

    public LegacyContractBlock {
        statements = List.copyOf(statements);
    }
}
