package org.contractexpr.compiler.frontend.lowering;

import org.contractexpr.compiler.api.CompilerErrorCode;
import org.contractexpr.compiler.diagnostics.CompilerLogger;
import org.contractexpr.compiler.frontend.contracts.ContractExpression;
import org.contractexpr.compiler.frontend.contracts.ContractGroup;
import org.contractexpr.compiler.frontend.contracts.ContractKind;
import org.contractexpr.compiler.frontend.contracts.LegacyContractBlock;
import org.contractexpr.compiler.frontend.lexer.Token;
import org.contractexpr.compiler.frontend.lexer.TokenType;
import org.contractexpr.compiler.frontend.parser.ContractParseError;
import org.contractexpr.compiler.frontend.parser.ast.AssertStatementNode;
import org.contractexpr.compiler.frontend.parser.ast.ExpressionNode;
import org.contractexpr.compiler.frontend.parser.ast.StatementNode;
import org.contractexpr.compiler.internal.i18n.Messages;
import org.contractexpr.config.ContractOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lowers a {@link ContractGroup} into at most one {@link LoweredContract} per kind.
 * <p>
 * Merge rule per kind: one {@code assert(condition, message?)} per contract expression in
 * encounter order, followed by the statements of the legacy blocks verbatim. A kind whose
 * merged body is empty produces no contract at all.
 */
public class ContractLowerer {

    private final ContractOptions options;

    /**
     * Creates a lowerer.
     * @param options Supplies the name of the synthesized assert call.
     */
    public ContractLowerer(ContractOptions options) {
        this.options = options;
    }

    /**
     * Lowers the group.
     * @param group The recognized contracts of one declarator.
     * @return The lowered contracts in the order in, out, invariant; kinds without
     *         conditions are absent.
     * @throws ContractParseError with {@link CompilerErrorCode#CONFLICTING_RETURN_IDENTIFIER}
     *         if two out contracts name the return value differently.
     */
    public List<LoweredContract> lower(ContractGroup group) {
        List<LoweredContract> lowered = new ArrayList<>();
        for (ContractKind kind : ContractKind.values()) {
            lowerKind(group, kind).ifPresent(lowered::add);
        }
        return lowered;
    }

    private Optional<LoweredContract> lowerKind(ContractGroup group, ContractKind kind) {
        List<ContractExpression> expressions = group.expressionsOf(kind);
        List<LegacyContractBlock> blocks = group.legacyBlocksOf(kind);

        List<StatementNode> body = new ArrayList<>();
        for (ContractExpression expression : expressions) {
            body.add(synthesizeAssert(expression));
        }
        for (LegacyContractBlock block : blocks) {
            body.addAll(block.statements());
        }
        if (body.isEmpty()) {
            return Optional.empty();
        }

        Token keyword = !expressions.isEmpty() ? expressions.get(0).keyword() : blocks.get(0).keyword();
        Optional<Token> returnIdentifier = kind == ContractKind.OUT
                ? resolveReturnIdentifier(expressions, blocks)
                : Optional.empty();
        CompilerLogger.trace("Lowered " + expressions.size() + " expression(s) and " + blocks.size()
                + " block(s) into one " + kind.keyword() + " contract with " + body.size() + " statement(s).");
        return Optional.of(new LoweredContract(kind, keyword, returnIdentifier, body));
    }

    private AssertStatementNode synthesizeAssert(ContractExpression expression) {
        ExpressionNode condition = expression.condition().condition();
        Token position = condition.firstToken();
        Token assertToken = new Token(TokenType.IDENTIFIER, options.assertFunction(), null,
                position.line(), position.column(), position.fileName());
        return new AssertStatementNode(assertToken, condition, expression.condition().message());
    }

    /**
     * Picks the one identifier all out contracts agree on, in encounter order:
     * expression bindings first, then {@code out(r)} block identifiers.
     */
    private Optional<Token> resolveReturnIdentifier(List<ContractExpression> expressions, List<LegacyContractBlock> blocks) {
        List<Token> declared = new ArrayList<>();
        for (ContractExpression expression : expressions) {
            if (expression instanceof ContractExpression.Out out) {
                out.returnBinding().ifPresent(declared::add);
            }
        }
        for (LegacyContractBlock block : blocks) {
            block.returnIdentifier().ifPresent(declared::add);
        }

        Token chosen = null;
        for (Token identifier : declared) {
            if (chosen == null) {
                chosen = identifier;
            } else if (!chosen.text().equals(identifier.text())) {
                throw new ContractParseError(CompilerErrorCode.CONFLICTING_RETURN_IDENTIFIER,
                        Messages.get("lowering.conflictingReturnIdentifier", identifier.text(), chosen.text(),
                                chosen.line(), chosen.column()),
                        identifier);
            }
        }
        return Optional.ofNullable(chosen);
    }
}
