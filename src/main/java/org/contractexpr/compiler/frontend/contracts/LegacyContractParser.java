package org.contractexpr.compiler.frontend.contracts;

import org.contractexpr.compiler.api.CompilerErrorCode;
import org.contractexpr.compiler.frontend.lexer.Token;
import org.contractexpr.compiler.frontend.lexer.TokenType;
import org.contractexpr.compiler.frontend.parser.ParsingContext;
import org.contractexpr.compiler.frontend.parser.StatementParser;
import org.contractexpr.compiler.frontend.parser.ast.StatementNode;
import org.contractexpr.compiler.internal.i18n.Messages;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses contracts in the braced block form:
 * <ul>
 *     <li>{@code in { ... }}</li>
 *     <li>{@code out { ... }} and {@code out(identifier) { ... }}</li>
 *     <li>{@code invariant { ... }} and {@code invariant() { ... }} at aggregate scope</li>
 * </ul>
 * An opener that is not followed by a block is left untouched so that the caller can
 * decide what it means. An empty block is kept but reported as a warning, since it
 * lowers to no contract at all.
 */
public class LegacyContractParser {

    /**
     * Parses as many contiguous legacy blocks as are present.
     * @param cursor The cursor, positioned where a block may start.
     * @param contractContext Where the blocks appear; only aggregates accept invariants.
     * @return The blocks in source order, possibly empty.
     */
    public List<LegacyContractBlock> parseBlocks(ParsingContext cursor, ContractContext contractContext) {
        List<LegacyContractBlock> blocks = new ArrayList<>();
        while (true) {
            Optional<LegacyContractBlock> block = parseBlock(cursor, contractContext);
            if (block.isEmpty()) {
                return blocks;
            }
            blocks.add(block.get());
        }
    }

    /**
     * Checks whether the cursor is at the start of a legacy block, without consuming anything.
     * @param cursor The cursor.
     * @param contractContext Where the block would appear.
     * @return true if {@link #parseBlocks} would parse at least one block here.
     */
    public boolean atLegacyBlock(ParsingContext cursor, ContractContext contractContext) {
        return legacyOpenerLength(cursor, contractContext) > 0;
    }

    private Optional<LegacyContractBlock> parseBlock(ParsingContext cursor, ContractContext contractContext) {
        int openerLength = legacyOpenerLength(cursor, contractContext);
        if (openerLength == 0) {
            return Optional.empty();
        }
        Token keyword = cursor.advance();
        ContractKind kind = kindOf(keyword);
        Optional<Token> returnIdentifier = Optional.empty();
        if (cursor.match(TokenType.LEFT_PAREN)) {
            if (cursor.check(TokenType.IDENTIFIER)) {
                returnIdentifier = Optional.of(cursor.advance());
            }
            cursor.advance(); // consume ')'
        }
        List<StatementNode> statements = new StatementParser(cursor).parseBlock();
        if (statements.isEmpty()) {
            cursor.getDiagnostics().reportWarning(CompilerErrorCode.EMPTY_CONTRACT_BLOCK,
                    Messages.get("contracts.emptyBlock", keyword.text()),
                    keyword.fileName(), keyword.line(), keyword.column());
        }
        return Optional.of(new LegacyContractBlock(kind, keyword, returnIdentifier, statements));
    }

    /**
     * Returns the number of tokens before the opening brace of a legacy block at the cursor,
     * or 0 if there is none.
     */
    private int legacyOpenerLength(ParsingContext cursor, ContractContext contractContext) {
        Token keyword = cursor.peek();
        boolean isIn = keyword.isKeyword("in") && contractContext != ContractContext.AGGREGATE;
        boolean isOut = keyword.isKeyword("out") && contractContext != ContractContext.AGGREGATE;
        boolean isInvariant = keyword.isKeyword("invariant") && contractContext == ContractContext.AGGREGATE;
        if (!isIn && !isOut && !isInvariant) {
            return 0;
        }
        if (cursor.peek(1).type() == TokenType.LEFT_BRACE) {
            return 1;
        }
        if (isOut && cursor.peek(1).type() == TokenType.LEFT_PAREN && cursor.peek(2).type() == TokenType.IDENTIFIER
                && cursor.peek(3).type() == TokenType.RIGHT_PAREN && cursor.peek(4).type() == TokenType.LEFT_BRACE) {
            return 4;
        }
        if (isInvariant && cursor.peek(1).type() == TokenType.LEFT_PAREN
                && cursor.peek(2).type() == TokenType.RIGHT_PAREN && cursor.peek(3).type() == TokenType.LEFT_BRACE) {
            return 3;
        }
        return 0;
    }

    private static ContractKind kindOf(Token keyword) {
        return switch (keyword.text()) {
            case "in" -> ContractKind.IN;
            case "out" -> ContractKind.OUT;
            default -> ContractKind.INVARIANT;
        };
    }
}
