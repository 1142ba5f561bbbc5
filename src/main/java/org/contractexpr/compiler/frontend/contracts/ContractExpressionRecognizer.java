package org.contractexpr.compiler.frontend.contracts;

import org.contractexpr.compiler.api.CompilerErrorCode;
import org.contractexpr.compiler.diagnostics.CompilerLogger;
import org.contractexpr.compiler.frontend.lexer.Token;
import org.contractexpr.compiler.frontend.lexer.TokenType;
import org.contractexpr.compiler.frontend.parser.ContractParseError;
import org.contractexpr.compiler.frontend.parser.ExpressionParser;
import org.contractexpr.compiler.frontend.parser.ParsingContext;
import org.contractexpr.compiler.frontend.parser.ast.ExpressionNode;
import org.contractexpr.compiler.internal.i18n.Messages;
import org.contractexpr.config.ContractOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recognizes the contracts following a function's parameter list, or the invariants at
 * member position in an aggregate body.
 * <p>
 * Contract expressions ({@code in(...)}, {@code out(...)}, {@code invariant(...);}) are read
 * first, then any legacy blocks. The only form that needs backtracking is
 * {@code out(identifier)}: it always introduces a legacy {@code out(identifier) { ... }} block
 * and is never read as a condition. When no block follows it, recognition fails with
 * {@link CompilerErrorCode#AMBIGUOUS_OUT_EXPRESSION}.
 * <p>
 * Instances hold no cursor state and may be shared between threads, as long as every
 * call gets its own cursor.
 */
public class ContractExpressionRecognizer {

    private final ContractOptions options;
    private final LegacyContractParser legacyParser = new LegacyContractParser();

    /**
     * Creates a recognizer.
     * @param options The parser options.
     */
    public ContractExpressionRecognizer(ContractOptions options) {
        this.options = options;
    }

    /**
     * Parses zero or more contracts at the cursor.
     *
     * @param cursor A cursor positioned right after a parameter list, or at member position
     *               in an aggregate body.
     * @param contractContext Where the cursor is.
     * @return The recognized contracts; empty if the cursor is not at a contract. The cursor is
     *         advanced past everything the group contains, plus a terminating {@code ;} when
     *         {@link ContractGroup#isTerminated()} is true.
     * @throws ContractParseError at the first malformed contract. No partial group is returned.
     */
    public ContractGroup parseContracts(ParsingContext cursor, ContractContext contractContext) {
        List<ContractExpression> expressions = new ArrayList<>();
        int deferredOutMark = -1;

        while (true) {
            if (atExpressionOpener(cursor, contractContext, "in")) {
                expressions.add(parseIn(cursor));
            } else if (atExpressionOpener(cursor, contractContext, "out")) {
                int mark = cursor.mark();
                Optional<ContractExpression.Out> out = parseOut(cursor);
                if (out.isEmpty()) {
                    deferredOutMark = mark;
                    CompilerLogger.trace("Deferring single-identifier out(...) at " + cursor.peek().line()
                            + ":" + cursor.peek().column() + " to the block form.");
                    break;
                }
                expressions.add(out.get());
            } else if (atExpressionOpener(cursor, contractContext, "invariant")) {
                expressions.add(parseInvariant(cursor));
            } else {
                break;
            }
        }

        List<LegacyContractBlock> legacyBlocks = legacyParser.parseBlocks(cursor, contractContext);

        if (deferredOutMark >= 0 && cursor.mark() == deferredOutMark) {
            Token outToken = cursor.peek();
            throw new ContractParseError(CompilerErrorCode.AMBIGUOUS_OUT_EXPRESSION,
                    Messages.get("contracts.ambiguousOut", cursor.peek(2).text()), outToken);
        }

        boolean terminated = false;
        if (!expressions.isEmpty() && legacyBlocks.isEmpty() && contractContext != ContractContext.AGGREGATE) {
            if (cursor.match(TokenType.SEMICOLON)) {
                terminated = true;
            } else if (!atBodyOpener(cursor)) {
                throw new ContractParseError(CompilerErrorCode.MISSING_CONTRACT_TERMINATOR,
                        Messages.get("contracts.missingTerminator", describe(cursor.peek())), cursor.peek());
            }
        }

        ContractGroup group = new ContractGroup(expressions, legacyBlocks, terminated);
        if (!group.isEmpty()) {
            CompilerLogger.debug("Recognized " + group + " in " + contractContext + " context.");
        }
        return group;
    }

    private boolean atExpressionOpener(ParsingContext cursor, ContractContext contractContext, String keyword) {
        if (!cursor.checkKeyword(keyword) || !cursor.checkNext(TokenType.LEFT_PAREN)) {
            return false;
        }
        if ("invariant".equals(keyword)) {
            return contractContext == ContractContext.AGGREGATE && !legacyParser.atLegacyBlock(cursor, contractContext);
        }
        return contractContext != ContractContext.AGGREGATE;
    }

    private ContractExpression.In parseIn(ParsingContext cursor) {
        Token keyword = cursor.advance();
        cursor.advance(); // consume '('
        return new ContractExpression.In(keyword, parseContractParameters(cursor, keyword));
    }

    /**
     * Parses an {@code out(...)} expression, or restores the cursor to before {@code out}
     * and returns empty for the single-identifier legacy introducer.
     */
    private Optional<ContractExpression.Out> parseOut(ParsingContext cursor) {
        int beforeOut = cursor.mark();
        Token keyword = cursor.advance();
        cursor.advance(); // consume '('

        if (cursor.match(TokenType.SEMICOLON)) {
            return Optional.of(new ContractExpression.Out(keyword, Optional.empty(), parseContractParameters(cursor, keyword)));
        }
        if (cursor.check(TokenType.IDENTIFIER)) {
            if (cursor.checkNext(TokenType.SEMICOLON)) {
                Token binding = cursor.advance();
                cursor.advance(); // consume ';'
                return Optional.of(new ContractExpression.Out(keyword, Optional.of(binding), parseContractParameters(cursor, keyword)));
            }
            if (cursor.checkNext(TokenType.RIGHT_PAREN)) {
                cursor.reset(beforeOut);
                return Optional.empty();
            }
        }
        // More than one token before ')': a condition without a return binding.
        return Optional.of(new ContractExpression.Out(keyword, Optional.empty(), parseContractParameters(cursor, keyword)));
    }

    private ContractExpression.Invariant parseInvariant(ParsingContext cursor) {
        Token keyword = cursor.advance();
        cursor.advance(); // consume '('
        ContractCondition condition = parseContractParameters(cursor, keyword);
        cursor.consume(TokenType.SEMICOLON, CompilerErrorCode.MISSING_CONTRACT_TERMINATOR,
                Messages.get("contracts.missingInvariantTerminator", describe(cursor.peek())));
        return new ContractExpression.Invariant(keyword, condition);
    }

    /**
     * Parses {@code condition [, message] [,]} and the closing parenthesis.
     */
    private ContractCondition parseContractParameters(ParsingContext cursor, Token keyword) {
        ExpressionParser expressionParser = new ExpressionParser(cursor);
        if (!expressionParser.atExpressionStart()) {
            throw malformed(Messages.get("contracts.missingCondition", keyword.text(), describe(cursor.peek())), cursor.peek());
        }
        ExpressionNode condition = expressionParser.parseAssignExpression();
        Optional<ExpressionNode> message = Optional.empty();

        if (cursor.match(TokenType.COMMA)) {
            if (cursor.check(TokenType.RIGHT_PAREN)) {
                requireTrailingCommaAllowed(cursor.previous());
            } else {
                if (!expressionParser.atExpressionStart()) {
                    throw malformed(Messages.get("contracts.missingMessage", keyword.text(), describe(cursor.peek())),
                            cursor.peek());
                }
                message = Optional.of(expressionParser.parseAssignExpression());
                if (cursor.match(TokenType.COMMA)) {
                    if (!cursor.check(TokenType.RIGHT_PAREN)) {
                        throw malformed(Messages.get("contracts.tooManyParameters", keyword.text()), cursor.peek());
                    }
                    requireTrailingCommaAllowed(cursor.previous());
                }
            }
        }

        if (!cursor.check(TokenType.RIGHT_PAREN)) {
            throw malformed(Messages.get("contracts.unexpectedAfterParameters", describe(cursor.peek()), keyword.text()),
                    cursor.peek());
        }
        cursor.advance();
        return new ContractCondition(condition, message);
    }

    private void requireTrailingCommaAllowed(Token comma) {
        if (!options.allowTrailingComma()) {
            throw malformed(Messages.get("contracts.trailingComma"), comma);
        }
    }

    private static boolean atBodyOpener(ParsingContext cursor) {
        return cursor.check(TokenType.LEFT_BRACE) || cursor.checkKeyword("do") || cursor.checkKeyword("body");
    }

    private static ContractParseError malformed(String message, Token at) {
        return new ContractParseError(CompilerErrorCode.MALFORMED_CONTRACT_PARAMETERS, message, at);
    }

    private static String describe(Token token) {
        return token.type() == TokenType.END_OF_FILE ? "end of file" : token.text();
    }
}
