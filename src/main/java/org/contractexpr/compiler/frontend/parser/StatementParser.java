package org.contractexpr.compiler.frontend.parser;

import org.contractexpr.compiler.api.CompilerErrorCode;
import org.contractexpr.compiler.frontend.lexer.Token;
import org.contractexpr.compiler.frontend.lexer.TokenType;
import org.contractexpr.compiler.frontend.parser.ast.AssertStatementNode;
import org.contractexpr.compiler.frontend.parser.ast.BlockStatementNode;
import org.contractexpr.compiler.frontend.parser.ast.EmptyStatementNode;
import org.contractexpr.compiler.frontend.parser.ast.ExpressionNode;
import org.contractexpr.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.contractexpr.compiler.frontend.parser.ast.IfStatementNode;
import org.contractexpr.compiler.frontend.parser.ast.StatementNode;
import org.contractexpr.compiler.internal.i18n.Messages;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses the statements allowed inside braced contract blocks: {@code assert(...)},
 * expression statements, {@code if}/{@code else}, nested blocks and empty statements.
 */
public class StatementParser {

    private final ParsingContext context;
    private final ExpressionParser expressions;

    /**
     * Creates a statement parser reading from the given cursor.
     * @param context The shared cursor.
     */
    public StatementParser(ParsingContext context) {
        this.context = context;
        this.expressions = new ExpressionParser(context);
    }

    /**
     * Parses {@code { statement* }}. The cursor must be at the opening brace.
     * @return The statements inside the block, in order.
     * @throws ContractParseError on malformed input or a missing closing brace.
     */
    public List<StatementNode> parseBlock() {
        context.consume(TokenType.LEFT_BRACE, CompilerErrorCode.UNEXPECTED_TOKEN,
                Messages.get("parser.expectedBlock", ExpressionParser.describe(context.peek())));
        List<StatementNode> statements = new ArrayList<>();
        while (!context.check(TokenType.RIGHT_BRACE)) {
            if (context.isAtEnd()) {
                throw new ContractParseError(CompilerErrorCode.UNEXPECTED_TOKEN,
                        Messages.get("parser.unclosedBlock"), context.peek());
            }
            statements.add(parseStatement());
        }
        context.advance(); // consume '}'
        return statements;
    }

    /**
     * Parses a single statement.
     * @return The statement.
     */
    public StatementNode parseStatement() {
        if (context.check(TokenType.LEFT_BRACE)) {
            return new BlockStatementNode(parseBlock());
        }
        if (context.check(TokenType.SEMICOLON)) {
            return new EmptyStatementNode(context.advance());
        }
        if (context.checkKeyword("assert") && context.checkNext(TokenType.LEFT_PAREN)) {
            return parseAssert();
        }
        if (context.checkKeyword("if") && context.checkNext(TokenType.LEFT_PAREN)) {
            return parseIf();
        }
        ExpressionNode expression = expressions.parseAssignExpression();
        expectSemicolon();
        return new ExpressionStatementNode(expression);
    }

    private StatementNode parseAssert() {
        Token keyword = context.advance();
        context.advance(); // consume '('
        ExpressionNode condition = expressions.parseAssignExpression();
        Optional<ExpressionNode> message = Optional.empty();
        if (context.match(TokenType.COMMA) && !context.check(TokenType.RIGHT_PAREN)) {
            message = Optional.of(expressions.parseAssignExpression());
            context.match(TokenType.COMMA);
        }
        context.consume(TokenType.RIGHT_PAREN, CompilerErrorCode.UNEXPECTED_TOKEN,
                Messages.get("parser.expectedClosing", "')'", ExpressionParser.describe(context.peek())));
        expectSemicolon();
        return new AssertStatementNode(keyword, condition, message);
    }

    private StatementNode parseIf() {
        Token keyword = context.advance();
        context.advance(); // consume '('
        ExpressionNode condition = expressions.parseAssignExpression();
        context.consume(TokenType.RIGHT_PAREN, CompilerErrorCode.UNEXPECTED_TOKEN,
                Messages.get("parser.expectedClosing", "')'", ExpressionParser.describe(context.peek())));
        StatementNode thenBranch = parseStatement();
        Optional<StatementNode> elseBranch = Optional.empty();
        if (context.checkKeyword("else")) {
            context.advance();
            elseBranch = Optional.of(parseStatement());
        }
        return new IfStatementNode(keyword, condition, thenBranch, elseBranch);
    }

    private void expectSemicolon() {
        context.consume(TokenType.SEMICOLON, CompilerErrorCode.UNEXPECTED_TOKEN,
                Messages.get("parser.expectedSemicolon", ExpressionParser.describe(context.peek())));
    }
}
