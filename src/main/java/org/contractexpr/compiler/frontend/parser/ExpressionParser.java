package org.contractexpr.compiler.frontend.parser;

import org.contractexpr.compiler.api.CompilerErrorCode;
import org.contractexpr.compiler.frontend.lexer.Token;
import org.contractexpr.compiler.frontend.lexer.TokenType;
import org.contractexpr.compiler.frontend.parser.ast.AssignExpressionNode;
import org.contractexpr.compiler.frontend.parser.ast.BinaryExpressionNode;
import org.contractexpr.compiler.frontend.parser.ast.CallExpressionNode;
import org.contractexpr.compiler.frontend.parser.ast.ConditionalExpressionNode;
import org.contractexpr.compiler.frontend.parser.ast.ExpressionNode;
import org.contractexpr.compiler.frontend.parser.ast.IdentifierNode;
import org.contractexpr.compiler.frontend.parser.ast.IndexExpressionNode;
import org.contractexpr.compiler.frontend.parser.ast.LiteralNode;
import org.contractexpr.compiler.frontend.parser.ast.MemberAccessNode;
import org.contractexpr.compiler.frontend.parser.ast.ParenthesizedNode;
import org.contractexpr.compiler.frontend.parser.ast.UnaryExpressionNode;
import org.contractexpr.compiler.internal.i18n.Messages;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for AssignExpressions, the argument form of contract
 * parameters and assert calls.
 * <p>
 * Precedence, lowest first: assignment (right associative), conditional, {@code ||},
 * {@code &&}, {@code |}, {@code ^}, {@code &}, equality, relational, shift, additive
 * (including {@code ~} concatenation), multiplicative, prefix unary, postfix.
 */
public class ExpressionParser {

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
            "=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "~=", "<<=", ">>=", ">>>=");
    private static final Set<String> PREFIX_OPERATORS = Set.of("!", "-", "+", "~", "++", "--", "*", "&");

    /** Binary operator levels, lowest precedence first. All are left associative. */
    private static final List<Set<String>> BINARY_LEVELS = List.of(
            Set.of("||"),
            Set.of("&&"),
            Set.of("|"),
            Set.of("^"),
            Set.of("&"),
            Set.of("==", "!="),
            Set.of("<", "<=", ">", ">="),
            Set.of("<<", ">>", ">>>"),
            Set.of("+", "-", "~"),
            Set.of("*", "/", "%")
    );

    private final ParsingContext context;

    /**
     * Creates an expression parser reading from the given cursor.
     * @param context The shared cursor. The expression parser advances it.
     */
    public ExpressionParser(ParsingContext context) {
        this.context = context;
    }

    /**
     * Parses one AssignExpression.
     * @return The parsed expression.
     * @throws ContractParseError if the tokens do not form an expression.
     */
    public ExpressionNode parseAssignExpression() {
        ExpressionNode target = parseConditional();
        Token op = context.peek();
        if (op.type() == TokenType.OPERATOR && ASSIGNMENT_OPERATORS.contains(op.text())) {
            context.advance();
            ExpressionNode value = parseAssignExpression();
            return new AssignExpressionNode(target, op, value);
        }
        return target;
    }

    /**
     * Checks whether the current token can start an expression. Used by callers that
     * must tell an empty parameter list apart from a malformed one.
     * @return true if {@link #parseAssignExpression()} could succeed here.
     */
    public boolean atExpressionStart() {
        Token token = context.peek();
        return switch (token.type()) {
            case IDENTIFIER, NUMBER, STRING, CHARACTER, LEFT_PAREN -> true;
            case OPERATOR -> PREFIX_OPERATORS.contains(token.text());
            default -> false;
        };
    }

    private ExpressionNode parseConditional() {
        ExpressionNode condition = parseBinary(0);
        if (context.peek().isOperator("?")) {
            context.advance();
            ExpressionNode thenBranch = parseAssignExpression();
            expectOperator(":");
            ExpressionNode elseBranch = parseConditional();
            return new ConditionalExpressionNode(condition, thenBranch, elseBranch);
        }
        return condition;
    }

    private ExpressionNode parseBinary(int level) {
        if (level >= BINARY_LEVELS.size()) {
            return parseUnary();
        }
        ExpressionNode left = parseBinary(level + 1);
        Set<String> operators = BINARY_LEVELS.get(level);
        while (context.check(TokenType.OPERATOR) && operators.contains(context.peek().text())) {
            Token op = context.advance();
            ExpressionNode right = parseBinary(level + 1);
            left = new BinaryExpressionNode(left, op, right);
        }
        return left;
    }

    private ExpressionNode parseUnary() {
        Token token = context.peek();
        if (token.type() == TokenType.OPERATOR && PREFIX_OPERATORS.contains(token.text())) {
            context.advance();
            return new UnaryExpressionNode(token, parseUnary(), false);
        }
        return parsePostfix(parsePrimary());
    }

    private ExpressionNode parsePostfix(ExpressionNode expression) {
        while (true) {
            if (context.match(TokenType.LEFT_PAREN)) {
                List<ExpressionNode> arguments = parseArgumentList(TokenType.RIGHT_PAREN, "')'");
                expression = new CallExpressionNode(expression, arguments);
            } else if (context.match(TokenType.LEFT_BRACKET)) {
                List<ExpressionNode> indices = parseArgumentList(TokenType.RIGHT_BRACKET, "']'");
                expression = new IndexExpressionNode(expression, indices);
            } else if (context.peek().isOperator(".")) {
                context.advance();
                Token member = context.consume(TokenType.IDENTIFIER, CompilerErrorCode.UNEXPECTED_TOKEN,
                        Messages.get("parser.expectedMemberName", context.peek().text()));
                expression = new MemberAccessNode(expression, member);
            } else if (context.peek().isOperator("++") || context.peek().isOperator("--")) {
                expression = new UnaryExpressionNode(context.advance(), expression, true);
            } else {
                return expression;
            }
        }
    }

    private List<ExpressionNode> parseArgumentList(TokenType closing, String closingText) {
        List<ExpressionNode> arguments = new ArrayList<>();
        if (!context.check(closing)) {
            do {
                if (context.check(closing)) break; // trailing comma
                arguments.add(parseAssignExpression());
            } while (context.match(TokenType.COMMA));
        }
        context.consume(closing, CompilerErrorCode.UNEXPECTED_TOKEN,
                Messages.get("parser.expectedClosing", closingText, context.peek().text()));
        return arguments;
    }

    private ExpressionNode parsePrimary() {
        Token token = context.peek();
        switch (token.type()) {
            case IDENTIFIER:
                context.advance();
                return new IdentifierNode(token);
            case NUMBER:
            case STRING:
            case CHARACTER:
                context.advance();
                return new LiteralNode(token);
            case LEFT_PAREN: {
                context.advance();
                ExpressionNode inner = parseAssignExpression();
                context.consume(TokenType.RIGHT_PAREN, CompilerErrorCode.UNEXPECTED_TOKEN,
                        Messages.get("parser.expectedClosing", "')'", context.peek().text()));
                return new ParenthesizedNode(token, inner);
            }
            default:
                throw new ContractParseError(CompilerErrorCode.UNEXPECTED_TOKEN,
                        Messages.get("parser.unexpectedInExpression", describe(token)), token);
        }
    }

    private void expectOperator(String operator) {
        Token token = context.peek();
        if (!token.isOperator(operator)) {
            throw new ContractParseError(CompilerErrorCode.UNEXPECTED_TOKEN,
                    Messages.get("parser.expectedOperator", operator, describe(token)), token);
        }
        context.advance();
    }

    static String describe(Token token) {
        return token.type() == TokenType.END_OF_FILE ? "end of file" : token.text();
    }
}
