package org.contractexpr.compiler.frontend.lowering;

import org.contractexpr.compiler.frontend.parser.ast.AssertStatementNode;
import org.contractexpr.compiler.frontend.parser.ast.AssignExpressionNode;
import org.contractexpr.compiler.frontend.parser.ast.BinaryExpressionNode;
import org.contractexpr.compiler.frontend.parser.ast.BlockStatementNode;
import org.contractexpr.compiler.frontend.parser.ast.CallExpressionNode;
import org.contractexpr.compiler.frontend.parser.ast.ConditionalExpressionNode;
import org.contractexpr.compiler.frontend.parser.ast.EmptyStatementNode;
import org.contractexpr.compiler.frontend.parser.ast.ExpressionNode;
import org.contractexpr.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.contractexpr.compiler.frontend.parser.ast.IdentifierNode;
import org.contractexpr.compiler.frontend.parser.ast.IfStatementNode;
import org.contractexpr.compiler.frontend.parser.ast.IndexExpressionNode;
import org.contractexpr.compiler.frontend.parser.ast.LiteralNode;
import org.contractexpr.compiler.frontend.parser.ast.MemberAccessNode;
import org.contractexpr.compiler.frontend.parser.ast.ParenthesizedNode;
import org.contractexpr.compiler.frontend.parser.ast.StatementNode;
import org.contractexpr.compiler.frontend.parser.ast.UnaryExpressionNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders lowered contracts, statements and expressions back to canonical source text.
 * Printing a lowered contract and running the text through the engine again reproduces
 * the same text.
 */
public final class SourcePrinter {

    private SourcePrinter() {}

    /**
     * Prints a contract on one line, e.g. {@code out(r) { assert(r > 0); }}.
     * @param contract The lowered contract.
     * @return The source text.
     */
    public static String print(LoweredContract contract) {
        StringBuilder sb = new StringBuilder(contract.kind().keyword());
        contract.returnIdentifier().ifPresent(id -> sb.append('(').append(id.text()).append(')'));
        sb.append(" {");
        for (StatementNode statement : contract.body()) {
            sb.append(' ').append(print(statement));
        }
        return sb.append(" }").toString();
    }

    /**
     * Prints several contracts separated by newlines.
     * @param contracts The contracts.
     * @return The source text.
     */
    public static String printAll(List<LoweredContract> contracts) {
        return contracts.stream().map(SourcePrinter::print).collect(Collectors.joining("\n"));
    }

    /**
     * Prints a statement on one line.
     * @param statement The statement.
     * @return The source text.
     */
    public static String print(StatementNode statement) {
        if (statement instanceof AssertStatementNode a) {
            String message = a.message().map(m -> ", " + print(m)).orElse("");
            return a.keyword().text() + "(" + print(a.condition()) + message + ");";
        } else if (statement instanceof ExpressionStatementNode e) {
            return print(e.expression()) + ";";
        } else if (statement instanceof BlockStatementNode b) {
            if (b.statements().isEmpty()) return "{ }";
            return b.statements().stream().map(SourcePrinter::print).collect(Collectors.joining(" ", "{ ", " }"));
        } else if (statement instanceof IfStatementNode i) {
            String elsePart = i.elseBranch().map(s -> " else " + print(s)).orElse("");
            return "if (" + print(i.condition()) + ") " + print(i.thenBranch()) + elsePart;
        } else if (statement instanceof EmptyStatementNode) {
            return ";";
        }
        throw new IllegalArgumentException("Unknown statement node: " + statement.getClass().getName());
    }

    /**
     * Prints an expression with single spaces around binary operators.
     * @param expression The expression.
     * @return The source text.
     */
    public static String print(ExpressionNode expression) {
        if (expression instanceof IdentifierNode id) {
            return id.identifierToken().text();
        } else if (expression instanceof LiteralNode lit) {
            return lit.literalToken().text();
        } else if (expression instanceof UnaryExpressionNode u) {
            String operand = print(u.operand());
            if (u.postfix()) {
                return operand + u.operator().text();
            }
            // "- -a" must not print as "--a".
            String op = u.operator().text();
            boolean separate = !operand.isEmpty() && "+-&*!~".indexOf(operand.charAt(0)) >= 0;
            return separate ? op + " " + operand : op + operand;
        } else if (expression instanceof BinaryExpressionNode b) {
            return print(b.left()) + " " + b.operator().text() + " " + print(b.right());
        } else if (expression instanceof ConditionalExpressionNode c) {
            return print(c.condition()) + " ? " + print(c.thenBranch()) + " : " + print(c.elseBranch());
        } else if (expression instanceof AssignExpressionNode a) {
            return print(a.target()) + " " + a.operator().text() + " " + print(a.value());
        } else if (expression instanceof CallExpressionNode call) {
            return print(call.callee()) + "(" + printList(call.arguments()) + ")";
        } else if (expression instanceof IndexExpressionNode idx) {
            return print(idx.target()) + "[" + printList(idx.indices()) + "]";
        } else if (expression instanceof MemberAccessNode m) {
            return print(m.target()) + "." + m.member().text();
        } else if (expression instanceof ParenthesizedNode p) {
            return "(" + print(p.inner()) + ")";
        }
        throw new IllegalArgumentException("Unknown expression node: " + expression.getClass().getName());
    }

    private static String printList(List<ExpressionNode> expressions) {
        return expressions.stream().map(SourcePrinter::print).collect(Collectors.joining(", "));
    }
}
