package org.contractexpr.compiler.frontend.parser.ast;

/**
 * A statement inside a braced contract block. Lowered contracts consist only of statements.
 */
public sealed interface StatementNode extends AstNode
        permits AssertStatementNode, ExpressionStatementNode, BlockStatementNode, IfStatementNode, EmptyStatementNode {
}
