package org.contractexpr.compiler.frontend.parser.ast;

import org.contractexpr.compiler.frontend.lexer.Token;

/**
 * A lone {@code ;}.
 */
public record EmptyStatementNode(Token semicolon) implements StatementNode {
}
