package org.contractexpr.compiler.frontend.contracts;

import org.contractexpr.compiler.frontend.parser.ast.ExpressionNode;

import java.util.Optional;

/**
 * One ContractParameters group: a condition and an optional message.
 *
 * @param condition The boolean condition.
 * @param message The message, passed unchanged to the synthesized assert.
 */
public record ContractCondition(ExpressionNode condition, Optional<ExpressionNode> message) {
}
