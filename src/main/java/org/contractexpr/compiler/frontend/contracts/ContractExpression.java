package org.contractexpr.compiler.frontend.contracts;

import org.contractexpr.compiler.frontend.lexer.Token;

import java.util.Optional;

/**
 * A contract written in the parenthesized expression form. The set of forms is closed;
 * the lowering step handles each of them explicitly.
 */
public sealed interface ContractExpression permits ContractExpression.In, ContractExpression.Out, ContractExpression.Invariant {

    /**
     * @return The keyword token that introduced the expression.
     */
    Token keyword();

    /**
     * @return The condition and optional message.
     */
    ContractCondition condition();

    /**
     * @return The kind of contract this expression lowers into.
     */
    ContractKind kind();

    /**
     * {@code in(condition, message?)}.
     * @param keyword The {@code in} token.
     * @param condition The condition and message.
     */
    record In(Token keyword, ContractCondition condition) implements ContractExpression {
        @Override
        public ContractKind kind() {
            return ContractKind.IN;
        }
    }

    /**
     * {@code out(; condition, message?)} or {@code out(binding; condition, message?)}, or
     * {@code out(condition, message?)} when the condition is more than a single identifier.
     * @param keyword The {@code out} token.
     * @param returnBinding The identifier naming the return value, if declared.
     * @param condition The condition and message.
     */
    record Out(Token keyword, Optional<Token> returnBinding, ContractCondition condition) implements ContractExpression {
        @Override
        public ContractKind kind() {
            return ContractKind.OUT;
        }
    }

    /**
     * {@code invariant(condition, message?);} at aggregate scope.
     * @param keyword The {@code invariant} token.
     * @param condition The condition and message.
     */
    record Invariant(Token keyword, ContractCondition condition) implements ContractExpression {
        @Override
        public ContractKind kind() {
            return ContractKind.INVARIANT;
        }
    }
}
