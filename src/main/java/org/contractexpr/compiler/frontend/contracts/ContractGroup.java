package org.contractexpr.compiler.frontend.contracts;

import java.util.ArrayList;
import java.util.List;

/**
 * The contracts attached to one declarator, in encounter order: the expression-form
 * contracts and the legacy blocks that followed them. A group is immutable and is
 * discarded once lowered.
 */
public final class ContractGroup {

    private static final ContractGroup EMPTY = new ContractGroup(List.of(), List.of(), false);

    private final List<ContractExpression> expressions;
    private final List<LegacyContractBlock> legacyBlocks;
    private final boolean terminated;

    /**
     * Creates a group.
     * @param expressions The contract expressions in encounter order.
     * @param legacyBlocks The legacy blocks in encounter order.
     * @param terminated true if the recognizer consumed the {@code ;} that ends a body-less declaration.
     */
    public ContractGroup(List<ContractExpression> expressions, List<LegacyContractBlock> legacyBlocks, boolean terminated) {
        this.expressions = List.copyOf(expressions);
        this.legacyBlocks = List.copyOf(legacyBlocks);
        this.terminated = terminated;
    }

    /**
     * @return A group without any contracts.
     */
    public static ContractGroup empty() {
        return EMPTY;
    }

    /**
     * Wraps already-legacy blocks, e.g. to feed lowered contracts through the engine again.
     * @param blocks The blocks.
     * @return A group holding only those blocks.
     */
    public static ContractGroup ofLegacy(List<LegacyContractBlock> blocks) {
        return new ContractGroup(List.of(), blocks, false);
    }

    /**
     * Appends another group's contracts after this group's, kind by kind.
     * Used for aggregates, whose invariants may be spread across the body.
     * @param other The group to append.
     * @return A new group.
     */
    public ContractGroup concat(ContractGroup other) {
        List<ContractExpression> mergedExpressions = new ArrayList<>(expressions);
        mergedExpressions.addAll(other.expressions);
        List<LegacyContractBlock> mergedBlocks = new ArrayList<>(legacyBlocks);
        mergedBlocks.addAll(other.legacyBlocks);
        return new ContractGroup(mergedExpressions, mergedBlocks, terminated || other.terminated);
    }

    public List<ContractExpression> getExpressions() {
        return expressions;
    }

    public List<LegacyContractBlock> getLegacyBlocks() {
        return legacyBlocks;
    }

    /**
     * @param kind The contract kind.
     * @return The expressions of that kind in encounter order.
     */
    public List<ContractExpression> expressionsOf(ContractKind kind) {
        return expressions.stream().filter(e -> e.kind() == kind).toList();
    }

    /**
     * @param kind The contract kind.
     * @return The legacy blocks of that kind in encounter order.
     */
    public List<LegacyContractBlock> legacyBlocksOf(ContractKind kind) {
        return legacyBlocks.stream().filter(b -> b.kind() == kind).toList();
    }

    public boolean isTerminated() {
        return terminated;
    }

    public boolean isEmpty() {
        return expressions.isEmpty() && legacyBlocks.isEmpty();
    }

    @Override
    public String toString() {
        return "ContractGroup{expressions=" + expressions.size() + ", legacyBlocks=" + legacyBlocks.size()
                + ", terminated=" + terminated + "}";
    }
}
