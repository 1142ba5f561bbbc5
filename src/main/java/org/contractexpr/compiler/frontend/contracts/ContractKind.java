package org.contractexpr.compiler.frontend.contracts;

/**
 * The fixed set of contract kinds. Lowered contracts are emitted in declaration order of this enum.
 */
public enum ContractKind {
    /** A precondition, {@code in}. */
    IN("in"),
    /** A postcondition, {@code out}. */
    OUT("out"),
    /** An aggregate invariant, {@code invariant}. */
    INVARIANT("invariant");

    private final String keyword;

    ContractKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return The source keyword introducing this kind of contract.
     */
    public String keyword() {
        return keyword;
    }
}
