package org.contractexpr.compiler.frontend.contracts;

/**
 * Where the recognizer is invoked.
 */
public enum ContractContext {
    /** After the parameter list of a function that may have a body. */
    FUNCTION,
    /** After the parameter list of an interface or abstract member, which usually has no body. */
    INTERFACE,
    /** At member position inside a class or struct body, where invariants are declared. */
    AGGREGATE
}
