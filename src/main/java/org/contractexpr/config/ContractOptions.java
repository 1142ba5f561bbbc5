package org.contractexpr.config;

import com.typesafe.config.Config;

/**
 * Typed view of the {@code contracts} configuration block.
 *
 * @param allowTrailingComma Whether {@code in(a > 0, "msg",)} is accepted.
 * @param assertFunction The name of the call synthesized for every lowered condition.
 * @param verbosity The {@link org.contractexpr.compiler.diagnostics.CompilerLogger} level.
 */
public record ContractOptions(boolean allowTrailingComma, String assertFunction, int verbosity) {

    /** The configuration path holding the options. */
    public static final String CONFIG_PATH = "contracts";

    public ContractOptions {
        if (assertFunction == null || assertFunction.isBlank()) {
            throw new IllegalArgumentException("assertFunction must not be blank");
        }
    }

    /**
     * @return The options used when no configuration is supplied.
     */
    public static ContractOptions defaults() {
        return new ContractOptions(true, "assert", 2);
    }

    /**
     * Reads the options from a resolved configuration.
     * @param config A configuration containing the {@code contracts} block.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a required key is missing or has the wrong type.
     */
    public static ContractOptions fromConfig(Config config) {
        Config contracts = config.getConfig(CONFIG_PATH);
        return new ContractOptions(
                contracts.getBoolean("parser.allow-trailing-comma"),
                contracts.getString("lowering.assert-function"),
                contracts.getInt("diagnostics.verbosity"));
    }
}
