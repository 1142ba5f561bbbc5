package org.contractexpr.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link ConfigLoader} and the typed {@link ContractOptions} view.
 */
public class ConfigLoaderTest {

    /**
     * Verifies that reference.conf supplies the same values as {@link ContractOptions#defaults()}.
     */
    @Test
    @Tag("unit")
    void testReferenceDefaults(@TempDir Path tempDir) {
        // Arrange
        File missing = tempDir.resolve("absent.conf").toFile();

        // Act
        ContractOptions options = ConfigLoader.loadOptions(missing);

        // Assert
        assertThat(options).isEqualTo(ContractOptions.defaults());
    }

    /**
     * Verifies that an explicit file overrides individual keys and keeps the rest.
     */
    @Test
    @Tag("unit")
    void testFileOverridesDefaults(@TempDir Path tempDir) throws Exception {
        // Arrange
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "contracts.lowering.assert-function = check\ncontracts.parser.allow-trailing-comma = false\n");

        // Act
        ContractOptions options = ConfigLoader.loadOptions(file.toFile());

        // Assert
        assertThat(options.assertFunction()).isEqualTo("check");
        assertThat(options.allowTrailingComma()).isFalse();
        assertThat(options.verbosity()).isEqualTo(2);
    }

    /**
     * Verifies that a configuration lacking a key fails with the typesafe-config exception.
     */
    @Test
    @Tag("unit")
    void testMissingKeyFails() {
        // Arrange
        Config config = ConfigFactory.parseString("contracts { parser { allow-trailing-comma = true } }");

        // Act & Assert
        assertThatThrownBy(() -> ContractOptions.fromConfig(config))
                .isInstanceOf(ConfigException.Missing.class);
    }

    /**
     * Verifies that a blank assert function name is rejected.
     */
    @Test
    @Tag("unit")
    void testBlankAssertFunctionIsRejected() {
        // Arrange
        Config config = ConfigFactory.parseString("contracts.lowering.assert-function = \" \"")
                .withFallback(ConfigFactory.parseResources("reference.conf"));

        // Act & Assert
        assertThatThrownBy(() -> ContractOptions.fromConfig(config))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
