package org.contractexpr.cli;

import org.contractexpr.cli.commands.LowerCommand;
import org.contractexpr.compiler.diagnostics.CompilerLogger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the {@code lower} subcommand through picocli and checks its output and exit codes.
 */
@Tag("unit")
class LowerCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        CompilerLogger.setLevel(CompilerLogger.INFO);
    }

    @Test
    void lower_shouldPrintLoweredContracts() throws Exception {
        final Path source = tempDir.resolve("stack.d");
        Files.writeString(source, String.join("\n",
                "interface Stack {",
                "    int pop() out(r; r != 0);",
                "}",
                "int twice(int a) in(a > 0) in(a < 100, \"too big\") { return 2 * a; }"));

        final int exitCode = commandLine.execute("lower", source.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly(
                "interface Stack",
                "    pop();",
                "        out(r) { assert(r != 0); }",
                "twice()",
                "    in { assert(a > 0); assert(a < 100, \"too big\"); }");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void lower_shouldReturnDiagnosticsExitCodeOnContractErrors() throws Exception {
        final Path source = tempDir.resolve("bad.d");
        Files.writeString(source, "int f(int i) out(i);");

        final int exitCode = commandLine.execute("lower", source.toString());

        assertThat(exitCode).isEqualTo(LowerCommand.EXIT_DIAGNOSTICS);
        assertThat(err.toString()).contains("AMBIGUOUS_OUT_EXPRESSION", "out(; i)");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void lower_shouldReturnIoExitCodeForMissingFile() {
        final int exitCode = commandLine.execute("lower", tempDir.resolve("missing.d").toString());

        assertThat(exitCode).isEqualTo(LowerCommand.EXIT_IO_ERROR);
        assertThat(err.toString()).contains("missing.d");
    }

    @Test
    void lower_shouldHonorConfigFileAndVerbosity() throws Exception {
        final Path config = tempDir.resolve("custom.conf");
        Files.writeString(config, "contracts.lowering.assert-function = verify\n");
        final Path source = tempDir.resolve("f.d");
        Files.writeString(source, "void f(int a) in(a != 0) { }");

        final int exitCode = commandLine.execute("--config", config.toString(), "lower", "-v", "-v", source.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("in { verify(a != 0); }");
        assertThat(CompilerLogger.getLevel()).isEqualTo(CompilerLogger.TRACE);
    }
}
