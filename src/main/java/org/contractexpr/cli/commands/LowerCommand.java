package org.contractexpr.cli.commands;

import com.typesafe.config.ConfigException;
import org.contractexpr.cli.CommandLineInterface;
import org.contractexpr.compiler.api.CompilationException;
import org.contractexpr.compiler.api.ContractCompiler;
import org.contractexpr.compiler.api.LoweringResult;
import org.contractexpr.compiler.diagnostics.CompilerLogger;
import org.contractexpr.compiler.diagnostics.Diagnostic;
import org.contractexpr.compiler.frontend.declaration.AggregateDeclarationNode;
import org.contractexpr.compiler.frontend.declaration.DeclarationNode;
import org.contractexpr.compiler.frontend.declaration.FunctionDeclarationNode;
import org.contractexpr.compiler.frontend.lowering.LoweredContract;
import org.contractexpr.compiler.frontend.lowering.SourcePrinter;
import org.contractexpr.config.ContractOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "lower",
    description = "Lowers the contracts of every declaration in a source file and prints them in block form."
)
public class LowerCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(LowerCommand.class);

    /** Exit code when the source has contract errors. */
    public static final int EXIT_DIAGNOSTICS = 1;
    /** Exit code when the source or configuration cannot be read. */
    public static final int EXIT_IO_ERROR = 2;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "The source file to lower.")
    private Path file;

    @Option(names = {"-v", "--verbose"}, description = "Increase log verbosity (repeatable).")
    private boolean[] verbose = new boolean[0];

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final ContractOptions options;
        try {
            options = parent.getOptions();
        } catch (ConfigException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_IO_ERROR;
        }
        CompilerLogger.setLevel(options.verbosity() + verbose.length);

        try {
            LoweringResult result = new ContractCompiler(options).lower(file);
            for (Diagnostic warning : result.diagnostics()) {
                err.println(warning);
            }
            for (DeclarationNode declaration : result.declarations()) {
                print(out, declaration, "");
            }
            out.flush();
            return 0;
        } catch (CompilationException e) {
            LOGGER.debug("Lowering of {} failed with {} diagnostic(s)", file, e.getDiagnostics().size());
            err.println(e.getMessage());
            return EXIT_DIAGNOSTICS;
        } catch (IOException e) {
            err.println("Could not read " + file + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }
    }

    private void print(PrintWriter out, DeclarationNode declaration, String indent) {
        if (declaration instanceof FunctionDeclarationNode function) {
            out.println(indent + function.name().text() + "()" + (function.hasBody() ? "" : ";"));
            for (LoweredContract contract : function.contracts()) {
                out.println(indent + "    " + SourcePrinter.print(contract));
            }
        } else if (declaration instanceof AggregateDeclarationNode aggregate) {
            out.println(indent + aggregate.keyword().text() + " " + aggregate.name().text());
            for (LoweredContract invariant : aggregate.invariants()) {
                out.println(indent + "    " + SourcePrinter.print(invariant));
            }
            for (DeclarationNode member : aggregate.members()) {
                print(out, member, indent + "    ");
            }
        }
    }
}
