package org.contractexpr.cli;

import com.typesafe.config.ConfigException;
import org.contractexpr.cli.commands.LowerCommand;
import org.contractexpr.config.ConfigLoader;
import org.contractexpr.config.ContractOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "contractc",
    mixinStandardHelpOptions = true,
    version = "contractc 1.0",
    description = "Lowers contract expressions (in(...), out(...), invariant(...)) into contract blocks",
    subcommands = {
        LowerCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private ContractOptions options;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("contractc");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the options on first use, honoring {@code --config}.
     * @return The contract options.
     * @throws ConfigException if the configuration cannot be parsed or lacks a required key.
     */
    public ContractOptions getOptions() {
        if (options == null) {
            if (configFile != null && !configFile.exists()) {
                LOG.warn("Configuration file specified via --config was not found: {}", configFile.getAbsolutePath());
            }
            options = ConfigLoader.loadOptions(configFile);
        }
        return options;
    }
}
