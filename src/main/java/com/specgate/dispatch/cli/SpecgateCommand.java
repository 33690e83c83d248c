package com.specgate.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Specgate.
 * Routes to subcommands: validate, status, history.
 */
@Command(
        name = "specgate",
        mixinStandardHelpOptions = true,
        version = "Specgate 0.1.0",
        description = "Validates proposal, task and spec documents of a change workflow",
        subcommands = {
                ValidateCommand.class,
                StatusCommand.class,
                HistoryCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SpecgateCommand implements Runnable {

    /** Exit code for a valid instance. */
    public static final int EXIT_VALID = 0;
    /** Exit code when validation found blocking errors. */
    public static final int EXIT_INVALID = 1;
    /** Exit code for usage or I/O failures. */
    public static final int EXIT_FAILURE = 2;

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
