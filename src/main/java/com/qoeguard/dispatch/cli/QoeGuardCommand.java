package com.qoeguard.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for qoe-guard.
 * Routes to subcommands: validate, batch, policy.
 */
@Command(
        name = "qoe-guard",
        mixinStandardHelpOptions = true,
        version = "qoe-guard 0.1.0",
        exitCodeOnInvalidInput = ExitCodes.ERROR,
        exitCodeOnExecutionException = ExitCodes.ERROR,
        description = "Validate API responses against a baseline and gate releases on QoE risk",
        footer = {
                "",
                "Exit codes:",
                "  0 = PASS (safe to deploy)",
                "  1 = WARN (review recommended)",
                "  2 = FAIL (do not deploy)",
                "  3 = ERROR (validation could not run)"
        },
        subcommands = {
                ValidateCommand.class,
                BatchCommand.class,
                PolicyCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class QoeGuardCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
