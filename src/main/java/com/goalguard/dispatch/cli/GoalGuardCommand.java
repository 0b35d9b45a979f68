package com.goalguard.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for GoalGuard.
 * Routes to subcommands: run, transitions, windows.
 */
@Command(
        name = "goalguard",
        mixinStandardHelpOptions = true,
        version = "GoalGuard 0.1.0",
        description = "Gated strategy development with walk-forward validation and reflexion",
        subcommands = {
                RunCommand.class,
                TransitionsCommand.class,
                WindowsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class GoalGuardCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
