package com.planwatch.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Planwatch.
 * Routes to subcommands: run, report.
 */
@Command(
        name = "planwatch",
        mixinStandardHelpOptions = true,
        version = "Planwatch 0.1.0",
        description = "Dispatches security test workflows and watches the engine reason through them",
        subcommands = {
                RunCommand.class,
                ReportCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PlanwatchCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
