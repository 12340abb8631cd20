package com.stagegate.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for StageGate.
 * Routes to subcommands: run, resume, validate, gate, health.
 */
@Command(
        name = "stagegate",
        mixinStandardHelpOptions = true,
        version = "StageGate 0.1.0",
        description = "Evidence-gated workflow engine",
        subcommands = {
                RunCommand.class,
                ResumeCommand.class,
                ValidateCommand.class,
                GateCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class StageGateCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
