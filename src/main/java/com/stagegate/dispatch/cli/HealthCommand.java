package com.stagegate.dispatch.cli;

import com.stagegate.core.health.StartupValidator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: stagegate health
 * <p>
 * Runs the startup probes without creating a run and prints one line per component.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check dependencies, memory and scheduler")
@Component
public class HealthCommand implements Callable<Integer> {

    private final StartupValidator startupValidator;

    public HealthCommand(@Autowired(required = false) StartupValidator startupValidator) {
        this.startupValidator = startupValidator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (startupValidator == null) {
            ConsoleOutput.error("Startup validator not available");
            return 1;
        }

        var checks = startupValidator.checkAll();
        boolean allUp = true;

        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
                case DEGRADED -> {
                    ConsoleOutput.info(label);
                    allUp = false;
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: ready to run");
            return 0;
        }
        ConsoleOutput.error("Overall: one or more components down");
        return 1;
    }
}
