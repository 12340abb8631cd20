package com.stagegate.dispatch.cli;

import com.stagegate.core.engine.PipelineOrchestrator;
import com.stagegate.core.events.EventBus;
import com.stagegate.core.health.StartupFailedException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: stagegate resume &lt;runId&gt;
 */
@Command(name = "resume", mixinStandardHelpOptions = true,
        description = "Resume an aborted run from its last checkpoint")
@Component
public class ResumeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Run id, e.g. 20250101_120000_1a2b3c4d")
    private String runId;

    @Option(names = "--run-root", description = "Directory that holds run directories")
    private Path runRoot;

    private final PipelineOrchestrator orchestrator;
    private final EventBus eventBus;

    public ResumeCommand(PipelineOrchestrator orchestrator, EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        Path root = runRoot != null ? runRoot : orchestrator.runRoot();
        var subscription = eventBus.subscribe(runId, ConsoleOutput::watchEvent);
        try {
            return RunResultPrinter.print(orchestrator.resume(runId, root));
        } catch (StartupFailedException e) {
            ConsoleOutput.error(e.getMessage());
            return RunResultPrinter.EXIT_STARTUP_FAILED;
        } catch (RuntimeException e) {
            ConsoleOutput.error("Resume failed: " + e.getMessage());
            return RunResultPrinter.EXIT_ABORTED;
        } finally {
            subscription.unsubscribe();
        }
    }
}
