package com.stagegate.dispatch.cli;

import com.stagegate.core.config.StageGateProperties;
import com.stagegate.core.engine.PipelineOrchestrator;
import com.stagegate.core.engine.RunOutcome;
import com.stagegate.core.events.EventBus;
import com.stagegate.core.health.StartupFailedException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: stagegate run --objective "&lt;text&gt;" --plan plan.json
 * <p>
 * Starts a run, streams progress events and exits with 0 on COMPLETE, 1 on ABORTED
 * and 2 when the startup checks fail.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Start a gated workflow run")
@Component
public class RunCommand implements Callable<Integer> {

    @Option(names = {"--objective", "-o"}, required = true, description = "User objective for the run")
    private String objective;

    @Option(names = {"--plan", "-p"}, description = "Plan file (JSON task list)")
    private String planFile;

    @Option(names = "--auto-approve", description = "Accept the plan without asking")
    private boolean autoApprove;

    @Option(names = "--run-root", description = "Directory that holds run directories")
    private Path runRoot;

    private final PipelineOrchestrator orchestrator;
    private final StageGateProperties properties;
    private final EventBus eventBus;

    public RunCommand(PipelineOrchestrator orchestrator, StageGateProperties properties, EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (planFile != null) {
            properties.getPlan().setFile(planFile);
        }
        if (autoApprove) {
            properties.getPlan().setAutoApprove(true);
        }
        Path root = runRoot != null ? runRoot : orchestrator.runRoot();
        String runId = orchestrator.newRunId();
        ConsoleOutput.info("Run " + runId + ": " + objective);

        var subscription = eventBus.subscribe(runId, ConsoleOutput::watchEvent);
        try {
            RunOutcome outcome = orchestrator.run(runId, objective, root);
            return RunResultPrinter.print(outcome);
        } catch (StartupFailedException e) {
            ConsoleOutput.error(e.getMessage());
            e.checks().stream().filter(c -> !c.isUp())
                    .forEach(c -> ConsoleOutput.error("  " + c.component() + ": " + c.detail()));
            return RunResultPrinter.EXIT_STARTUP_FAILED;
        } catch (RuntimeException e) {
            ConsoleOutput.error("Run failed: " + e.getMessage());
            return RunResultPrinter.EXIT_ABORTED;
        } finally {
            subscription.unsubscribe();
        }
    }
}
