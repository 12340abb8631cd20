package com.stagegate.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.stagegate.core.config.StageGateProperties;
import com.stagegate.core.engine.RunLayout;
import com.stagegate.core.model.Stage;
import com.stagegate.core.qualitygate.GateDecision;
import com.stagegate.core.qualitygate.GateLog;
import com.stagegate.core.qualitygate.QualityGateEngine;
import com.stagegate.core.store.RecordCodec;
import com.stagegate.core.store.RecordSerializationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: stagegate gate &lt;stage&gt; &lt;outputFile&gt;
 * <p>
 * Evaluates one stage's output outside a run. The exit code is the gate action:
 * 0 PROCEED, 1 REVISE, 2 ESCALATE, 3 STOP; 4 when the input cannot be used.
 */
@Command(name = "gate", mixinStandardHelpOptions = true, description = "Evaluate the quality gate for a stage output")
@Component
public class GateCommand implements Callable<Integer> {

    static final int EXIT_BAD_INPUT = 4;

    @Parameters(index = "0", description = "Stage: PLAN, REVIEW, DISRUPT, IMPLEMENT, TEST, REVIEW_POST, VALIDATE, LEARN")
    private String stage;

    @Parameters(index = "1", description = "JSON file with the stage's output records")
    private Path outputFile;

    @Option(names = "--retry", defaultValue = "0", description = "Retry count of this attempt")
    private int retry;

    @Option(names = "--run-root", description = "Directory whose logs/ receives the gate log")
    private Path runRoot;

    private final QualityGateEngine gateEngine;
    private final RecordCodec codec;
    private final StageGateProperties properties;

    public GateCommand(QualityGateEngine gateEngine, RecordCodec codec, StageGateProperties properties) {
        this.gateEngine = gateEngine;
        this.codec = codec;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        Stage target;
        try {
            target = Stage.fromWireName(stage);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Unknown stage: " + stage);
            return EXIT_BAD_INPUT;
        }
        List<JsonNode> outputs;
        try {
            outputs = codec.readDocuments(outputFile);
        } catch (RecordSerializationException | UncheckedIOException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_BAD_INPUT;
        }

        Path root = runRoot != null ? runRoot : Path.of(properties.getRunRoot());
        GateDecision decision = gateEngine.gate(target, outputs, retry, new GateLog(RunLayout.logs(root), codec));

        try {
            System.out.println(codec.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(decision));
        } catch (JsonProcessingException e) {
            ConsoleOutput.error("Cannot render decision: " + e.getOriginalMessage());
        }
        ConsoleOutput.gate(decision.stageInstance(), decision.action(), decision.errors().size());
        if (decision.report() != null) {
            System.out.println(decision.report());
        }
        return decision.action().exitCode();
    }
}
