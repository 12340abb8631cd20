package com.stagegate.dispatch.cli;

import com.stagegate.core.RecordFixtures;
import com.stagegate.core.config.StageGateProperties;
import com.stagegate.core.engine.PipelineOrchestrator;
import com.stagegate.core.events.EventBus;
import com.stagegate.core.health.HealthStatus;
import com.stagegate.core.health.StartupFailedException;
import com.stagegate.core.health.StartupValidator;
import com.stagegate.core.model.Stage;
import com.stagegate.core.qualitygate.GateAction;
import com.stagegate.core.qualitygate.GateDecision;
import com.stagegate.core.qualitygate.QualityGateEngine;
import com.stagegate.core.schema.SchemaValidator;
import com.stagegate.core.store.RecordCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the StageGate CLI command structure.
 * These tests exercise picocli directly without Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path dir;

    private final RecordCodec codec = RecordFixtures.codec();
    private QualityGateEngine gateEngine;
    private StartupValidator startupValidator;
    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        gateEngine = mock(QualityGateEngine.class);
        startupValidator = mock(StartupValidator.class);
        orchestrator = mock(PipelineOrchestrator.class);
    }

    /**
     * Custom picocli IFactory that provides mock dependencies for commands.
     */
    private CommandLine.IFactory createFactory() {
        var properties = new StageGateProperties();
        var eventBus = new EventBus();
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ValidateCommand.class) {
                    return (K) new ValidateCommand(new SchemaValidator(), codec);
                }
                if (cls == GateCommand.class) {
                    return (K) new GateCommand(gateEngine, codec, properties);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(startupValidator);
                }
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(orchestrator, properties, eventBus);
                }
                if (cls == ResumeCommand.class) {
                    return (K) new ResumeCommand(orchestrator, eventBus);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new StageGateCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private Path writeFile(String name, String content) throws Exception {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            for (String sub : List.of("run", "resume", "validate", "gate", "health")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "'");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("StageGate 0.1.0"));
        }
    }

    @Nested
    @DisplayName("validate")
    class ValidateTests {

        @Test
        @DisplayName("exits 0 when every record is valid")
        void validRecords() throws Exception {
            Path file = writeFile("evidence.json", codec.toJson(codec.toTrees(List.of(
                    RecordFixtures.evidence("E-IMPLEMENT-20250115-001", "out/a.log", "built"),
                    RecordFixtures.evidence("E-IMPLEMENT-20250115-002", "out/b.log", "tested")))));

            CliResult result = execute("validate", file.toString(), "evidence");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Record #2: valid evidence"));
        }

        @Test
        @DisplayName("exits 1 and lists the errors of an invalid record")
        void invalidRecord() throws Exception {
            Path file = writeFile("evidence.json", "{\"id\": \"E-IMPLEMENT-20250115-001\"}");

            CliResult result = execute("validate", file.toString(), "evidence");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Missing required field: claim"));
        }

        @Test
        @DisplayName("exits 2 on an unknown schema or a missing file")
        void badInput() throws Exception {
            Path file = writeFile("x.json", "{}");

            assertEquals(2, execute("validate", file.toString(), "ticket").exitCode());
            assertEquals(2, execute("validate", dir.resolve("absent.json").toString(), "evidence").exitCode());
        }
    }

    @Nested
    @DisplayName("gate")
    class GateTests {

        private GateDecision decision(Stage stage, GateAction action, String report) {
            return new GateDecision(stage, action, List.of(), List.of("todo"), List.of(), List.of(), 1,
                    RecordFixtures.NOW, report);
        }

        @Test
        @DisplayName("the exit code is the gate action")
        void exitCodeIsAction() throws Exception {
            Path file = writeFile("out.json", "[]");
            when(gateEngine.gate(eq(Stage.REVIEW_POST), anyList(), eq(1), any()))
                    .thenReturn(decision(Stage.REVIEW_POST, GateAction.REVISE, "Fix the review"));

            CliResult result = execute("gate", "review(post)", file.toString(), "--retry", "1",
                    "--run-root", dir.toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("\"stage_instance\" : \"review_post\""));
            assertTrue(result.output().contains("Fix the review"));
        }

        @Test
        @DisplayName("exits 4 on an unknown stage or unreadable output")
        void badInput() throws Exception {
            Path broken = writeFile("broken.json", "{not json");

            assertEquals(4, execute("gate", "DEPLOY", broken.toString()).exitCode());
            assertEquals(4, execute("gate", "TEST", broken.toString()).exitCode());
            assertEquals(4, execute("gate", "TEST", dir.resolve("absent.json").toString()).exitCode());
        }
    }

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("exits 0 when every component is up")
        void allUp() {
            when(startupValidator.checkAll()).thenReturn(List.of(
                    HealthStatus.up("memory", "Key-value store reachable"),
                    HealthStatus.up("scheduler", "Liveness timer fired")));

            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Overall: ready to run"));
        }

        @Test
        @DisplayName("exits 1 when a component is down")
        void oneDown() {
            when(startupValidator.checkAll()).thenReturn(List.of(
                    HealthStatus.up("memory", "Key-value store reachable"),
                    HealthStatus.down("reviewer", "Connection refused")));

            CliResult result = execute("health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("reviewer: Connection refused"));
        }
    }

    @Nested
    @DisplayName("run and resume")
    class RunTests {

        @Test
        @DisplayName("run requires an objective")
        void objectiveRequired() {
            CliResult result = execute("run");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("--objective"));
        }

        @Test
        @DisplayName("run exits 2 when the startup checks fail")
        void startupFailure() {
            when(orchestrator.newRunId()).thenReturn("R-1");
            when(orchestrator.run(eq("R-1"), eq("Ship it"), any(Path.class))).thenThrow(
                    new StartupFailedException(null, List.of(HealthStatus.down("memory", "store unreachable"))));

            CliResult result = execute("run", "--objective", "Ship it", "--run-root", dir.toString());

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("memory: store unreachable"));
        }

        @Test
        @DisplayName("resume exits 1 for an unknown run")
        void resumeUnknownRun() {
            when(orchestrator.resume(eq("R-404"), any(Path.class)))
                    .thenThrow(new IllegalArgumentException("No checkpoint for run R-404"));

            CliResult result = execute("resume", "R-404", "--run-root", dir.toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Resume failed: No checkpoint for run R-404"));
        }
    }
}
