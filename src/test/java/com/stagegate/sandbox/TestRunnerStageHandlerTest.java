package com.stagegate.sandbox;

import com.stagegate.core.RecordFixtures;
import com.stagegate.core.collaborator.StageContext;
import com.stagegate.core.collaborator.TaskOutcome;
import com.stagegate.core.collaborator.TestRunResult;
import com.stagegate.core.collaborator.TestRunner;
import com.stagegate.core.model.EvidenceType;
import com.stagegate.core.model.RunMetrics;
import com.stagegate.core.model.Stage;
import com.stagegate.core.model.Task;
import com.stagegate.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link TestRunnerStageHandler}.
 */
class TestRunnerStageHandlerTest {

    @TempDir
    Path dir;

    private TestRunner testRunner;
    private TestRunnerStageHandler handler;
    private StageContext context;
    private Path summary;
    private Task task;

    @BeforeEach
    void setUp() {
        testRunner = mock(TestRunner.class);
        handler = new TestRunnerStageHandler(testRunner);
        context = new StageContext("R-1", "Ship it", Stage.TEST, dir, "Haiku", 0);
        summary = dir.resolve("test/summary.txt");
        task = RecordFixtures.pendingTask("T-9", Stage.TEST, summary.toString());
    }

    @Test
    @DisplayName("only handles TEST tasks")
    void supportsTestOnly() {
        assertTrue(handler.supports(Stage.TEST));
        assertFalse(handler.supports(Stage.IMPLEMENT));
    }

    @Test
    @DisplayName("a green run writes the summary and claims it as a test result")
    void greenRun() throws Exception {
        when(testRunner.run("default")).thenReturn(new TestRunResult(8, 0, dir.resolve("runner.log")));

        TaskOutcome outcome = handler.execute(context, task);

        assertEquals(TaskStatus.COMPLETED, outcome.status());
        assertEquals(EvidenceType.TEST_RESULT, outcome.evidenceClaims().get(0).type());
        assertEquals(summary.toString(), outcome.evidenceClaims().get(0).location());
        assertTrue(Files.readString(summary).startsWith("Tests passed: 8"));
        RunMetrics metrics = (RunMetrics) outcome.records().get(0);
        assertEquals(8, metrics.quality().get("tests_passed"));
    }

    @Test
    @DisplayName("a red run fails the task but still reports metrics")
    void redRun() {
        when(testRunner.run("default")).thenReturn(new TestRunResult(5, 2, dir.resolve("runner.log")));

        TaskOutcome outcome = handler.execute(context, task);

        assertEquals(TaskStatus.FAILED, outcome.status());
        assertTrue(outcome.evidenceClaims().isEmpty());
        assertEquals(1, outcome.records().size());
        assertTrue(outcome.detail().startsWith("2 test(s) failed"));
    }
}
