package com.stagegate.sandbox;

import com.stagegate.core.RecordFixtures;
import com.stagegate.core.collaborator.StageContext;
import com.stagegate.core.collaborator.TaskOutcome;
import com.stagegate.core.model.Stage;
import com.stagegate.core.model.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactStageHandlerTest {

    @TempDir
    Path dir;

    private final ArtifactStageHandler handler = new ArtifactStageHandler();

    private StageContext context() {
        return new StageContext("R-1", "Ship it", Stage.IMPLEMENT, dir, "Haiku", 0);
    }

    @Test
    @DisplayName("claims an artifact that exists at the task's evidence location")
    void artifactPresent() {
        Path file = RecordFixtures.artifact(dir, "build.log", "all checks passed");

        TaskOutcome outcome = handler.execute(context(),
                RecordFixtures.pendingTask("T-1", Stage.IMPLEMENT, file.toString()));

        assertEquals(TaskStatus.COMPLETED, outcome.status());
        assertEquals("all checks passed", outcome.evidenceClaims().get(0).claim());
    }

    @Test
    @DisplayName("fails the task when the artifact is not there")
    void artifactMissing() {
        Path file = dir.resolve("missing.log");

        TaskOutcome outcome = handler.execute(context(),
                RecordFixtures.pendingTask("T-1", Stage.IMPLEMENT, file.toString()));

        assertEquals(TaskStatus.FAILED, outcome.status());
        assertEquals("Expected artifact missing at " + file, outcome.detail());
    }
}
