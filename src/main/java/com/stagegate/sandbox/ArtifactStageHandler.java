package com.stagegate.sandbox;

import com.stagegate.core.collaborator.StageContext;
import com.stagegate.core.collaborator.StageHandler;
import com.stagegate.core.collaborator.TaskOutcome;
import com.stagegate.core.model.EvidenceClaim;
import com.stagegate.core.model.Task;
import com.stagegate.core.model.TaskMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Fallback handler for tasks whose work is done by an agent outside the engine.
 * The task completes once its artifact exists at {@code evidence_location}; the gate then
 * decides whether the artifact proves anything.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class ArtifactStageHandler implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStageHandler.class);

    @Override
    public TaskOutcome execute(StageContext context, Task task) {
        TaskMetadata metadata = task.metadata();
        String location = metadata.evidenceLocation();
        if (location == null || location.isBlank()) {
            return TaskOutcome.failed("Task " + task.id() + " names no evidence location");
        }
        if (!Files.isRegularFile(Path.of(location))) {
            log.info("Task {}: no artifact at {} yet (agent {})", task.id(), location, context.executingAgent());
            return TaskOutcome.failed("Expected artifact missing at " + location);
        }
        log.info("Task {}: collected artifact {}", task.id(), location);
        var claim = new EvidenceClaim(metadata.evidenceRequired(), metadata.successCriteria(), location);
        return TaskOutcome.completed(List.of(claim), List.of());
    }
}
