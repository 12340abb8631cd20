package com.stagegate.sandbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.stagegate.core.StageGateException;
import com.stagegate.core.collaborator.Plan;
import com.stagegate.core.collaborator.PlanSource;
import com.stagegate.core.collaborator.StageContext;
import com.stagegate.core.config.StageGateProperties;
import com.stagegate.core.model.EvidenceClaim;
import com.stagegate.core.model.EvidenceType;
import com.stagegate.core.model.Task;
import com.stagegate.core.model.WorkflowRecord;
import com.stagegate.core.store.RecordCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads the plan an agent prepared as JSON: either an array of task records or an object
 * with {@code tasks}, optional {@code evidence} claims and optional further {@code records}.
 * <p>
 * The plan is copied into {@code plans/} of the run together with a short summary that
 * serves as the plan's own evidence.
 */
public class FilePlanSource implements PlanSource {

    private static final Logger log = LoggerFactory.getLogger(FilePlanSource.class);

    private final RecordCodec codec;
    private final StageGateProperties properties;

    public FilePlanSource(RecordCodec codec, StageGateProperties properties) {
        this.codec = codec;
        this.properties = properties;
    }

    @Override
    public Plan plan(StageContext context) {
        Path file = Path.of(properties.getPlan().getFile());
        if (!Files.isRegularFile(file)) {
            throw new StageGateException("Plan file not found: " + file.toAbsolutePath());
        }
        JsonNode root = codec.parse(readString(file));

        JsonNode taskNodes = root.isArray() ? root : root.path("tasks");
        var tasks = new ArrayList<Task>();
        taskNodes.forEach(node -> tasks.add(codec.toRecord(node, Task.class)));

        var claims = new ArrayList<EvidenceClaim>();
        root.path("evidence").forEach(node -> claims.add(
                codec.mapper().convertValue(node, EvidenceClaim.class)));

        var records = new ArrayList<WorkflowRecord>();
        root.path("records").forEach(node -> codec.toRecord(node).ifPresentOrElse(records::add,
                () -> log.warn("Skipping plan record that matches no schema: {}", node)));

        Path plans = context.runDir().resolve("plans");
        codec.write(plans.resolve("plan.json"), codec.toTrees(tasks));
        claims.add(writeSummary(plans.resolve("plan.md"), context, tasks));

        log.info("Loaded plan with {} tasks from {} (attempt {})", tasks.size(), file, context.attempt());
        return new Plan(tasks, claims, records);
    }

    private EvidenceClaim writeSummary(Path summary, StageContext context, List<Task> tasks) {
        String headline = "Plan with " + tasks.size() + " tasks";
        String ids = tasks.stream().map(Task::id).collect(Collectors.joining(", "));
        String text = String.format("# %s%n%nRun: %s%nPlanned by: %s%nTasks: %s%n",
                headline, context.runId(), context.executingAgent(), ids);
        try {
            Files.createDirectories(summary.getParent());
            Files.writeString(summary, text);
        } catch (IOException e) {
            throw new StageGateException("Cannot write plan summary " + summary, e);
        }
        return new EvidenceClaim(EvidenceType.OUTPUT, headline, summary.toString());
    }

    private static String readString(Path file) {
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new StageGateException("Cannot read plan file " + file, e);
        }
    }
}
