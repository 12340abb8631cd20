package com.stagegate.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.stagegate.core.model.Evidence;
import com.stagegate.core.model.Stage;
import com.stagegate.core.model.Task;
import com.stagegate.core.model.TaskStatus;
import com.stagegate.core.scheduler.UnknownDependencyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * Run-scoped holder of tasks and evidence.
 * <p>
 * Records are only ever added or updated. Updates to one task are atomic per id;
 * evidence is immutable once added. Iteration follows insertion order.
 */
public class RecordStore {

    private static final Logger log = LoggerFactory.getLogger(RecordStore.class);

    public static final String TASKS_FILE = "todo/tasks.json";
    public static final String EVIDENCE_FILE = "evidence/evidence.json";

    private final String runId;
    private final Map<String, Task> tasks = new ConcurrentHashMap<>();
    private final List<String> taskOrder = new CopyOnWriteArrayList<>();
    private final Map<String, Evidence> evidence = new ConcurrentHashMap<>();
    private final List<String> evidenceOrder = new CopyOnWriteArrayList<>();
    private final EvidenceIdGenerator evidenceIds;

    public RecordStore(String runId) {
        this.runId = runId;
        this.evidenceIds = new EvidenceIdGenerator(runId);
    }

    public String runId() {
        return runId;
    }

    // ── Tasks ──────────────────────────────────────────────────────────

    /**
     * Adds a batch of tasks. Every {@code blocked_by} entry must name a task already in
     * the store or in the same batch.
     */
    public synchronized void addTasks(List<Task> batch) {
        var known = new HashSet<>(tasks.keySet());
        for (Task task : batch) {
            if (!known.add(task.id())) {
                throw new DuplicateRecordException("Task " + task.id() + " already exists");
            }
        }
        for (Task task : batch) {
            for (String dep : task.metadata().blockedBy()) {
                if (!known.contains(dep)) {
                    throw new UnknownDependencyException(task.id(), dep);
                }
            }
        }
        for (Task task : batch) {
            tasks.put(task.id(), task);
            taskOrder.add(task.id());
        }
        log.debug("Stored {} tasks (total {})", batch.size(), tasks.size());
    }

    /**
     * Replaces every task with {@code batch}, as when an approved plan is committed again
     * after a resume. The previous tasks are kept if the batch is rejected.
     */
    public synchronized void replaceTasks(List<Task> batch) {
        List<Task> previous = tasks();
        tasks.clear();
        taskOrder.clear();
        try {
            addTasks(batch);
        } catch (RuntimeException e) {
            tasks.clear();
            taskOrder.clear();
            for (Task task : previous) {
                tasks.put(task.id(), task);
                taskOrder.add(task.id());
            }
            throw e;
        }
        if (!previous.isEmpty()) {
            log.info("Replaced {} stored tasks with {} planned tasks", previous.size(), batch.size());
        }
    }

    public Optional<Task> task(String id) {
        return Optional.ofNullable(tasks.get(id));
    }

    public List<Task> tasks() {
        var result = new ArrayList<Task>(taskOrder.size());
        for (String id : taskOrder) {
            result.add(tasks.get(id));
        }
        return result;
    }

    public List<Task> tasksOwnedBy(Stage stage) {
        return tasks().stream()
                .filter(t -> t.metadata() != null && t.metadata().currentStage() == stage)
                .toList();
    }

    /**
     * Atomically moves a task to {@code next}, enforcing the status lifecycle.
     */
    public Task transition(String taskId, TaskStatus next) {
        return update(taskId, current -> {
            if (!current.status().canTransitionTo(next)) {
                throw new IllegalTaskTransitionException(taskId, current.status(), next);
            }
            return current.withStatus(next);
        });
    }

    /**
     * Puts a task back to pending so that a repeated stage attempt runs it again.
     */
    public Task reopen(String taskId) {
        return update(taskId, current -> current.withStatus(TaskStatus.PENDING));
    }

    public Task update(String taskId, UnaryOperator<Task> change) {
        Task updated = tasks.computeIfPresent(taskId, (id, current) -> {
            Task next = Objects.requireNonNull(change.apply(current), "update returned null");
            if (!next.id().equals(id)) {
                throw new IllegalArgumentException("Task id cannot change: " + id + " -> " + next.id());
            }
            return next;
        });
        if (updated == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        return updated;
    }

    // ── Evidence ───────────────────────────────────────────────────────

    public String nextEvidenceId(Stage stage) {
        return evidenceIds.next(stage);
    }

    public void addEvidence(Evidence record) {
        Evidence existing = evidence.putIfAbsent(record.id(), record);
        if (existing != null) {
            throw new DuplicateRecordException("Evidence " + record.id() + " already exists");
        }
        evidenceOrder.add(record.id());
        evidenceIds.observe(record.id());
    }

    public Optional<Evidence> evidence(String id) {
        return Optional.ofNullable(evidence.get(id));
    }

    public List<Evidence> evidence() {
        var result = new ArrayList<Evidence>(evidenceOrder.size());
        for (String id : evidenceOrder) {
            result.add(evidence.get(id));
        }
        return result;
    }

    public Set<String> provenLocations() {
        var locations = new HashSet<String>();
        for (Evidence e : evidence.values()) {
            locations.add(e.location());
        }
        return locations;
    }

    // ── Archive ────────────────────────────────────────────────────────

    public void archive(Path runDir, RecordCodec codec) {
        codec.write(runDir.resolve(TASKS_FILE), codec.toTrees(tasks()));
        codec.write(runDir.resolve(EVIDENCE_FILE), codec.toTrees(evidence()));
        log.info("Archived {} tasks and {} evidence records to {}", tasks.size(), evidence.size(), runDir);
    }

    /**
     * Rebuilds a store from a run directory written by {@link #archive}.
     */
    public static RecordStore load(String runId, Path runDir, RecordCodec codec) {
        var store = new RecordStore(runId);
        Path taskFile = runDir.resolve(TASKS_FILE);
        Path evidenceFile = runDir.resolve(EVIDENCE_FILE);
        try {
            if (Files.exists(taskFile)) {
                List<Task> archived = codec.mapper().readValue(taskFile.toFile(), new TypeReference<List<Task>>() {});
                store.addTasks(archived);
            }
            if (Files.exists(evidenceFile)) {
                List<Evidence> archived = codec.mapper().readValue(evidenceFile.toFile(), new TypeReference<List<Evidence>>() {});
                archived.forEach(store::addEvidence);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load archive from " + runDir, e);
        }
        return store;
    }
}
