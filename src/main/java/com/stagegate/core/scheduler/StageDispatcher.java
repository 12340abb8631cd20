package com.stagegate.core.scheduler;

import com.stagegate.core.collaborator.StageContext;
import com.stagegate.core.collaborator.StageHandler;
import com.stagegate.core.collaborator.StageHandlerRegistry;
import com.stagegate.core.collaborator.TaskOutcome;
import com.stagegate.core.config.StageGateProperties;
import com.stagegate.core.events.EventBus;
import com.stagegate.core.events.WorkflowEvent;
import com.stagegate.core.logging.MdcContext;
import com.stagegate.core.metrics.StageGateMetrics;
import com.stagegate.core.model.Task;
import com.stagegate.core.model.TaskStatus;
import com.stagegate.core.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes the tasks of one stage.
 * <p>
 * Tasks without in-batch dependencies form the independent set. When that set reaches the
 * parallel threshold it runs on a fixed worker pool, otherwise one task at a time. Dependent
 * tasks follow in topological order and only run once every predecessor completed; a task
 * whose predecessor did not complete is marked blocked without running.
 */
@Component
public class StageDispatcher {

    private static final Logger log = LoggerFactory.getLogger(StageDispatcher.class);

    private final StageHandlerRegistry handlers;
    private final int parallelThreshold;
    private final int workerPoolWidth;
    private final EventBus eventBus;
    private final StageGateMetrics metrics;

    @Autowired
    public StageDispatcher(StageHandlerRegistry handlers, StageGateProperties properties,
                           EventBus eventBus, @Autowired(required = false) StageGateMetrics metrics) {
        this(handlers, properties.getDispatch().getParallelThreshold(),
                properties.getDispatch().getWorkerPoolWidth(), eventBus, metrics);
    }

    StageDispatcher(StageHandlerRegistry handlers, int parallelThreshold, int workerPoolWidth,
                    EventBus eventBus, StageGateMetrics metrics) {
        this.handlers = handlers;
        this.parallelThreshold = parallelThreshold;
        this.workerPoolWidth = workerPoolWidth;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Runs {@code tasks} (all pending) and returns one result per task in batch order.
     *
     * @throws DependencyCycleException   before any task runs, if the batch has a cycle
     * @throws UnknownDependencyException if a dependency names no task in the batch or store
     */
    public List<TaskResult> dispatch(StageContext context, RecordStore store, List<Task> tasks) {
        if (tasks.isEmpty()) {
            return List.of();
        }
        var outside = new HashSet<String>();
        for (Task known : store.tasks()) {
            outside.add(known.id());
        }
        tasks.forEach(t -> outside.remove(t.id()));

        DependencyGraph graph = DependencyGraph.of(tasks, outside);
        List<Task> order = graph.topologicalOrder();
        List<Task> independent = graph.independent();
        StageHandler handler = handlers.handlerFor(context.stage());
        Map<String, TaskResult> results = new ConcurrentHashMap<>();

        log.info("Dispatching {} tasks for {} ({} independent)",
                tasks.size(), context.stage(), independent.size());

        if (independent.size() >= parallelThreshold) {
            runParallel(context, store, graph, handler, independent, results);
        } else {
            for (Task task : independent) {
                results.put(task.id(), runIfReady(context, store, graph, handler, task, results));
            }
        }

        // ── Dependents, strictly after their predecessors ──
        for (Task task : order) {
            if (!results.containsKey(task.id())) {
                results.put(task.id(), runIfReady(context, store, graph, handler, task, results));
            }
        }

        var ordered = new LinkedHashMap<String, TaskResult>();
        for (Task task : tasks) {
            ordered.put(task.id(), results.get(task.id()));
        }
        return new ArrayList<>(ordered.values());
    }

    private void runParallel(StageContext context, RecordStore store, DependencyGraph graph,
                             StageHandler handler, List<Task> independent, Map<String, TaskResult> results) {
        var threadIndex = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workerPoolWidth, r -> {
            Thread t = new Thread(r, "stage-worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            var futures = new ArrayList<CompletableFuture<TaskResult>>();
            for (Task task : independent) {
                futures.add(CompletableFuture.supplyAsync(
                        () -> runIfReady(context, store, graph, handler, task, results), executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            for (var future : futures) {
                TaskResult result = future.join();
                results.put(result.taskId(), result);
            }
        } finally {
            executor.shutdown();
        }
    }

    private TaskResult runIfReady(StageContext context, RecordStore store, DependencyGraph graph,
                                  StageHandler handler, Task task, Map<String, TaskResult> results) {
        Optional<String> unmet = unmetDependency(store, graph, task, results);
        if (unmet.isPresent()) {
            String reason = "Blocked by " + unmet.get() + " which did not complete";
            log.warn("Task {} {}", task.id(), reason);
            store.transition(task.id(), TaskStatus.IN_PROGRESS);
            store.transition(task.id(), TaskStatus.BLOCKED);
            publish(context, "task.finished", task.id(), Map.of("status", TaskStatus.BLOCKED.wireName()));
            return TaskResult.blocked(task.id(), reason);
        }
        return execute(context, store, handler, task);
    }

    private Optional<String> unmetDependency(RecordStore store, DependencyGraph graph, Task task,
                                             Map<String, TaskResult> results) {
        for (String dep : graph.internalDependencies(task.id())) {
            TaskResult result = results.get(dep);
            if (result == null || !result.completed()) {
                return Optional.of(dep);
            }
        }
        for (String dep : graph.externalDependencies(task.id())) {
            boolean done = store.task(dep).map(t -> t.status() == TaskStatus.COMPLETED).orElse(false);
            if (!done) {
                return Optional.of(dep);
            }
        }
        return Optional.empty();
    }

    private TaskResult execute(StageContext context, RecordStore store, StageHandler handler, Task task) {
        MdcContext.setTask(context.runId(), context.stage().name(), task.id());
        try {
            Task running = store.transition(task.id(), TaskStatus.IN_PROGRESS);
            publish(context, "task.started", task.id(), Map.of("content", task.content()));
            Instant startedAt = Instant.now();

            TaskOutcome outcome;
            try {
                outcome = handler.execute(context, running);
                if (outcome == null || outcome.status() == null || !outcome.status().isTerminal()) {
                    outcome = TaskOutcome.failed("Handler returned no final status");
                }
            } catch (RuntimeException e) {
                log.error("Handler failed for task {}: {}", task.id(), e.getMessage(), e);
                outcome = TaskOutcome.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
            }

            Instant finishedAt = Instant.now();
            store.transition(task.id(), outcome.status());
            log.info("Task {} finished as {}", task.id(), outcome.status().wireName());
            if (metrics != null) {
                metrics.recordTaskExecution(context.stage().name(), outcome.status().wireName(),
                        Duration.between(startedAt, finishedAt).toMillis());
            }
            publish(context, "task.finished", task.id(), Map.of("status", outcome.status().wireName()));
            return new TaskResult(task.id(), outcome.status(), outcome.evidenceClaims(), outcome.records(),
                    startedAt, finishedAt, outcome.detail());
        } finally {
            MdcContext.clearTask();
        }
    }

    private void publish(StageContext context, String type, String taskId, Map<String, Object> payload) {
        eventBus.publish(new WorkflowEvent(type, context.runId(), taskId, payload, Instant.now()));
    }
}
