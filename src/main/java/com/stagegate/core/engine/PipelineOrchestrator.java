package com.stagegate.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.stagegate.core.StageGateException;
import com.stagegate.core.collaborator.KeyValueStore;
import com.stagegate.core.collaborator.LivenessTimer;
import com.stagegate.core.collaborator.Plan;
import com.stagegate.core.collaborator.PlanApprover;
import com.stagegate.core.collaborator.PlanSource;
import com.stagegate.core.collaborator.StageOutputCollector;
import com.stagegate.core.config.StageGateProperties;
import com.stagegate.core.events.EventBus;
import com.stagegate.core.events.WorkflowEvent;
import com.stagegate.core.health.StartupFailedException;
import com.stagegate.core.health.StartupResult;
import com.stagegate.core.health.StartupValidator;
import com.stagegate.core.logging.MdcContext;
import com.stagegate.core.metrics.StageGateMetrics;
import com.stagegate.core.model.Evidence;
import com.stagegate.core.model.EvidenceClaim;
import com.stagegate.core.model.Handoff;
import com.stagegate.core.model.HandoffContext;
import com.stagegate.core.model.RecoveryRecord;
import com.stagegate.core.model.Stage;
import com.stagegate.core.model.Task;
import com.stagegate.core.model.TaskStatus;
import com.stagegate.core.model.VerifiedBy;
import com.stagegate.core.model.WorkflowRecord;
import com.stagegate.core.qualitygate.GateAction;
import com.stagegate.core.qualitygate.GateDecision;
import com.stagegate.core.qualitygate.GateErrorKind;
import com.stagegate.core.qualitygate.GateLog;
import com.stagegate.core.qualitygate.QualityGateEngine;
import com.stagegate.core.scheduler.DependencyCycleException;
import com.stagegate.core.scheduler.StageDispatcher;
import com.stagegate.core.scheduler.TaskResult;
import com.stagegate.core.scheduler.UnknownDependencyException;
import com.stagegate.core.store.RecordCodec;
import com.stagegate.core.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drives a run through STARTUP, the eight stage occurrences and a terminal state.
 * <p>
 * Each stage executes its tasks, hands the resulting records to the quality gate and
 * follows the {@link TransitionTable} on the gate's action. The run context is
 * checkpointed before every attempt so an aborted run can be resumed.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private static final DateTimeFormatter RECOVERY_ID =
            DateTimeFormatter.ofPattern("'R-'yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);

    private final QualityGateEngine gateEngine;
    private final StageDispatcher dispatcher;
    private final StageOutputCollector collector;
    private final PlanSource planSource;
    private final PlanApprover planApprover;
    private final KeyValueStore keyValueStore;
    private final LivenessTimer livenessTimer;
    private final StartupValidator startupValidator;
    private final RecordCodec codec;
    private final EventBus eventBus;
    private final StageGateMetrics metrics;
    private final AgentLadder ladder;
    private final Path runRoot;
    private final Duration livenessInterval;
    private final TransitionTable transitions = TransitionTable.standard();
    private final Clock clock;

    @Autowired
    public PipelineOrchestrator(QualityGateEngine gateEngine,
                                StageDispatcher dispatcher,
                                StageOutputCollector collector,
                                PlanSource planSource,
                                PlanApprover planApprover,
                                KeyValueStore keyValueStore,
                                LivenessTimer livenessTimer,
                                StartupValidator startupValidator,
                                RecordCodec codec,
                                EventBus eventBus,
                                StageGateProperties properties,
                                @Autowired(required = false) StageGateMetrics metrics) {
        this(gateEngine, dispatcher, collector, planSource, planApprover, keyValueStore, livenessTimer,
                startupValidator, codec, eventBus, metrics, AgentLadder.from(properties),
                Path.of(properties.getRunRoot()), properties.getLiveness().getInterval(), Clock.systemUTC());
    }

    PipelineOrchestrator(QualityGateEngine gateEngine, StageDispatcher dispatcher, StageOutputCollector collector,
                         PlanSource planSource, PlanApprover planApprover, KeyValueStore keyValueStore,
                         LivenessTimer livenessTimer, StartupValidator startupValidator, RecordCodec codec,
                         EventBus eventBus, StageGateMetrics metrics, AgentLadder ladder, Path runRoot,
                         Duration livenessInterval, Clock clock) {
        this.gateEngine = gateEngine;
        this.dispatcher = dispatcher;
        this.collector = collector;
        this.planSource = planSource;
        this.planApprover = planApprover;
        this.keyValueStore = keyValueStore;
        this.livenessTimer = livenessTimer;
        this.startupValidator = startupValidator;
        this.codec = codec;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.ladder = ladder;
        this.runRoot = runRoot;
        this.livenessInterval = livenessInterval;
        this.clock = clock;
    }

    public Path runRoot() {
        return runRoot;
    }

    public String newRunId() {
        return RunLayout.newRunId(clock);
    }

    public static String checkpointKey(String runId) {
        return "run/" + runId + "/checkpoint";
    }

    public static String recoveryKey(String runId) {
        return "run/" + runId + "/recovery";
    }

    /**
     * Starts a new run for {@code objective} and drives it to COMPLETE or ABORTED.
     *
     * @throws StartupFailedException if a startup check fails; no stage is entered
     */
    public RunOutcome run(String objective) {
        return run(RunLayout.newRunId(clock), objective, runRoot);
    }

    public RunOutcome run(String runId, String objective, Path root) {
        Path runDir = root.resolve(runId);
        MdcContext.setRun(runId);
        try {
            log.info("Starting run {}: {}", runId, objective);
            publish("run.created", runId, Map.of("objective", objective, "runDir", runDir.toString()));

            RunContext context = RunContext.start(runId, objective, runDir, clock.instant());
            checkpoint(context);
            startup(runId, runDir);

            PipelineState first = transitions.next(PipelineState.STARTUP, GateAction.PROCEED);
            context = context.advance(first, ladder.defaultFor(first.stage().orElseThrow()));
            return drive(context, new RecordStore(runId));
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Continues an aborted or interrupted run from its checkpoint. The stage it stopped in
     * is re-entered with a fresh retry budget. Plan approval is only asked for again when
     * the run re-enters PLAN.
     */
    public RunOutcome resume(String runId) {
        return resume(runId, runRoot);
    }

    public RunOutcome resume(String runId, Path root) {
        Path runDir = root.resolve(runId);
        MdcContext.setRun(runId);
        try {
            RunContext saved = loadCheckpoint(runId);
            PipelineState target = switch (saved.state()) {
                case COMPLETE -> throw new StageGateException("Run " + runId + " already completed");
                case ABORTED -> saved.resumeState() != null ? saved.resumeState() : PipelineState.PLAN;
                case STARTUP -> PipelineState.PLAN;
                default -> saved.state();
            };
            log.info("Resuming run {} at {} (was {})", runId, target, saved.state());
            startup(runId, runDir);

            RecordStore store = RecordStore.load(runId, runDir, codec);
            Stage stage = target.stage().orElseThrow();
            reopenStageTasks(store, stage);
            RunContext context = saved.resumedAt(target, ladder.defaultFor(stage));
            publish("run.resumed", runId, Map.of("state", target.name()));
            return drive(context, store);
        } finally {
            MdcContext.clear();
        }
    }

    private void startup(String runId, Path runDir) {
        StartupResult startup = startupValidator.validate(runId, runDir);
        if (!startup.passed()) {
            publish("run.startup_failed", runId, Map.of("checks", startup.checks().toString()));
            throw new StartupFailedException(startup.report(), startup.checks());
        }
        codec.write(RunLayout.logs(runDir).resolve("startup.json"), startup.report());
    }

    // ── Main loop ──────────────────────────────────────────────────────

    private RunOutcome drive(RunContext context, RecordStore store) {
        var decisions = new ArrayList<GateDecision>();
        RecoveryRecord recovery = null;
        try {
            while (!context.state().isTerminal()) {
                checkpoint(context);
                Stage stage = context.stage();
                MdcContext.setStage(context.runId(), stage.name(), context.executingAgent());
                publish("stage.entered", context.runId(), Map.of(
                        "stage", stage.name(), "attempt", context.retryCount(), "agent", String.valueOf(context.executingAgent())));

                StageAttempt attempt;
                try {
                    attempt = stage == Stage.PLAN ? attemptPlan(context, store) : attemptStage(context, store);
                } catch (DependencyCycleException | UnknownDependencyException e) {
                    log.error("Stage {} cannot be scheduled: {}", stage, e.getMessage());
                    recovery = stop(context, "dependency_cycle");
                    context = context.aborted();
                    break;
                }

                GateDecision decision = attempt.decision();
                decisions.add(decision);
                if (decision.hasError(GateErrorKind.FABRICATION)) {
                    context = context.fabricated();
                }
                publish("gate.decided", context.runId(), Map.of(
                        "stage", stage.name(), "action", decision.action().name(),
                        "errors", decision.errors().size(), "retry", decision.retry()));

                switch (decision.action()) {
                    case PROCEED -> {
                        if (stage == Stage.PLAN && !planApprover.awaitApproval(attempt.plan())) {
                            log.warn("Plan rejected for run {}", context.runId());
                            recovery = stop(context, "plan_rejected");
                            context = context.aborted();
                            break;
                        }
                        commit(store, attempt, decision);
                        PipelineState next = transitions.next(context.state(), GateAction.PROCEED);
                        context = context.advance(next, next.stage().map(ladder::defaultFor).orElse(null));
                    }
                    case REVISE -> {
                        reopenStageTasks(store, stage);
                        transitions.next(context.state(), GateAction.REVISE);
                        context = context.nextAttempt();
                    }
                    case ESCALATE -> {
                        var nextAgent = ladder.above(context.executingAgent());
                        if (nextAgent.isEmpty()) {
                            log.error("Stage {} exhausted the agent ladder at {}", stage, context.executingAgent());
                            recovery = stop(context, "escalation_exhausted");
                            context = context.aborted();
                            break;
                        }
                        writeHandoff(context, store, decision, nextAgent.get());
                        reopenStageTasks(store, stage);
                        transitions.next(context.state(), GateAction.ESCALATE);
                        context = context.escalated(nextAgent.get());
                    }
                    case STOP -> {
                        recovery = stop(context, stopTrigger(decision));
                        context = context.aborted();
                    }
                }
            }
        } finally {
            store.archive(context.runPath(), codec);
            checkpoint(context);
        }

        log.info("Run {} finished in state {}", context.runId(), context.state());
        if (metrics != null) {
            metrics.recordRunResult(context.state().name());
        }
        publish(context.state() == PipelineState.COMPLETE ? "run.completed" : "run.aborted",
                context.runId(), Map.of("state", context.state().name()));
        return new RunOutcome(context, decisions, recovery);
    }

    // ── Stage attempts ─────────────────────────────────────────────────

    private record StageAttempt(GateDecision decision, List<Evidence> evidence, Plan plan) {
    }

    private StageAttempt attemptPlan(RunContext context, RecordStore store) {
        Plan plan = planSource.plan(context.stageContext());
        List<Evidence> evidence = materialize(store, Stage.PLAN, plan.evidenceClaims(), new HashSet<>());
        var batch = new ArrayList<JsonNode>();
        batch.addAll(codec.toTrees(plan.tasks()));
        batch.addAll(codec.toTrees(evidence));
        batch.addAll(codec.toTrees(plan.records()));
        batch.addAll(collector.collect(context.runPath(), Stage.PLAN));

        GateDecision decision = gateEngine.gate(Stage.PLAN, batch, context.retryCount(),
                context.fabricationCount(), gateLog(context));
        return new StageAttempt(decision, evidence, plan);
    }

    private StageAttempt attemptStage(RunContext context, RecordStore store) {
        Stage stage = context.stage();
        List<Task> pending = store.tasksOwnedBy(stage).stream()
                .filter(t -> t.status() == TaskStatus.PENDING)
                .toList();

        List<TaskResult> results;
        try (LivenessTimer.Registration ignored = livenessTimer.every(livenessInterval,
                () -> livenessCheck(context, store))) {
            results = dispatcher.dispatch(context.stageContext(), store, pending);
        }

        var claims = new ArrayList<EvidenceClaim>();
        var records = new ArrayList<WorkflowRecord>();
        for (TaskResult result : results) {
            claims.addAll(result.evidenceClaims());
            records.addAll(result.records());
        }
        List<Evidence> evidence = materialize(store, stage, claims, store.provenLocations());

        var batch = new ArrayList<JsonNode>();
        batch.addAll(codec.toTrees(store.tasksOwnedBy(stage)));
        batch.addAll(codec.toTrees(evidence));
        batch.addAll(codec.toTrees(records));
        batch.addAll(collector.collect(context.runPath(), stage));

        GateDecision decision = gateEngine.gate(stage, batch, context.retryCount(),
                context.fabricationCount(), gateLog(context));
        return new StageAttempt(decision, evidence, null);
    }

    /**
     * Turns claims into evidence records with fresh ids. A location already proven earlier in
     * the run is not claimed again.
     */
    private List<Evidence> materialize(RecordStore store, Stage stage, List<EvidenceClaim> claims,
                                       Set<String> alreadyProven) {
        var evidence = new ArrayList<Evidence>();
        var seen = new HashSet<>(alreadyProven);
        Instant now = clock.instant();
        for (EvidenceClaim claim : claims) {
            if (claim.location() != null && !seen.add(claim.location())) {
                continue;
            }
            evidence.add(new Evidence(store.nextEvidenceId(stage), claim.type(), claim.claim(), claim.location(),
                    now, true, VerifiedBy.AGENT));
        }
        return evidence;
    }

    private void commit(RecordStore store, StageAttempt attempt, GateDecision decision) {
        if (attempt.plan() != null) {
            store.replaceTasks(attempt.plan().tasks());
        }
        Set<String> proven = new HashSet<>(decision.provenEvidenceIds());
        for (Evidence evidence : attempt.evidence()) {
            if (proven.contains(evidence.id())) {
                store.addEvidence(evidence);
            }
        }
    }

    private void livenessCheck(RunContext context, RecordStore store) {
        Stage stage = context.stage();
        try {
            var batch = new ArrayList<JsonNode>(codec.toTrees(store.tasksOwnedBy(stage)));
            batch.addAll(collector.collect(context.runPath(), stage));
            GateDecision decision = gateEngine.precheck(stage, batch, context.retryCount());
            if (!decision.proceeds()) {
                log.warn("Liveness check for {}: {} with {} open errors",
                        stage, decision.action(), decision.errors().size());
            }
        } catch (RuntimeException e) {
            log.warn("Liveness check for {} failed: {}", stage, e.getMessage());
        }
    }

    // ── Escalation and stop ────────────────────────────────────────────

    private void writeHandoff(RunContext context, RecordStore store, GateDecision decision, String toAgent) {
        Stage stage = context.stage();
        Instant now = clock.instant();
        List<String> remaining = store.tasksOwnedBy(stage).stream()
                .filter(t -> t.status() != TaskStatus.COMPLETED)
                .map(Task::id)
                .toList();
        List<String> evidenceIds = store.evidence().stream().map(Evidence::id).toList();
        var handoffContext = new HandoffContext(
                context.objective(),
                stage.gateName(),
                context.completedStageNames(),
                remaining,
                evidenceIds,
                decision.errorMessages(),
                List.of(),
                List.of(checkpointKey(context.runId())));
        var handoff = new Handoff(
                context.executingAgent(),
                toAgent,
                now,
                handoffContext,
                String.format("Quality gate for %s failed after %d attempt(s). Resolve the blockers and resubmit.",
                        stage.gateName(), decision.retry() + 1),
                now.plus(Duration.ofMinutes(60)));

        Path file = RunLayout.docs(context.runPath())
                .resolve(String.format("handoff-%s-%d.json", stage.instanceName(), context.escalationCount() + 1));
        codec.write(file, handoff);
        log.warn("Escalating {} from {} to {}", stage, context.executingAgent(), toAgent);
        if (metrics != null) {
            metrics.incrementEscalations(stage.name());
        }
        publish("run.escalated", context.runId(), Map.of(
                "stage", stage.name(), "from", String.valueOf(context.executingAgent()), "to", toAgent));
    }

    private RecoveryRecord stop(RunContext context, String trigger) {
        PipelineState before = context.state();
        String rollbackTo = context.completedStages().isEmpty()
                ? PipelineState.STARTUP.name()
                : context.completedStages().get(context.completedStages().size() - 1).name();
        var record = new RecoveryRecord(
                RECOVERY_ID.format(clock.instant()),
                trigger,
                rollbackTo,
                before.name(),
                PipelineState.ABORTED.name(),
                true,
                before.stage().orElse(null));
        codec.write(RunLayout.logs(context.runPath()).resolve("recovery-" + record.id() + ".json"), record);
        keyValueStore.put(recoveryKey(context.runId()), codec.toJson(record));
        log.error("Run {} stopped at {} ({}); resume from {}", context.runId(), before, trigger, before);
        return record;
    }

    private static String stopTrigger(GateDecision decision) {
        if (decision.hasError(GateErrorKind.DEPENDENCY_CYCLE)) {
            return "dependency_cycle";
        }
        if (decision.hasError(GateErrorKind.FABRICATION)) {
            return "fabrication";
        }
        return "gate_stop";
    }

    // ── Persistence ────────────────────────────────────────────────────

    private void reopenStageTasks(RecordStore store, Stage stage) {
        for (Task task : store.tasksOwnedBy(stage)) {
            if (task.status() != TaskStatus.PENDING) {
                store.reopen(task.id());
            }
        }
    }

    private void checkpoint(RunContext context) {
        keyValueStore.put(checkpointKey(context.runId()), codec.toJson(context));
    }

    private RunContext loadCheckpoint(String runId) {
        String json = keyValueStore.get(checkpointKey(runId))
                .orElseThrow(() -> new StageGateException("No checkpoint for run " + runId));
        try {
            return codec.mapper().readValue(json, RunContext.class);
        } catch (JsonProcessingException e) {
            throw new StageGateException("Corrupt checkpoint for run " + runId, e);
        }
    }

    private GateLog gateLog(RunContext context) {
        return new GateLog(RunLayout.logs(context.runPath()), codec);
    }

    private void publish(String type, String runId, Map<String, Object> payload) {
        eventBus.publish(WorkflowEvent.of(type, runId, payload));
    }
}
