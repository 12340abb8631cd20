package com.stagegate.core.qualitygate;

import com.fasterxml.jackson.databind.JsonNode;
import com.stagegate.core.collaborator.EvidencePackage;
import com.stagegate.core.collaborator.ExternalReviewer;
import com.stagegate.core.collaborator.ReviewVerdict;
import com.stagegate.core.config.StageGateProperties;
import com.stagegate.core.evidence.EvidenceVerifier;
import com.stagegate.core.evidence.VerificationFailure;
import com.stagegate.core.evidence.VerificationResult;
import com.stagegate.core.metrics.StageGateMetrics;
import com.stagegate.core.model.Evidence;
import com.stagegate.core.model.ReviewAction;
import com.stagegate.core.model.ReviewGate;
import com.stagegate.core.model.Stage;
import com.stagegate.core.model.Task;
import com.stagegate.core.model.TaskStatus;
import com.stagegate.core.model.WorkflowRecord;
import com.stagegate.core.scheduler.DependencyCycleException;
import com.stagegate.core.scheduler.DependencyGraph;
import com.stagegate.core.schema.SchemaName;
import com.stagegate.core.schema.SchemaValidator;
import com.stagegate.core.schema.ValidationResult;
import com.stagegate.core.store.RecordCodec;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a stage's output lets the run move on.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Validate every output record against its schema</li>
 *   <li>Check that each schema the stage requires is represented</li>
 *   <li>Verify the artifacts behind verified evidence and detect completion claims with no evidence</li>
 *   <li>Consult the external reviewer at the stages that need independent approval</li>
 *   <li>Turn the collected errors into PROCEED, REVISE, ESCALATE or STOP</li>
 * </ul>
 * Given the same outputs, retry count, artifact contents and reviewer answers, the action and
 * error list are always the same.
 */
@Service
public class QualityGateEngine {

    private static final Logger log = LoggerFactory.getLogger(QualityGateEngine.class);

    private final SchemaValidator validator;
    private final EvidenceVerifier verifier;
    private final RecordCodec codec;
    private final ExternalReviewer reviewer;
    private final GatePolicy policy;
    private final StageGateMetrics metrics;
    private final Clock clock;
    private final ExecutorService reviewerExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "external-reviewer");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public QualityGateEngine(SchemaValidator validator, EvidenceVerifier verifier, RecordCodec codec,
                             @Autowired(required = false) ExternalReviewer reviewer,
                             StageGateProperties properties,
                             @Autowired(required = false) StageGateMetrics metrics) {
        this(validator, verifier, codec, reviewer, GatePolicy.from(properties), metrics, Clock.systemUTC());
    }

    public QualityGateEngine(SchemaValidator validator, EvidenceVerifier verifier, RecordCodec codec,
                             ExternalReviewer reviewer, GatePolicy policy, StageGateMetrics metrics, Clock clock) {
        this.validator = validator;
        this.verifier = verifier;
        this.codec = codec;
        this.reviewer = reviewer;
        this.policy = policy;
        this.metrics = metrics;
        this.clock = clock;
    }

    @PreDestroy
    void shutdown() {
        reviewerExecutor.shutdown();
        try {
            if (!reviewerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                reviewerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            reviewerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    boolean isShutdown() {
        return reviewerExecutor.isShutdown();
    }

    public GatePolicy policy() {
        return policy;
    }

    /**
     * Evaluates the gate and appends the decision to {@code gateLog} before returning.
     */
    public GateDecision gate(Stage stage, List<JsonNode> outputs, int retryCount, GateLog gateLog) {
        return gate(stage, outputs, retryCount, 0, gateLog);
    }

    /**
     * As {@link #gate(Stage, List, int, GateLog)}; {@code priorFabrications} counts earlier gates of
     * this stage that found a fabrication, across agent escalations.
     */
    public GateDecision gate(Stage stage, List<JsonNode> outputs, int retryCount, int priorFabrications,
                             GateLog gateLog) {
        GateDecision decision = evaluate(stage, outputs, retryCount, priorFabrications, true);
        gateLog.append(decision);
        if (metrics != null) {
            metrics.recordGateDecision(stage.name(), decision.action().name());
            metrics.recordGateErrors(stage.name(), decision.errors().size());
        }
        if (decision.proceeds()) {
            log.info("Gate {} PROCEED at retry {} (checked {})", stage, retryCount, decision.checkedSchemas());
        } else {
            log.warn("Gate {} {} at retry {} with {} errors", stage, decision.action(), retryCount,
                    decision.errors().size());
        }
        return decision;
    }

    /**
     * Evaluates the gate without writing anything.
     */
    public GateDecision evaluate(Stage stage, List<JsonNode> outputs, int retryCount) {
        return evaluate(stage, outputs, retryCount, 0, true);
    }

    /**
     * Side-effect-free re-check used while a stage is still running; skips the external reviewer.
     */
    public GateDecision precheck(Stage stage, List<JsonNode> outputs, int retryCount) {
        return evaluate(stage, outputs, retryCount, 0, false);
    }

    private GateDecision evaluate(Stage stage, List<JsonNode> outputs, int retryCount, int priorFabrications,
                                  boolean consultReviewer) {
        var errors = new ArrayList<GateError>();
        var checked = new LinkedHashSet<SchemaName>();
        var tasks = new ArrayList<Task>();
        var evidence = new ArrayList<Evidence>();
        var reviews = new ArrayList<ReviewGate>();

        // ── Step 1: schema validation ──
        for (int i = 0; i < outputs.size(); i++) {
            JsonNode node = outputs.get(i);
            Optional<SchemaName> schema = validator.detectSchema(node);
            if (schema.isEmpty()) {
                errors.add(new GateError(GateErrorKind.SCHEMA_VIOLATION, "unknown",
                        "Record #" + (i + 1) + ": cannot determine schema"));
                continue;
            }
            checked.add(schema.get());
            ValidationResult result = validator.validate(node, schema.get());
            String label = recordLabel(node, i);
            for (String error : result.errors()) {
                errors.add(new GateError(GateErrorKind.SCHEMA_VIOLATION, schema.get().wireName(), label + error));
            }
            if (result.ok()) {
                bind(node, schema.get(), label, errors).ifPresent(record -> {
                    if (record instanceof Task task) {
                        tasks.add(task);
                    } else if (record instanceof Evidence e) {
                        evidence.add(e);
                    } else if (record instanceof ReviewGate review) {
                        reviews.add(review);
                    }
                });
            }
        }

        // ── Step 2: required schemas ──
        List<SchemaName> required = StageRequirements.requiredFor(stage);
        var missing = new ArrayList<String>();
        for (SchemaName schema : required) {
            if (!checked.contains(schema)) {
                missing.add(schema.wireName());
                errors.add(new GateError(GateErrorKind.MISSING_SCHEMA, schema.wireName(),
                        "Missing required schema: " + schema.wireName()));
            }
        }

        // ── Step 3: dependencies, evidence, fabrication ──
        checkDependencies(stage, tasks, errors);
        List<String> proven = verifyEvidence(tasks, evidence, errors);
        checkTaskOutcomes(tasks, evidence, errors);
        checkReviews(reviews, errors);

        // ── Step 4: independent approval ──
        if (stage.requiresExternalApproval() && consultReviewer) {
            consultReviewer(stage, outputs, errors);
        }

        // ── Step 5: decide ──
        GateAction action = policy.decide(errors, retryCount, priorFabrications);
        var checkedNames = checked.stream().map(SchemaName::wireName).toList();
        var decision = new GateDecision(stage, action, errors, checkedNames, missing, proven,
                retryCount, clock.instant(), null);
        if (action == GateAction.PROCEED) {
            return decision;
        }
        return new GateDecision(stage, action, errors, checkedNames, missing, proven, retryCount,
                decision.timestamp(), RemediationReport.render(decision, policy, required));
    }

    private Optional<WorkflowRecord> bind(JsonNode node, SchemaName schema, String label, List<GateError> errors) {
        Optional<WorkflowRecord> record = codec.toRecord(node);
        if (record.isEmpty()) {
            errors.add(new GateError(GateErrorKind.SCHEMA_VIOLATION, schema.wireName(),
                    label + "field values cannot be read as " + schema.wireName()));
        }
        return record;
    }

    /**
     * At PLAN the batch holds every task of the run, so each reference must resolve inside it.
     * Later stages may reference tasks owned by other stages.
     */
    private void checkDependencies(Stage stage, List<Task> tasks, List<GateError> errors) {
        var ids = new HashSet<String>();
        tasks.forEach(t -> ids.add(t.id()));
        var outside = new HashSet<String>();
        for (Task task : tasks) {
            for (String dep : task.metadata().blockedBy()) {
                if (ids.contains(dep)) {
                    continue;
                }
                if (stage == Stage.PLAN) {
                    errors.add(new GateError(GateErrorKind.SCHEMA_VIOLATION, SchemaName.TODO.wireName(),
                            task.id() + ": blocked_by references unknown task " + dep));
                } else {
                    outside.add(dep);
                }
            }
        }
        if (stage == Stage.PLAN && errors.stream().anyMatch(e -> e.message().contains("references unknown task"))) {
            return;
        }
        try {
            DependencyGraph.of(tasks, outside).topologicalOrder();
        } catch (DependencyCycleException e) {
            errors.add(new GateError(GateErrorKind.DEPENDENCY_CYCLE, SchemaName.TODO.wireName(), e.getMessage()));
        }
    }

    private List<String> verifyEvidence(List<Task> tasks, List<Evidence> evidence, List<GateError> errors) {
        Map<String, Task> owners = new HashMap<>();
        for (Task task : tasks) {
            owners.putIfAbsent(task.metadata().evidenceLocation(), task);
        }
        var proven = new ArrayList<String>();
        for (Evidence e : evidence) {
            if (!e.verified()) {
                continue;
            }
            if (e.location() == null || e.location().isBlank()) {
                errors.add(new GateError(GateErrorKind.FABRICATION, SchemaName.EVIDENCE.wireName(),
                        "Evidence " + e.id() + " claims verification without an artifact"));
                continue;
            }
            Task owner = owners.get(e.location());
            String criteria = owner != null ? owner.metadata().successCriteria() : e.claim();
            VerificationResult result = verifier.verify(e, criteria);
            if (result.proven()) {
                proven.add(e.id());
            } else {
                GateErrorKind kind = result.reason() == VerificationFailure.MISSING_FILE
                        ? GateErrorKind.MISSING_EVIDENCE : GateErrorKind.UNPROVEN_CLAIM;
                errors.add(new GateError(kind, SchemaName.EVIDENCE.wireName(),
                        result.detail() + " (" + e.id() + ")"));
            }
        }
        return proven;
    }

    private void checkTaskOutcomes(List<Task> tasks, List<Evidence> evidence, List<GateError> errors) {
        Set<String> locations = new HashSet<>();
        for (Evidence e : evidence) {
            locations.add(e.location());
        }
        for (Task task : tasks) {
            if (task.status() == TaskStatus.COMPLETED && !locations.contains(task.metadata().evidenceLocation())) {
                errors.add(new GateError(GateErrorKind.FABRICATION, SchemaName.TODO.wireName(),
                        String.format("Task %s is completed but no evidence references %s",
                                task.id(), task.metadata().evidenceLocation())));
            } else if (task.status() == TaskStatus.FAILED || task.status() == TaskStatus.BLOCKED) {
                errors.add(new GateError(GateErrorKind.UNPROVEN_CLAIM, SchemaName.TODO.wireName(),
                        String.format("Task %s ended %s; '%s' is unproven",
                                task.id(), task.status().wireName(), task.metadata().successCriteria())));
            }
        }
    }

    private void checkReviews(List<ReviewGate> reviews, List<GateError> errors) {
        for (ReviewGate review : reviews) {
            if (!review.approved() || review.action() != ReviewAction.PROCEED) {
                errors.add(new GateError(GateErrorKind.EXTERNAL_REJECTION, SchemaName.REVIEW_GATE.wireName(),
                        String.format("Review by %s not approved (action=%s)",
                                review.agent(), review.action().wireName())));
            }
        }
    }

    private void consultReviewer(Stage stage, List<JsonNode> outputs, List<GateError> errors) {
        String schema = "review";
        if (reviewer == null) {
            errors.add(new GateError(GateErrorKind.EXTERNAL_REJECTION, schema,
                    "No external reviewer available for " + stage.gateName()));
            return;
        }
        var findings = errors.stream().map(GateError::render).toList();
        var evidencePackage = new EvidencePackage(stage.gateName(), outputs, findings);
        long timeoutMs = policy.reviewerTimeout().toMillis();
        CompletableFuture<ReviewVerdict> call =
                CompletableFuture.supplyAsync(() -> reviewer.review(evidencePackage), reviewerExecutor);
        try {
            ReviewVerdict verdict = call.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (verdict == null || !verdict.approved()) {
                String reasons = verdict == null || verdict.reasons().isEmpty()
                        ? "no reason given" : String.join("; ", verdict.reasons());
                log.warn("External reviewer rejected {}: {}", stage, reasons);
                errors.add(new GateError(GateErrorKind.EXTERNAL_REJECTION, schema,
                        "External reviewer rejected " + stage.gateName() + ": " + reasons));
            }
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("External reviewer timed out after {} ms at {}", timeoutMs, stage);
            errors.add(new GateError(GateErrorKind.EXTERNAL_REJECTION, schema,
                    String.format("External reviewer timed out after %ds", policy.reviewerTimeout().toSeconds())));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("External reviewer failed at {}: {}", stage, cause.getMessage(), cause);
            errors.add(new GateError(GateErrorKind.EXTERNAL_REJECTION, schema,
                    "External reviewer failed: " + cause.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errors.add(new GateError(GateErrorKind.EXTERNAL_REJECTION, schema,
                    "Interrupted while waiting for the external reviewer"));
        }
    }

    private static String recordLabel(JsonNode node, int index) {
        JsonNode body = node.size() == 1 && node.elements().next().isObject() ? node.elements().next() : node;
        JsonNode id = body.get("id");
        if (id != null && id.isTextual() && !id.asText().isBlank()) {
            return id.asText() + ": ";
        }
        return "Record #" + (index + 1) + ": ";
    }
}
