package com.stagegate.core.schema;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static com.stagegate.core.schema.FieldType.BOOLEAN;
import static com.stagegate.core.schema.FieldType.INTEGER;
import static com.stagegate.core.schema.FieldType.LIST;
import static com.stagegate.core.schema.FieldType.OBJECT;

/**
 * The fixed rule set for every record kind. Field names and enum values match the
 * JSON written to run logs; the aliases and synonyms are the older names the record
 * types also accept when reading.
 */
public final class SchemaCatalog {

    public static final String EVIDENCE_ID_PATTERN = "^E-[A-Z]+-[\\w.]+-\\d{3}$";
    public static final String CONFLICT_ID_PATTERN = "^C-\\d{8}T\\d{6}$";
    public static final String RECOVERY_ID_PATTERN = "^R-\\d{8}T\\d{6}$";

    private static final String[] STAGES =
            {"PLAN", "REVIEW", "DISRUPT", "IMPLEMENT", "TEST", "VALIDATE", "LEARN"};
    private static final String[] EVIDENCE_TYPES =
            {"log", "output", "test_result", "diff", "screenshot", "api_response"};

    private static final Map<SchemaName, RecordSchema> SCHEMAS = new EnumMap<>(SchemaName.class);

    static {
        register(RecordSchema.builder(SchemaName.TODO)
                .required("id", "content", "status", "priority", "metadata")
                .nested("metadata",
                        "objective", "success_criteria", "fail_criteria", "evidence_required",
                        "evidence_location", "agent_model", "workflow", "blocked_by", "parallel",
                        "workflow_stage", "instructions_set", "time_budget", "reviewer")
                .oneOf("status", "pending", "in_progress", "completed", "blocked", "failed")
                .oneOf("priority", "high", "medium", "low")
                .oneOf("metadata.evidence_required", EVIDENCE_TYPES)
                .oneOf("metadata.workflow_stage", STAGES)
                .oneOf("metadata.agent_model", "Claude", "GPT", "Ollama")
                .type("metadata", OBJECT)
                .type("metadata.blocked_by", LIST)
                .type("metadata.parallel", BOOLEAN)
                .alias("metadata.responsible_agent", "agent_model")
                .alias("metadata.workflow_path", "workflow")
                .alias("metadata.current_stage", "workflow_stage")
                .alias("metadata.instruction_set", "instructions_set")
                .build());

        register(RecordSchema.builder(SchemaName.EVIDENCE)
                .required("id", "type", "claim", "location", "timestamp", "verified", "verified_by")
                .oneOf("type", EVIDENCE_TYPES)
                .oneOf("verified_by", "agent", "third-party", "user")
                .pattern("id", EVIDENCE_ID_PATTERN)
                .type("verified", BOOLEAN)
                .synonym("verified_by", "external-reviewer", "third-party")
                .synonym("verified_by", "human", "user")
                .build());

        register(RecordSchema.builder(SchemaName.REVIEW_GATE)
                .required("stage", "agent", "timestamp", "criteria_checked", "approved", "action")
                .oneOf("stage", STAGES)
                .oneOf("action", "proceed", "revise", "escalate")
                .type("criteria_checked", LIST)
                .type("approved", BOOLEAN)
                .alias("reviewing_agent", "agent")
                .build());

        register(RecordSchema.builder(SchemaName.CONFLICT)
                .required("id", "type", "parties", "positions")
                .oneOf("type", "plan_disagreement", "evidence_dispute", "priority_conflict", "resource_conflict")
                .pattern("id", CONFLICT_ID_PATTERN)
                .type("parties", LIST)
                .type("positions", LIST)
                .build());

        register(RecordSchema.builder(SchemaName.HANDOFF)
                .required("from_agent", "to_agent", "timestamp", "context")
                .nested("context",
                        "user_objective", "current_stage", "completed_stages", "todos_remaining",
                        "evidence_collected", "blockers", "assumptions", "memory_refs")
                .type("context", OBJECT)
                .type("context.completed_stages", LIST)
                .type("context.todos_remaining", LIST)
                .type("context.evidence_collected", LIST)
                .type("context.blockers", LIST)
                .type("context.assumptions", LIST)
                .type("context.memory_refs", LIST)
                .alias("from", "from_agent")
                .alias("to", "to_agent")
                .alias("context.objective", "user_objective")
                .alias("context.pending_tasks", "todos_remaining")
                .alias("context.evidence_refs", "evidence_collected")
                .build());

        register(RecordSchema.builder(SchemaName.RECOVERY)
                .required("id", "trigger", "rollback_to", "state_before", "state_after", "success", "resume_stage")
                .oneOf("resume_stage", STAGES)
                .pattern("id", RECOVERY_ID_PATTERN)
                .type("success", BOOLEAN)
                .build());

        register(RecordSchema.builder(SchemaName.METRICS)
                .required("workflow_id", "timestamp", "total_time_min", "stages", "agents", "evidence", "quality")
                .type("total_time_min", INTEGER)
                .type("stages", OBJECT)
                .type("agents", OBJECT)
                .type("evidence", OBJECT)
                .type("quality", OBJECT)
                .build());

        register(RecordSchema.builder(SchemaName.SKILL)
                .required("name", "source", "purpose", "interface", "tested", "evidence_location")
                .type("tested", BOOLEAN)
                .build());

        register(RecordSchema.builder(SchemaName.STARTUP)
                .required("mcp_verified", "scheduler_active", "memory_ok", "env_ready", "workflow_dir", "timestamp")
                .type("mcp_verified", BOOLEAN)
                .type("scheduler_active", BOOLEAN)
                .type("memory_ok", BOOLEAN)
                .type("env_ready", BOOLEAN)
                .alias("dependencies_verified", "mcp_verified")
                .build());
    }

    private SchemaCatalog() {
    }

    private static void register(RecordSchema schema) {
        SCHEMAS.put(schema.name(), schema);
    }

    public static RecordSchema get(SchemaName name) {
        return SCHEMAS.get(name);
    }

    public static Optional<RecordSchema> find(String wireName) {
        return SchemaName.fromWireName(wireName).map(SCHEMAS::get);
    }
}
