package com.stagegate.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stagegate.core.RecordFixtures;
import com.stagegate.core.model.Evidence;
import com.stagegate.core.model.Stage;
import com.stagegate.core.model.Task;
import com.stagegate.core.model.VerifiedBy;
import com.stagegate.core.store.RecordCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SchemaValidator}.
 */
class SchemaValidatorTest {

    private SchemaValidator validator;
    private RecordCodec codec;

    @BeforeEach
    void setUp() {
        validator = new SchemaValidator();
        codec = RecordFixtures.codec();
    }

    private ObjectNode validTask() {
        return codec.toTree(RecordFixtures.pendingTask("T-1", Stage.IMPLEMENT, "out/t1.log"));
    }

    private static void rename(JsonNode node, String from, String to) {
        ObjectNode object = (ObjectNode) node;
        object.set(to, object.remove(from));
    }

    @Nested
    @DisplayName("todo")
    class TodoTests {

        @Test
        @DisplayName("accepts a task with all 17 fields")
        void acceptsCompleteTask() {
            ValidationResult result = validator.validate(validTask(), "todo");

            assertTrue(result.ok(), () -> "unexpected errors: " + result.errors());
            assertEquals(17, validator.countTaskFields(validTask()));
        }

        @Test
        @DisplayName("reports a missing top-level field")
        void reportsMissingTopLevelField() {
            ObjectNode task = validTask();
            task.remove("priority");

            ValidationResult result = validator.validate(task, SchemaName.TODO);

            assertFalse(result.ok());
            assertTrue(result.errors().contains("Missing required field: priority"));
        }

        @Test
        @DisplayName("treats an empty string as missing")
        void emptyStringIsMissing() {
            ObjectNode task = validTask();
            task.put("content", "");

            ValidationResult result = validator.validate(task, SchemaName.TODO);

            assertTrue(result.errors().contains("Missing required field: content"));
        }

        @Test
        @DisplayName("accepts the older metadata field names and binds them")
        void acceptsOlderMetadataNames() {
            ObjectNode task = validTask();
            JsonNode metadata = task.get("metadata");
            rename(metadata, "agent_model", "responsible_agent");
            rename(metadata, "workflow", "workflow_path");
            rename(metadata, "workflow_stage", "current_stage");
            rename(metadata, "instructions_set", "instruction_set");

            ValidationResult result = validator.validate(task, SchemaName.TODO);

            assertTrue(result.ok(), () -> result.errors().toString());
            assertTrue(task.get("metadata").has("responsible_agent"));
            Task bound = codec.toRecord(task, Task.class);
            assertEquals(Stage.IMPLEMENT, bound.metadata().currentStage());
            assertEquals("default", bound.metadata().instructionSet());
        }

        @Test
        @DisplayName("an older metadata name still has to hold an allowed value")
        void olderMetadataNameChecksEnum() {
            ObjectNode task = validTask();
            ObjectNode metadata = (ObjectNode) task.get("metadata");
            metadata.remove("workflow_stage");
            metadata.put("current_stage", "SHIP");

            ValidationResult result = validator.validate(task, SchemaName.TODO);

            assertEquals(1, result.errors().size());
            assertTrue(result.errors().get(0).startsWith("metadata.workflow_stage: 'SHIP' not in"));
        }

        @Test
        @DisplayName("reports a missing metadata field without a field-count error")
        void reportsMissingMetadataField() {
            ObjectNode task = validTask();
            ((ObjectNode) task.get("metadata")).remove("reviewer");

            ValidationResult result = validator.validate(task, SchemaName.TODO);

            assertEquals(1, result.errors().size(), () -> result.errors().toString());
            assertEquals("Missing metadata field: reviewer", result.errors().get(0));
        }

        @Test
        @DisplayName("rejects an enum value outside the allowed set")
        void rejectsBadEnum() {
            ObjectNode task = validTask();
            task.put("status", "done");

            ValidationResult result = validator.validate(task, SchemaName.TODO);

            assertEquals(1, result.errors().size());
            assertTrue(result.errors().get(0).startsWith("status: 'done' not in"));
        }

        @Test
        @DisplayName("rejects an agent model outside the known families")
        void rejectsUnknownAgentModel() {
            ObjectNode task = validTask();
            ((ObjectNode) task.get("metadata")).put("agent_model", "Gemini");

            ValidationResult result = validator.validate(task, SchemaName.TODO);

            assertTrue(result.errors().get(0).startsWith("metadata.agent_model: 'Gemini' not in"));
        }

        @Test
        @DisplayName("reports a wrong value type")
        void reportsWrongType() {
            ObjectNode task = validTask();
            ((ObjectNode) task.get("metadata")).put("parallel", "yes");

            ValidationResult result = validator.validate(task, SchemaName.TODO);

            assertEquals(1, result.errors().size());
            assertTrue(result.errors().get(0).startsWith("metadata.parallel: expected"));
        }

        @Test
        @DisplayName("reports an extra field through the field count")
        void reportsExtraField() {
            ObjectNode task = validTask();
            task.put("owner", "someone");

            ValidationResult result = validator.validate(task, SchemaName.TODO);

            assertEquals("Field count: 18 (expected 17)", result.errors().get(0));
        }
    }

    @Nested
    @DisplayName("evidence and ids")
    class EvidenceTests {

        @Test
        @DisplayName("accepts a well-formed evidence id")
        void acceptsEvidenceId() {
            JsonNode evidence = codec.toTree(
                    RecordFixtures.evidence("E-IMPLEMENT-20250115-001", "out/t1.log", "built"));

            assertTrue(validator.validate(evidence, SchemaName.EVIDENCE).ok());
        }

        @Test
        @DisplayName("rejects a malformed evidence id")
        void rejectsMalformedEvidenceId() {
            JsonNode evidence = codec.toTree(RecordFixtures.evidence("evidence-1", "out/t1.log", "built"));

            ValidationResult result = validator.validate(evidence, SchemaName.EVIDENCE);

            assertEquals(1, result.errors().size());
            assertTrue(result.errors().get(0).startsWith("id: pattern mismatch"));
        }

        @Test
        @DisplayName("accepts a conflict with a timestamped id")
        void acceptsConflict() {
            assertTrue(validator.validate(codec.toTree(RecordFixtures.conflict()), SchemaName.CONFLICT).ok());
        }

        @Test
        @DisplayName("accepts human and external-reviewer as verifiers")
        void acceptsVerifierSynonyms() {
            ObjectNode evidence = codec.toTree(
                    RecordFixtures.evidence("E-IMPLEMENT-20250115-001", "out/t1.log", "built"));

            evidence.put("verified_by", "human");
            assertTrue(validator.validate(evidence, SchemaName.EVIDENCE).ok());
            assertEquals(VerifiedBy.USER, codec.toRecord(evidence, Evidence.class).verifiedBy());

            evidence.put("verified_by", "external-reviewer");
            assertTrue(validator.validate(evidence, SchemaName.EVIDENCE).ok());
            assertEquals(VerifiedBy.THIRD_PARTY, codec.toRecord(evidence, Evidence.class).verifiedBy());

            evidence.put("verified_by", "robot");
            assertEquals(1, validator.validate(evidence, SchemaName.EVIDENCE).errors().size());
        }

        @Test
        @DisplayName("treats an empty required list as missing")
        void emptyListIsMissing() {
            ObjectNode conflict = codec.toTree(RecordFixtures.conflict());
            conflict.putArray("parties");
            ObjectNode review = codec.toTree(RecordFixtures.review(Stage.REVIEW, true));
            review.putArray("criteria_checked");

            assertEquals(List.of("Missing required field: parties"),
                    validator.validate(conflict, SchemaName.CONFLICT).errors());
            assertEquals(List.of("Missing required field: criteria_checked"),
                    validator.validate(review, SchemaName.REVIEW_GATE).errors());
        }

        @Test
        @DisplayName("accepts a handoff written with the older field names")
        void acceptsOlderHandoffNames() {
            ObjectNode handoff = (ObjectNode) codec.parse("""
                    {"kind": "handoff", "from": "Haiku", "to": "Sonnet", "timestamp": "2025-01-15T10:30:00Z",
                     "context": {"objective": "Ship it", "current_stage": "IMPLEMENT", "completed_stages": [],
                                 "pending_tasks": ["T-1"], "evidence_refs": [], "blockers": [],
                                 "assumptions": [], "memory_refs": []}}
                    """);

            ValidationResult result = validator.validate(handoff, SchemaName.HANDOFF);

            assertTrue(result.ok(), () -> result.errors().toString());
        }
    }

    @Nested
    @DisplayName("schema detection")
    class DetectionTests {

        @Test
        @DisplayName("uses the kind discriminator")
        void usesKind() {
            assertEquals(SchemaName.METRICS,
                    validator.detectSchema(codec.toTree(RecordFixtures.metrics("run-1"))).orElseThrow());
        }

        @Test
        @DisplayName("unwraps a legacy envelope")
        void unwrapsEnvelope() {
            JsonNode body = codec.toTree(RecordFixtures.conflict());
            ((ObjectNode) body).remove("kind");
            ObjectNode wrapped = codec.mapper().createObjectNode();
            wrapped.set("conflict", body);

            assertEquals(SchemaName.CONFLICT, validator.detectSchema(wrapped).orElseThrow());
            assertTrue(validator.validate(wrapped, SchemaName.CONFLICT).ok());
        }

        @Test
        @DisplayName("recognises a bare task by its metadata objective")
        void detectsBareTask() {
            ObjectNode task = validTask();
            task.remove("kind");

            assertEquals(SchemaName.TODO, validator.detectSchema(task).orElseThrow());
        }

        @Test
        @DisplayName("returns empty for an unrecognisable record")
        void unknownRecord() {
            assertTrue(validator.detectSchema(codec.parse("{\"foo\": 1, \"bar\": 2}")).isEmpty());
        }
    }

    @Test
    @DisplayName("unknown schema name yields a single error and no schema")
    void unknownSchemaName() {
        ValidationResult result = validator.validate(validTask(), "nonsense");

        assertFalse(result.schemaKnown());
        assertFalse(result.ok());
        assertEquals("Unknown schema: nonsense", result.errors().get(0));
    }

    @Test
    @DisplayName("non-object input is rejected")
    void nonObjectRejected() {
        ValidationResult result = validator.validate(codec.parse("[1, 2]"), SchemaName.SKILL);

        assertEquals("Record is not a JSON object", result.errors().get(0));
    }
}
