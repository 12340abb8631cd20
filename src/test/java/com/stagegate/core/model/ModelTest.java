package com.stagegate.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.stagegate.core.RecordFixtures;
import com.stagegate.core.store.RecordCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wire names and lifecycle rules of the record model.
 */
class ModelTest {

    @Nested
    @DisplayName("Stage")
    class StageTests {

        @Test
        @DisplayName("both review occurrences share the REVIEW wire name")
        void reviewOccurrences() {
            assertEquals("REVIEW", Stage.REVIEW.gateName());
            assertEquals("REVIEW", Stage.REVIEW_POST.gateName());
            assertEquals("review_post", Stage.REVIEW_POST.instanceName());
        }

        @Test
        @DisplayName("parses wire names leniently")
        void parsesWireNames() {
            assertEquals(Stage.REVIEW_POST, Stage.fromWireName("review(post)"));
            assertEquals(Stage.REVIEW_POST, Stage.fromWireName("post-review"));
            assertEquals(Stage.IMPLEMENT, Stage.fromWireName(" implement "));
            assertThrows(IllegalArgumentException.class, () -> Stage.fromWireName("DEPLOY"));
        }

        @Test
        @DisplayName("only DISRUPT and VALIDATE need an external reviewer")
        void externalApproval() {
            for (Stage stage : Stage.values()) {
                assertEquals(stage == Stage.DISRUPT || stage == Stage.VALIDATE, stage.requiresExternalApproval(),
                        stage.name());
            }
        }
    }

    @Nested
    @DisplayName("TaskStatus")
    class TaskStatusTests {

        @Test
        @DisplayName("moves forward only")
        void transitions() {
            assertTrue(TaskStatus.PENDING.canTransitionTo(TaskStatus.IN_PROGRESS));
            assertFalse(TaskStatus.PENDING.canTransitionTo(TaskStatus.COMPLETED));
            assertTrue(TaskStatus.IN_PROGRESS.canTransitionTo(TaskStatus.BLOCKED));
            assertFalse(TaskStatus.COMPLETED.canTransitionTo(TaskStatus.IN_PROGRESS));
            assertFalse(TaskStatus.FAILED.canTransitionTo(TaskStatus.PENDING));
        }

        @Test
        @DisplayName("uses lower-case wire names")
        void wireNames() {
            assertEquals("in_progress", TaskStatus.IN_PROGRESS.wireName());
            assertEquals(TaskStatus.BLOCKED, TaskStatus.fromWireName("blocked"));
            assertTrue(TaskStatus.FAILED.isTerminal());
            assertFalse(TaskStatus.PENDING.isTerminal());
        }
    }

    @Nested
    @DisplayName("Task wire format")
    class TaskWireTests {

        private final RecordCodec codec = RecordFixtures.codec();

        @Test
        @DisplayName("serializes metadata under its wire names")
        void metadataWireNames() {
            Task task = RecordFixtures.task("T-1", Stage.TEST, TaskStatus.IN_PROGRESS, "out/t.txt", "T-0");

            JsonNode tree = codec.toTree(task);

            assertEquals("todo", tree.get("kind").asText());
            assertEquals("in_progress", tree.get("status").asText());
            JsonNode metadata = tree.get("metadata");
            assertEquals("TEST", metadata.get("workflow_stage").asText());
            assertEquals("Claude", metadata.get("agent_model").asText());
            assertEquals("T-0", metadata.get("blocked_by").get(0).asText());
            assertEquals(TaskMetadata.FIELD_COUNT, metadata.size());
        }

        @Test
        @DisplayName("binds a task back from its JSON form")
        void bindsBack() {
            Task task = RecordFixtures.pendingTask("T-1", Stage.IMPLEMENT, "out/t.log");

            Task bound = codec.toRecord(codec.parse(codec.toJson(codec.toTree(task))), Task.class);

            assertEquals(task, bound);
            assertFalse(bound.hasDependencies());
        }
    }
}
