package com.stagegate.sandbox;

import com.stagegate.core.RecordFixtures;
import com.stagegate.core.collaborator.EvidencePackage;
import com.stagegate.core.collaborator.Plan;
import com.stagegate.core.collaborator.ReviewVerdict;
import com.stagegate.core.config.StageGateProperties;
import com.stagegate.core.model.Stage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the console-backed reviewer and plan approver.
 */
class ConsoleInteractionTest {

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    private ConsolePrompt prompt(String input) {
        return new ConsolePrompt(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    private static EvidencePackage evidencePackage() {
        return new EvidencePackage("VALIDATE", List.of(), List.of("MissingEvidence [evidence] gone"));
    }

    @Nested
    @DisplayName("ConsolePrompt")
    class PromptTests {

        @Test
        @DisplayName("re-asks until the answer is yes or no")
        void reasks() {
            ConsolePrompt prompt = prompt("maybe\nYES\n");

            assertEquals(true, prompt.confirm("Continue?").orElseThrow());
            assertTrue(printed().contains("Please answer y or n."));
        }

        @Test
        @DisplayName("closed input yields no answer")
        void closedInput() {
            assertTrue(prompt("").confirm("Continue?").isEmpty());
            assertTrue(prompt("").ask("Why?").isEmpty());
        }
    }

    @Nested
    @DisplayName("ConsoleExternalReviewer")
    class ReviewerTests {

        @Test
        @DisplayName("approves on yes and shows the findings")
        void approve() {
            ReviewVerdict verdict = new ConsoleExternalReviewer(prompt("y\n")).review(evidencePackage());

            assertTrue(verdict.approved());
            assertTrue(printed().contains("finding: MissingEvidence [evidence] gone"));
        }

        @Test
        @DisplayName("rejects on no with the given reason")
        void rejectWithReason() {
            ReviewVerdict verdict = new ConsoleExternalReviewer(prompt("n\nacceptance log is stale\n"))
                    .review(evidencePackage());

            assertFalse(verdict.approved());
            assertEquals(List.of("acceptance log is stale"), verdict.reasons());
        }

        @Test
        @DisplayName("no input is a rejection")
        void noInput() {
            ReviewVerdict verdict = new ConsoleExternalReviewer(prompt("")).review(evidencePackage());

            assertFalse(verdict.approved());
            assertEquals(List.of("No reviewer input"), verdict.reasons());
        }
    }

    @Nested
    @DisplayName("ConsolePlanApprover")
    class ApproverTests {

        private final Plan plan = new Plan(
                List.of(RecordFixtures.pendingTask("T-1", Stage.IMPLEMENT, "out/t1.log")), List.of(), List.of());

        @Test
        @DisplayName("lists the tasks and waits for a yes")
        void approves() {
            var approver = new ConsolePlanApprover(prompt("y\n"), new StageGateProperties());

            assertTrue(approver.awaitApproval(plan));
            assertTrue(printed().contains("Plan (1 tasks):"));
            assertTrue(printed().contains("T-1"));
        }

        @Test
        @DisplayName("closed input rejects the plan")
        void closedInputRejects() {
            assertFalse(new ConsolePlanApprover(prompt(""), new StageGateProperties()).awaitApproval(plan));
        }

        @Test
        @DisplayName("auto-approve skips the prompt")
        void autoApprove() {
            var properties = new StageGateProperties();
            properties.getPlan().setAutoApprove(true);

            assertTrue(new ConsolePlanApprover(prompt(""), properties).awaitApproval(plan));
            assertEquals("", printed());
        }
    }
}
