package com.stagegate.core.engine;

import com.stagegate.core.model.Stage;
import com.stagegate.core.qualitygate.GateAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TransitionTable}.
 */
class TransitionTableTest {

    private final TransitionTable table = TransitionTable.standard();

    @Test
    @DisplayName("proceeding from startup walks every stage once and completes")
    void proceedWalksThePipeline() {
        var visited = new ArrayList<PipelineState>();
        PipelineState state = PipelineState.STARTUP;
        while (!state.isTerminal()) {
            state = table.next(state, GateAction.PROCEED);
            visited.add(state);
        }

        assertEquals(List.of(PipelineState.PLAN, PipelineState.REVIEW, PipelineState.DISRUPT,
                PipelineState.IMPLEMENT, PipelineState.TEST, PipelineState.REVIEW_POST,
                PipelineState.VALIDATE, PipelineState.LEARN, PipelineState.COMPLETE), visited);
    }

    @Test
    @DisplayName("revise and escalate stay in the same stage")
    void retryActionsStayPut() {
        assertEquals(PipelineState.TEST, table.next(PipelineState.TEST, GateAction.REVISE));
        assertEquals(PipelineState.REVIEW_POST, table.next(PipelineState.REVIEW_POST, GateAction.ESCALATE));
    }

    @Test
    @DisplayName("stop aborts from any non-terminal state")
    void stopAborts() {
        for (PipelineState state : PipelineState.values()) {
            if (!state.isTerminal()) {
                assertEquals(PipelineState.ABORTED, table.next(state, GateAction.STOP), state.name());
            }
        }
    }

    @Test
    @DisplayName("startup cannot be revised or escalated")
    void startupHasNoRetries() {
        assertFalse(table.allows(PipelineState.STARTUP, GateAction.REVISE));
        var ex = assertThrows(IllegalTransitionException.class,
                () -> table.next(PipelineState.STARTUP, GateAction.ESCALATE));
        assertEquals("No transition from STARTUP on ESCALATE", ex.getMessage());
    }

    @Test
    @DisplayName("terminal states have no exits")
    void terminalStatesAreFinal() {
        assertTrue(table.exits(PipelineState.COMPLETE).isEmpty());
        assertTrue(table.exits(PipelineState.ABORTED).isEmpty());
        assertThrows(IllegalTransitionException.class, () -> table.next(PipelineState.COMPLETE, GateAction.PROCEED));
    }

    @Test
    @DisplayName("each stage maps to its own state, including the second review")
    void stageStates() {
        assertEquals(PipelineState.REVIEW_POST, PipelineState.of(Stage.REVIEW_POST));
        assertEquals(Stage.REVIEW_POST, PipelineState.REVIEW_POST.stage().orElseThrow());
        assertTrue(PipelineState.STARTUP.stage().isEmpty());
    }
}
