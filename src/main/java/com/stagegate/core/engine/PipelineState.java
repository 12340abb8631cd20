package com.stagegate.core.engine;

import com.stagegate.core.model.Stage;

import java.util.Optional;

/**
 * Position of a run in the fixed pipeline. Every stage occurrence has a state of its own,
 * framed by STARTUP and the two terminal states.
 */
public enum PipelineState {
    STARTUP(null),
    PLAN(Stage.PLAN),
    REVIEW(Stage.REVIEW),
    DISRUPT(Stage.DISRUPT),
    IMPLEMENT(Stage.IMPLEMENT),
    TEST(Stage.TEST),
    REVIEW_POST(Stage.REVIEW_POST),
    VALIDATE(Stage.VALIDATE),
    LEARN(Stage.LEARN),
    COMPLETE(null),
    ABORTED(null);

    private final Stage stage;

    PipelineState(Stage stage) {
        this.stage = stage;
    }

    public Optional<Stage> stage() {
        return Optional.ofNullable(stage);
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ABORTED;
    }

    public static PipelineState of(Stage stage) {
        for (PipelineState state : values()) {
            if (state.stage == stage) {
                return state;
            }
        }
        throw new IllegalArgumentException("No pipeline state for stage " + stage);
    }
}
