package com.stagegate.core.engine;

import com.stagegate.core.qualitygate.GateAction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Explicit (state, gate action) to next-state table for the pipeline.
 * <p>
 * PROCEED moves to the following stage, REVISE and ESCALATE stay put, STOP aborts.
 * STARTUP only knows PROCEED and STOP; terminal states have no exits.
 */
public final class TransitionTable {

    private static final PipelineState[] SEQUENCE = {
        PipelineState.STARTUP,
        PipelineState.PLAN,
        PipelineState.REVIEW,
        PipelineState.DISRUPT,
        PipelineState.IMPLEMENT,
        PipelineState.TEST,
        PipelineState.REVIEW_POST,
        PipelineState.VALIDATE,
        PipelineState.LEARN,
        PipelineState.COMPLETE
    };

    private static final TransitionTable STANDARD = build();

    private final Map<PipelineState, Map<GateAction, PipelineState>> table;

    private TransitionTable(Map<PipelineState, Map<GateAction, PipelineState>> table) {
        this.table = table;
    }

    public static TransitionTable standard() {
        return STANDARD;
    }

    public PipelineState next(PipelineState from, GateAction action) {
        PipelineState next = table.getOrDefault(from, Map.of()).get(action);
        if (next == null) {
            throw new IllegalTransitionException(from, action);
        }
        return next;
    }

    public boolean allows(PipelineState from, GateAction action) {
        return table.getOrDefault(from, Map.of()).containsKey(action);
    }

    public Map<GateAction, PipelineState> exits(PipelineState from) {
        return table.getOrDefault(from, Map.of());
    }

    private static TransitionTable build() {
        var table = new EnumMap<PipelineState, Map<GateAction, PipelineState>>(PipelineState.class);
        for (int i = 0; i < SEQUENCE.length - 1; i++) {
            PipelineState state = SEQUENCE[i];
            var exits = new EnumMap<GateAction, PipelineState>(GateAction.class);
            exits.put(GateAction.PROCEED, SEQUENCE[i + 1]);
            if (state != PipelineState.STARTUP) {
                exits.put(GateAction.REVISE, state);
                exits.put(GateAction.ESCALATE, state);
            }
            exits.put(GateAction.STOP, PipelineState.ABORTED);
            table.put(state, Collections.unmodifiableMap(exits));
        }
        return new TransitionTable(Collections.unmodifiableMap(table));
    }
}
