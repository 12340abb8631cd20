package com.stagegate.core.engine;

import com.stagegate.core.config.StageGateProperties;
import com.stagegate.core.model.Stage;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered agent tiers used for escalation, plus the tier each stage starts with.
 */
public class AgentLadder {

    private final List<String> rungs;
    private final Map<Stage, String> stageDefaults;

    public AgentLadder(List<String> rungs, Map<Stage, String> stageDefaults) {
        if (rungs == null || rungs.isEmpty()) {
            throw new IllegalArgumentException("Agent ladder needs at least one rung");
        }
        this.rungs = List.copyOf(rungs);
        this.stageDefaults = stageDefaults == null || stageDefaults.isEmpty()
                ? Map.of() : new EnumMap<>(stageDefaults);
    }

    public static AgentLadder from(StageGateProperties properties) {
        return new AgentLadder(properties.getAgents().getLadder(), properties.getAgents().getStageDefaults());
    }

    public String defaultFor(Stage stage) {
        return stageDefaults.getOrDefault(stage, rungs.get(0));
    }

    /**
     * The next more capable agent, or empty when {@code agent} is already the top rung.
     * An agent that is not on the ladder climbs to the bottom rung.
     */
    public Optional<String> above(String agent) {
        int index = rungs.indexOf(agent);
        if (index < 0) {
            return Optional.of(rungs.get(0));
        }
        return index + 1 < rungs.size() ? Optional.of(rungs.get(index + 1)) : Optional.empty();
    }

    public List<String> rungs() {
        return rungs;
    }
}
