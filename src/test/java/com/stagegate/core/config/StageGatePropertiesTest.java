package com.stagegate.core.config;

import com.stagegate.core.model.Stage;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StageGatePropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new StageGateProperties();
        assertEquals(".workflow", props.getRunRoot());
        assertEquals(3, props.getGate().getMaxRetry());
        assertEquals(10, props.getGate().getErrorCeiling());
        assertEquals(1, props.getGate().getFabricationRetryLimit());
        assertEquals(Duration.ofSeconds(300), props.getGate().getReviewerTimeout());
        assertEquals(List.of("error", "exception", "traceback"), props.getEvidence().getFailureMarkers());
        assertEquals(3, props.getDispatch().getParallelThreshold());
        assertEquals(5, props.getDispatch().getWorkerPoolWidth());
        assertEquals(Duration.ofMinutes(5), props.getLiveness().getInterval());
        assertEquals("console", props.getReviewer().getMode());
        assertFalse(props.getPlan().isAutoApprove());
    }

    @Test
    void bindsRelaxedNames() {
        var source = new MapConfigurationPropertySource(Map.of(
                "stagegate.gate.max-retry", "5",
                "stagegate.evidence.max-age", "2h",
                "stagegate.agents.ladder", "Sonnet,Opus",
                "stagegate.agents.stage-defaults.REVIEW_POST", "Opus",
                "stagegate.test-runner.command", "gradle test"));

        StageGateProperties props = new Binder(source).bind("stagegate", StageGateProperties.class).get();

        assertEquals(5, props.getGate().getMaxRetry());
        assertEquals(Duration.ofHours(2), props.getEvidence().getMaxAge());
        assertEquals(List.of("Sonnet", "Opus"), props.getAgents().getLadder());
        assertEquals("Opus", props.getAgents().getStageDefaults().get(Stage.REVIEW_POST));
        assertEquals("gradle test", props.getTestRunner().getCommand());
    }
}
