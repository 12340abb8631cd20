package com.stagegate.core.config;

import com.stagegate.core.model.Stage;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Settings bound from {@code stagegate.*}.
 */
@Component
@ConfigurationProperties(prefix = "stagegate")
public class StageGateProperties {

    private String runRoot = ".workflow";
    private Gate gate = new Gate();
    private Evidence evidence = new Evidence();
    private Dispatch dispatch = new Dispatch();
    private Liveness liveness = new Liveness();
    private Agents agents = new Agents();
    private Reviewer reviewer = new Reviewer();
    private Startup startup = new Startup();
    private TestRunner testRunner = new TestRunner();
    private Plan plan = new Plan();

    public String getRunRoot() { return runRoot; }
    public void setRunRoot(String runRoot) { this.runRoot = runRoot; }
    public Gate getGate() { return gate; }
    public void setGate(Gate gate) { this.gate = gate; }
    public Evidence getEvidence() { return evidence; }
    public void setEvidence(Evidence evidence) { this.evidence = evidence; }
    public Dispatch getDispatch() { return dispatch; }
    public void setDispatch(Dispatch dispatch) { this.dispatch = dispatch; }
    public Liveness getLiveness() { return liveness; }
    public void setLiveness(Liveness liveness) { this.liveness = liveness; }
    public Agents getAgents() { return agents; }
    public void setAgents(Agents agents) { this.agents = agents; }
    public Reviewer getReviewer() { return reviewer; }
    public void setReviewer(Reviewer reviewer) { this.reviewer = reviewer; }
    public Startup getStartup() { return startup; }
    public void setStartup(Startup startup) { this.startup = startup; }
    public TestRunner getTestRunner() { return testRunner; }
    public void setTestRunner(TestRunner testRunner) { this.testRunner = testRunner; }
    public Plan getPlan() { return plan; }
    public void setPlan(Plan plan) { this.plan = plan; }

    public static class Gate {
        private int maxRetry = 3;
        private int errorCeiling = 10;
        private int fabricationRetryLimit = 1;
        private Duration reviewerTimeout = Duration.ofSeconds(300);

        public int getMaxRetry() { return maxRetry; }
        public void setMaxRetry(int maxRetry) { this.maxRetry = maxRetry; }
        public int getErrorCeiling() { return errorCeiling; }
        public void setErrorCeiling(int errorCeiling) { this.errorCeiling = errorCeiling; }
        public int getFabricationRetryLimit() { return fabricationRetryLimit; }
        public void setFabricationRetryLimit(int fabricationRetryLimit) { this.fabricationRetryLimit = fabricationRetryLimit; }
        public Duration getReviewerTimeout() { return reviewerTimeout; }
        public void setReviewerTimeout(Duration reviewerTimeout) { this.reviewerTimeout = reviewerTimeout; }
    }

    public static class Evidence {
        private List<String> failureMarkers = new ArrayList<>(List.of("error", "exception", "traceback"));
        /** Zero disables the freshness check. */
        private Duration maxAge = Duration.ZERO;

        public List<String> getFailureMarkers() { return failureMarkers; }
        public void setFailureMarkers(List<String> failureMarkers) { this.failureMarkers = failureMarkers; }
        public Duration getMaxAge() { return maxAge; }
        public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }
    }

    public static class Dispatch {
        private int parallelThreshold = 3;
        private int workerPoolWidth = 5;

        public int getParallelThreshold() { return parallelThreshold; }
        public void setParallelThreshold(int parallelThreshold) { this.parallelThreshold = parallelThreshold; }
        public int getWorkerPoolWidth() { return workerPoolWidth; }
        public void setWorkerPoolWidth(int workerPoolWidth) { this.workerPoolWidth = workerPoolWidth; }
    }

    public static class Liveness {
        private Duration interval = Duration.ofMinutes(5);

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
    }

    public static class Agents {
        private List<String> ladder = new ArrayList<>(List.of("Haiku", "Sonnet", "Opus", "Human"));
        private Map<Stage, String> stageDefaults = new EnumMap<>(Stage.class);

        public List<String> getLadder() { return ladder; }
        public void setLadder(List<String> ladder) { this.ladder = ladder; }
        public Map<Stage, String> getStageDefaults() { return stageDefaults; }
        public void setStageDefaults(Map<Stage, String> stageDefaults) { this.stageDefaults = stageDefaults; }
    }

    public static class Reviewer {
        /** {@code http}, {@code console} or {@code approve}. */
        private String mode = "console";
        private String url;

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
    }

    public static class Startup {
        private List<String> probes = new ArrayList<>();
        private Duration probeTimeout = Duration.ofSeconds(5);

        public List<String> getProbes() { return probes; }
        public void setProbes(List<String> probes) { this.probes = probes; }
        public Duration getProbeTimeout() { return probeTimeout; }
        public void setProbeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; }
    }

    public static class TestRunner {
        private String command = "mvn -q test";
        private Duration timeout = Duration.ofMinutes(30);

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Plan {
        private String file = "plan.json";
        private boolean autoApprove = false;

        public String getFile() { return file; }
        public void setFile(String file) { this.file = file; }
        public boolean isAutoApprove() { return autoApprove; }
        public void setAutoApprove(boolean autoApprove) { this.autoApprove = autoApprove; }
    }
}
