package com.stagegate.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing run-scoped MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setStage(String runId, String stage, String agent) {
        MDC.put("runId", runId);
        MDC.put("stage", stage);
        if (agent != null) {
            MDC.put("agent", agent);
        }
    }

    public static void setTask(String runId, String stage, String taskId) {
        MDC.put("runId", runId);
        MDC.put("stage", stage);
        MDC.put("taskId", taskId);
    }

    public static void clearTask() {
        MDC.remove("taskId");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("stage");
        MDC.remove("taskId");
        MDC.remove("agent");
    }
}
