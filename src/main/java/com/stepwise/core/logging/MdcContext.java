package com.stepwise.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Stepwise MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setGroup(String runId, int groupIndex) {
        MDC.put("runId", runId);
        MDC.put("groupIndex", String.valueOf(groupIndex));
    }

    public static void setTask(String runId, int groupIndex, String taskId, String phase) {
        setGroup(runId, groupIndex);
        MDC.put("taskId", taskId);
        MDC.put("phase", phase);
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("groupIndex");
        MDC.remove("taskId");
        MDC.remove("phase");
    }
}
