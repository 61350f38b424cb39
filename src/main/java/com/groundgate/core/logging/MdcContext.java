package com.groundgate.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Groundgate-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String rootTaskId) {
        MDC.put("rootTaskId", rootTaskId);
    }

    public static void setTask(String rootTaskId, String taskId) {
        MDC.put("rootTaskId", rootTaskId);
        MDC.put("taskId", taskId);
        MDC.remove("attempt");
    }

    public static void setAttempt(int attempt) {
        MDC.put("attempt", String.valueOf(attempt));
    }

    public static void clearTask() {
        MDC.remove("taskId");
        MDC.remove("attempt");
    }

    public static void clear() {
        MDC.remove("rootTaskId");
        MDC.remove("taskId");
        MDC.remove("attempt");
    }
}
