package com.waveforge.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Waveforge-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPhase(String phaseId) {
        MDC.put("phaseId", phaseId);
    }

    public static void setWave(String phaseId, int waveId) {
        MDC.put("phaseId", phaseId);
        MDC.put("waveId", String.valueOf(waveId));
    }

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void clearTask() {
        MDC.remove("taskId");
    }

    public static void clear() {
        MDC.remove("phaseId");
        MDC.remove("waveId");
        MDC.remove("taskId");
    }
}
