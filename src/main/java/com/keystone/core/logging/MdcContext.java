package com.keystone.core.logging;

import org.slf4j.MDC;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Utility for managing Keystone-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setWorkflow(String workflowId) {
        MDC.put("workflowId", workflowId);
    }

    public static void setStep(String workflowId, String stepId, String role) {
        MDC.put("workflowId", workflowId);
        MDC.put("stepId", stepId);
        MDC.put("role", role);
    }

    public static void setWave(String workflowId, int wave) {
        MDC.put("workflowId", workflowId);
        MDC.put("wave", String.valueOf(wave));
    }

    public static void clear() {
        MDC.remove("workflowId");
        MDC.remove("stepId");
        MDC.remove("role");
        MDC.remove("wave");
    }

    /**
     * Wraps a task so it runs with the caller's MDC on a pool thread.
     */
    public static <T> Supplier<T> propagate(Supplier<T> task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (captured != null) MDC.setContextMap(captured);
            try {
                return task.get();
            } finally {
                if (previous != null) MDC.setContextMap(previous); else MDC.clear();
            }
        };
    }
}
