package com.keystone.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setStep puts workflowId, stepId and role in MDC")
    void setStep() {
        MdcContext.setStep("WF-1", "STEP-001", "developer");
        assertEquals("WF-1", MDC.get("workflowId"));
        assertEquals("STEP-001", MDC.get("stepId"));
        assertEquals("developer", MDC.get("role"));
    }

    @Test
    @DisplayName("setWave puts workflowId and wave in MDC")
    void setWave() {
        MdcContext.setWave("WF-1", 3);
        assertEquals("WF-1", MDC.get("workflowId"));
        assertEquals("3", MDC.get("wave"));
    }

    @Test
    @DisplayName("clear removes all keystone MDC keys")
    void clear() {
        MdcContext.setStep("WF-1", "STEP-001", "developer");
        MdcContext.setWave("WF-1", 2);
        MdcContext.clear();
        assertNull(MDC.get("workflowId"));
        assertNull(MDC.get("stepId"));
        assertNull(MDC.get("role"));
        assertNull(MDC.get("wave"));
    }

    @Test
    @DisplayName("propagate carries the caller's MDC to a pool thread and restores it afterwards")
    void propagate() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            pool.submit(() -> MDC.put("workflowId", "WF-pool")).get();
            MdcContext.setStep("WF-1", "STEP-002", "qa");

            String seen = CompletableFuture.supplyAsync(
                    MdcContext.propagate(() -> MDC.get("workflowId") + "/" + MDC.get("stepId")), pool).get();
            String after = pool.submit(() -> MDC.get("workflowId")).get();

            assertEquals("WF-1/STEP-002", seen);
            assertEquals("WF-pool", after);
        } finally {
            pool.shutdownNow();
        }
    }
}
