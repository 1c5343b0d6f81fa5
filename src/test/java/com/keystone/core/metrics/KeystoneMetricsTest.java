package com.keystone.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeystoneMetricsTest {

    private SimpleMeterRegistry registry;
    private KeystoneMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new KeystoneMetrics(registry);
    }

    @Test
    @DisplayName("recordGateResult counts by verdict")
    void recordGateResult() {
        metrics.recordGateResult("PASS");
        metrics.recordGateResult("PASS");
        metrics.recordGateResult("FAIL");

        assertEquals(2.0, registry.find("keystone.gate.evaluations").tag("verdict", "PASS").counter().count());
        assertEquals(1.0, registry.find("keystone.gate.evaluations").tag("verdict", "FAIL").counter().count());
    }

    @Test
    @DisplayName("recordStepExecution records a timer per role")
    void recordStepExecution() {
        metrics.recordStepExecution("developer", 200);
        metrics.recordStepExecution("qa", 100);

        var timer = registry.find("keystone.step.duration").tag("role", "developer").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordFallback tags source and target role")
    void recordFallback() {
        metrics.recordFallback("developer", "architect");

        var counter = registry.find("keystone.fallbacks.total")
                .tag("from", "developer").tag("to", "architect").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordHandoff counts handoffs and records the generation")
    void recordHandoff() {
        metrics.recordHandoff(1);
        metrics.recordHandoff(2);

        assertEquals(2.0, registry.find("keystone.handoffs.total").counter().count());
        assertEquals(3.0, registry.find("keystone.handoff.generation").summary().totalAmount());
    }

    @Test
    @DisplayName("recordIntegrityDiscrepancies increments by count")
    void recordIntegrityDiscrepancies() {
        metrics.recordIntegrityDiscrepancies(3);

        assertEquals(3.0, registry.find("keystone.registry.discrepancies").counter().count());
    }

    @Test
    @DisplayName("recordWorkflowResult counts by status")
    void recordWorkflowResult() {
        metrics.recordWorkflowResult("COMPLETED");
        metrics.recordWorkflowResult("BLOCKED");

        assertEquals(1.0, registry.find("keystone.workflows.total").tag("status", "BLOCKED").counter().count());
    }
}
