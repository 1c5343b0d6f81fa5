package com.keystone.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for workflow orchestration.
 */
@Service
public class KeystoneMetrics {

    private final MeterRegistry registry;

    @Autowired
    public KeystoneMetrics(ObjectProvider<MeterRegistry> registry) {
        this(registry.getIfAvailable(SimpleMeterRegistry::new));
    }

    public KeystoneMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() {
        return registry;
    }

    public void recordClassification(String type, String complexity) {
        Counter.builder("keystone.tasks.classified")
                .tag("type", type)
                .tag("complexity", complexity)
                .register(registry)
                .increment();
    }

    public void recordStepExecution(String role, long ms) {
        Timer.builder("keystone.step.duration")
                .tag("role", role)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGateResult(String verdict) {
        Counter.builder("keystone.gate.evaluations")
                .tag("verdict", verdict)
                .register(registry)
                .increment();
    }

    public void recordGateScore(double score) {
        DistributionSummary.builder("keystone.gate.score")
                .register(registry)
                .record(score);
    }

    /**
     * Records a step moved to an alternate role after its original role failed.
     *
     * @param fromRole role that exhausted its attempts or was unavailable
     * @param toRole   alternate role chosen by the fallback matrix
     */
    public void recordFallback(String fromRole, String toRole) {
        Counter.builder("keystone.fallbacks.total")
                .tag("from", fromRole)
                .tag("to", toRole)
                .register(registry)
                .increment();
    }

    public void recordConflict(String severity, String outcome) {
        Counter.builder("keystone.conflicts.total")
                .description("Conflicts between concurrent outputs")
                .tag("severity", severity)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordIntegrityDiscrepancies(int count) {
        Counter.builder("keystone.registry.discrepancies")
                .register(registry)
                .increment(count);
    }

    public void recordHandoff(int generation) {
        Counter.builder("keystone.handoffs.total")
                .register(registry)
                .increment();
        DistributionSummary.builder("keystone.handoff.generation")
                .register(registry)
                .record(generation);
    }

    public void recordWaveExecution(int stepCount) {
        Counter.builder("keystone.wave.executions")
                .register(registry)
                .increment();
        DistributionSummary.builder("keystone.wave.step_count")
                .description("Number of steps per wave")
                .register(registry)
                .record(stepCount);
    }

    public void recordWorkflowResult(String status) {
        Counter.builder("keystone.workflows.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordIssue(String kind) {
        Counter.builder("keystone.issues.total")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}
