package com.keystone.core.engine;

import com.keystone.core.logging.MdcContext;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.model.Plan;
import com.keystone.core.model.Step;
import com.keystone.core.model.StepStatus;
import com.keystone.core.plan.InvalidPlanException;
import com.keystone.core.plan.PlanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dispatches all steps of a wave concurrently on a pool bounded at the concurrency limit and
 * waits for every step to settle. A step that throws is recorded as FAILED; the rest of the
 * wave is unaffected.
 */
@Component
public class WaveExecutor {

    private static final Logger log = LoggerFactory.getLogger(WaveExecutor.class);

    private final StepRunner runner;
    private final PlanStore planStore;
    private final KeystoneMetrics metrics;

    public WaveExecutor(StepRunner runner, PlanStore planStore, KeystoneMetrics metrics) {
        this.runner = runner;
        this.planStore = planStore;
        this.metrics = metrics;
    }

    public List<StepExecution> execute(RunContext ctx, Plan plan, List<Step> wave, int waveNumber, int maxParallel) {
        if (wave.isEmpty()) {
            return List.of();
        }
        MdcContext.setWave(ctx.workflowId(), waveNumber);
        log.info("Dispatching wave {} of {}: {}", waveNumber, ctx.workflowId(),
                wave.stream().map(Step::stepId).toList());
        ctx.publish("wave.started", null, Map.of("wave", waveNumber,
                "steps", wave.stream().map(Step::stepId).toList()));
        metrics.recordWaveExecution(wave.size());

        var counter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, Math.min(maxParallel, wave.size())), r -> {
            Thread t = new Thread(r, "wave-" + waveNumber + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            var futures = new ArrayList<CompletableFuture<StepExecution>>();
            for (Step step : wave) {
                futures.add(CompletableFuture.supplyAsync(
                        MdcContext.propagate(() -> runSafely(ctx, plan, step)), pool));
            }
            var results = futures.stream().map(CompletableFuture::join).toList();
            log.info("Wave {} settled: {}", waveNumber, results.stream()
                    .map(r -> r.stepId() + "=" + r.outcome()).toList());
            return results;
        } finally {
            pool.shutdown();
        }
    }

    private StepExecution runSafely(RunContext ctx, Plan plan, Step step) {
        try {
            return runner.run(ctx, plan, step);
        } catch (RuntimeException e) {
            log.error("Step {} failed unexpectedly: {}", step.stepId(), e.getMessage(), e);
            String reason = "unexpected failure: " + e.getMessage();
            try {
                planStore.updateStepStatus(ctx.workflowId(), step.stepId(), StepStatus.FAILED, List.of(), reason);
            } catch (InvalidPlanException stuck) {
                log.warn("Could not mark {} FAILED: {}", step.stepId(), stuck.getMessage());
            }
            return StepExecution.ended(step.stepId(), step.assignedRole(), StepExecution.Outcome.FAILED, null, reason);
        }
    }
}
