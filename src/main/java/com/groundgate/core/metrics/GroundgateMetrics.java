package com.groundgate.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for grounding and gate execution.
 */
@Service
public class GroundgateMetrics {

    private final MeterRegistry registry;

    public GroundgateMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordGateResult(boolean passed) {
        Counter.builder("groundgate.gate.evaluations")
                .tag("result", passed ? "passed" : "failed")
                .register(registry)
                .increment();
    }

    public void recordFailReason(String code, String severity) {
        Counter.builder("groundgate.gate.fail_reasons")
                .tag("code", code)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    /**
     * @param reason "missing_chunk_id", "not_in_store" or "not_relevant"
     */
    public void recordDroppedCitation(String reason) {
        Counter.builder("groundgate.citations.dropped")
                .description("Citations removed during validation")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAttempt(String resolvedStatus, long ms) {
        Timer.builder("groundgate.attempt.duration")
                .tag("status", resolvedStatus)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordAttemptCost(double cost) {
        DistributionSummary.builder("groundgate.attempt.cost")
                .register(registry)
                .record(cost);
    }

    public void recordRetry(String reason) {
        Counter.builder("groundgate.retries.total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordTaskResult(String status) {
        Counter.builder("groundgate.tasks.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordAttemptsPerTask(int attempts) {
        DistributionSummary.builder("groundgate.task.attempts")
                .register(registry)
                .record(attempts);
    }
}
