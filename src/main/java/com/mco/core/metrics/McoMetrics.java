package com.mco.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for orchestration runs.
 */
@Service
public class McoMetrics {

    private final MeterRegistry registry;

    public McoMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordConfigLoad(boolean success, long ms) {
        Timer.builder("mco.config.load.duration")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordOrchestrationStarted() {
        Counter.builder("mco.orchestrations.started")
                .register(registry)
                .increment();
    }

    public void recordOrchestrationCompleted() {
        Counter.builder("mco.orchestrations.completed")
                .register(registry)
                .increment();
    }

    public void recordDirectiveIssued(boolean injected) {
        Counter.builder("mco.directives.issued")
                .tag("injected", String.valueOf(injected))
                .register(registry)
                .increment();
    }

    /**
     * Records one evaluation verdict.
     *
     * @param success whether the step passed
     */
    public void recordEvaluation(boolean success) {
        Counter.builder("mco.evaluations")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordAdapterExecution(String adapter, boolean success, long ms) {
        Timer.builder("mco.adapter.execution.duration")
                .tag("adapter", adapter)
                .tag("result", success ? "success" : "error")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
