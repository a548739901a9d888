package com.mco.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class McoMetricsTest {

    private SimpleMeterRegistry registry;
    private McoMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new McoMetrics(registry);
    }

    @Test
    void recordOrchestrationLifecycle() {
        metrics.recordOrchestrationStarted();
        metrics.recordOrchestrationStarted();
        metrics.recordOrchestrationCompleted();

        assertEquals(2.0, registry.counter("mco.orchestrations.started").count());
        assertEquals(1.0, registry.counter("mco.orchestrations.completed").count());
    }

    @Test
    void recordEvaluationTagsResult() {
        metrics.recordEvaluation(true);
        metrics.recordEvaluation(false);
        metrics.recordEvaluation(false);

        assertEquals(1.0, registry.counter("mco.evaluations", "result", "success").count());
        assertEquals(2.0, registry.counter("mco.evaluations", "result", "failure").count());
    }

    @Test
    void recordDirectiveIssuedTagsInjection() {
        metrics.recordDirectiveIssued(true);

        assertEquals(1.0, registry.counter("mco.directives.issued", "injected", "true").count());
    }

    @Test
    void recordTimers() {
        metrics.recordConfigLoad(true, 12);
        metrics.recordAdapterExecution("echo", true, 40);

        var load = registry.find("mco.config.load.duration").tag("result", "success").timer();
        assertNotNull(load);
        assertEquals(1, load.count());
        var exec = registry.find("mco.adapter.execution.duration").tags("adapter", "echo", "result", "success").timer();
        assertNotNull(exec);
        assertEquals(40.0, exec.totalTime(java.util.concurrent.TimeUnit.MILLISECONDS), 0.001);
    }
}
