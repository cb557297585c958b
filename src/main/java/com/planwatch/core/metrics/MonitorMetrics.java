package com.planwatch.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for monitoring sessions.
 */
@Service
public class MonitorMetrics {

    private final MeterRegistry registry;

    public MonitorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEventReceived(String eventType) {
        Counter.builder("planwatch.events.received")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    /**
     * Records a frame that could not be parsed and was dropped from the stream.
     */
    public void recordDroppedFrame() {
        Counter.builder("planwatch.frames.dropped")
                .description("Event frames dropped because they were not valid JSON objects")
                .register(registry)
                .increment();
    }

    public void recordDispatchResult(boolean success) {
        Counter.builder("planwatch.dispatch.results")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    /**
     * Records a finished session.
     *
     * @param terminationReason why the session ended (e.g. "WORKFLOW_COMPLETE", "CANCELLED")
     * @param duration          elapsed time the summary reports
     */
    public void recordSession(String terminationReason, Duration duration) {
        Counter.builder("planwatch.sessions.total")
                .tag("reason", terminationReason)
                .register(registry)
                .increment();
        Timer.builder("planwatch.session.duration")
                .register(registry)
                .record(duration);
    }
}
