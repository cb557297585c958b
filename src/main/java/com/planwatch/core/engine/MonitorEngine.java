package com.planwatch.core.engine;

import com.planwatch.core.channel.EventChannel;
import com.planwatch.core.classify.DisplayRenderer;
import com.planwatch.core.classify.EventClassifier;
import com.planwatch.core.config.MonitorProperties;
import com.planwatch.core.dispatch.CommandDispatcher;
import com.planwatch.core.metrics.MonitorMetrics;
import com.planwatch.core.model.WorkflowOptions;
import com.planwatch.core.model.WorkflowRequest;
import com.planwatch.core.session.MonitorSession;
import com.planwatch.core.summary.SummaryEmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Bridges the CLI to a monitoring session.
 * <p>
 * Generates the correlation id, resolves endpoints from configuration and flag
 * overrides, and hands back a supervisor the caller can run and cancel.
 */
@Service
public class MonitorEngine {

    private static final Logger log = LoggerFactory.getLogger(MonitorEngine.class);

    private final CommandDispatcher dispatcher;
    private final EventChannel channel;
    private final EventClassifier classifier;
    private final SummaryEmitter emitter;
    private final MonitorMetrics metrics;
    private final MonitorProperties properties;
    private final Clock clock;

    public MonitorEngine(CommandDispatcher dispatcher, EventChannel channel, EventClassifier classifier,
                         SummaryEmitter emitter, MonitorMetrics metrics, MonitorProperties properties,
                         Clock clock) {
        this.dispatcher = dispatcher;
        this.channel = channel;
        this.classifier = classifier;
        this.emitter = emitter;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Resolves where the session talks to, applying non-null overrides on top of configuration.
     *
     * @throws IllegalArgumentException if a URL is malformed
     */
    public SessionConfig sessionConfig(String backendUrl, String wsUrl, String outputDir) {
        return new SessionConfig(
                URI.create(backendUrl != null ? backendUrl : properties.getBackendUrl()),
                URI.create(wsUrl != null ? wsUrl : properties.getWsUrl()),
                Path.of(outputDir != null ? outputDir : properties.getOutputDir()),
                Duration.ofMillis(properties.getPollIntervalMs()));
    }

    /**
     * Builds a request, falling back to the configured test type when none is given.
     */
    public WorkflowRequest newRequest(String target, String description, String scope,
                                      String testType, WorkflowOptions options) {
        return new WorkflowRequest(target, description, scope,
                testType != null ? testType : properties.getTestType(), options);
    }

    public MonitorSupervisor prepare(WorkflowRequest request, SessionConfig config, DisplayRenderer renderer) {
        MonitorSession session = MonitorSession.start(clock);
        log.info("Prepared session {} (backend={}, ws={})", session.correlationId(),
                config.backendUrl(), config.wsUrl());
        return new MonitorSupervisor(session, request, config, dispatcher, channel, classifier,
                emitter, renderer, metrics, clock);
    }
}
