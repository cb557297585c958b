package com.planwatch.core.engine;

import com.planwatch.core.channel.ChannelException;
import com.planwatch.core.channel.EventChannel;
import com.planwatch.core.channel.EventStream;
import com.planwatch.core.classify.DisplayAction;
import com.planwatch.core.classify.DisplayRenderer;
import com.planwatch.core.classify.EventClassifier;
import com.planwatch.core.dispatch.CommandDispatcher;
import com.planwatch.core.dispatch.DispatchAck;
import com.planwatch.core.dispatch.DispatchException;
import com.planwatch.core.events.RawEvent;
import com.planwatch.core.logging.MdcContext;
import com.planwatch.core.metrics.MonitorMetrics;
import com.planwatch.core.model.TerminationReason;
import com.planwatch.core.model.WorkflowRequest;
import com.planwatch.core.session.MonitorSession;
import com.planwatch.core.summary.SummaryArtifact;
import com.planwatch.core.summary.SummaryEmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one monitoring session: dispatches the command and listens to the event
 * channel concurrently, then finalizes the summary exactly once.
 *
 * <p>State machine: {@code INITIALIZING -> DISPATCHED -> LISTENING -> TERMINATED}.
 * A failed dispatch is recorded and shown but never stops the listener. The listener
 * classifies events one at a time in arrival order and checks for cancellation at
 * every poll tick, so {@link #cancel()} takes effect within one poll interval and
 * keeps whatever state has accumulated.
 *
 * <p>Each supervisor is single-use.
 */
public class MonitorSupervisor {

    private static final Logger log = LoggerFactory.getLogger(MonitorSupervisor.class);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final MonitorSession session;
    private final WorkflowRequest request;
    private final SessionConfig config;
    private final CommandDispatcher dispatcher;
    private final EventChannel channel;
    private final EventClassifier classifier;
    private final SummaryEmitter emitter;
    private final DisplayRenderer renderer;
    private final MonitorMetrics metrics;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final CountDownLatch finished = new CountDownLatch(1);

    // Once set, a late dispatch result no longer touches the session or the display.
    private final Object dispatchLock = new Object();
    private boolean dispatchClosed;

    private volatile Future<?> dispatchFuture;

    MonitorSupervisor(MonitorSession session, WorkflowRequest request, SessionConfig config,
                      CommandDispatcher dispatcher, EventChannel channel, EventClassifier classifier,
                      SummaryEmitter emitter, DisplayRenderer renderer, MonitorMetrics metrics, Clock clock) {
        this.session = session;
        this.request = request;
        this.config = config;
        this.dispatcher = dispatcher;
        this.channel = channel;
        this.classifier = classifier;
        this.emitter = emitter;
        this.renderer = renderer;
        this.metrics = metrics;
        this.clock = clock;
    }

    public MonitorSession session() {
        return session;
    }

    /**
     * Runs the session to completion on the calling thread.
     *
     * @return the outcome, including where the summary was written
     * @throws IllegalStateException if called more than once
     */
    public MonitorResult run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Session " + session.correlationId() + " has already run");
        }
        MdcContext.setSession(session.correlationId(), "supervise");
        ExecutorService executor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "planwatch-session-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            log.info("Starting session {} for target {}", session.correlationId(), request.target());
            show(new DisplayAction.RequestPanel(session.correlationId(), request.target(),
                    request.scope(), request.description()));

            Future<TaskOutcome<DispatchAck>> dispatchTask = executor.submit(this::dispatchTask);
            dispatchFuture = dispatchTask;
            if (cancelRequested.get()) {
                dispatchTask.cancel(true);
            }
            Future<TaskOutcome<TerminationReason>> listenTask = executor.submit(this::listenTask);

            TaskOutcome<TerminationReason> listenOutcome = await(listenTask);
            TerminationReason reason;
            if (listenOutcome.succeeded()) {
                reason = listenOutcome.value();
            } else {
                reason = TerminationReason.CHANNEL_ERROR;
                log.warn("Event channel failed: {}", listenOutcome.error().getMessage());
                show(new DisplayAction.ErrorPanel("Event channel error", listenOutcome.error().getMessage()));
            }

            if (reason == TerminationReason.CANCELLED && !dispatchTask.isDone()) {
                dispatchTask.cancel(true);
            } else {
                await(dispatchTask);
            }
            return finish(reason);
        } finally {
            executor.shutdownNow();
            MdcContext.clear();
            finished.countDown();
        }
    }

    /**
     * Requests cooperative cancellation. Interrupts an in-flight dispatch; the listener
     * stops at its next poll tick. Finalization still runs. Idempotent.
     */
    public void cancel() {
        if (cancelRequested.compareAndSet(false, true)) {
            log.info("Cancellation requested for session {}", session.correlationId());
            Future<?> pending = dispatchFuture;
            if (pending != null) {
                pending.cancel(true);
            }
        }
    }

    /**
     * Waits for {@link #run()} to return, e.g. from a shutdown hook after {@link #cancel()}.
     *
     * @return true if the session finished within the timeout
     */
    public boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    // -- Tasks --

    private TaskOutcome<DispatchAck> dispatchTask() {
        MdcContext.setSession(session.correlationId(), "dispatch");
        Instant sentAt = clock.instant();
        DispatchAck ack = null;
        DispatchException failure = null;
        try {
            ack = dispatcher.dispatch(config.backendUrl(), session.correlationId(), request);
        } catch (DispatchException e) {
            failure = e;
        } catch (RuntimeException e) {
            failure = DispatchException.transport("Dispatch failed: " + e.getMessage(), e);
        }
        try {
            synchronized (dispatchLock) {
                if (dispatchClosed) {
                    log.info("Dispatch for session {} returned after finalization, result ignored",
                            session.correlationId());
                    return ack != null ? TaskOutcome.success(ack) : TaskOutcome.failure(failure);
                }
                try {
                    if (ack != null) {
                        return dispatchAccepted(ack, sentAt);
                    }
                    if (failure.kind() == DispatchException.Kind.PROTOCOL) {
                        session.markDispatchStarted(sentAt);
                    }
                    return dispatchFailed(failure);
                } finally {
                    session.markDispatched();
                }
            }
        } finally {
            MdcContext.clear();
        }
    }

    private TaskOutcome<DispatchAck> dispatchAccepted(DispatchAck ack, Instant sentAt) {
        session.markDispatchStarted(sentAt);
        recordDispatch(true);
        String status = ack.engineStatus();
        show(new DisplayAction.StatusLine("Workflow accepted by engine (HTTP " + ack.statusCode()
                + (status != null ? ", status " + status : "") + ")"));
        return TaskOutcome.success(ack);
    }

    private TaskOutcome<DispatchAck> dispatchFailed(DispatchException e) {
        if (cancelRequested.get()) {
            log.info("Dispatch abandoned after cancellation: {}", e.getMessage());
            return TaskOutcome.failure(e);
        }
        session.recordDispatchError(e);
        recordDispatch(false);
        log.warn("Dispatch failed ({}): {}", e.kind(), e.getMessage());
        show(new DisplayAction.ErrorPanel("Dispatch failed (" + e.kind().name().toLowerCase() + ")", e.getMessage()));
        return TaskOutcome.failure(e);
    }

    private TaskOutcome<TerminationReason> listenTask() {
        MdcContext.setSession(session.correlationId(), "listen");
        EventStream stream = null;
        try {
            stream = channel.open(config.wsUrl(), session.correlationId());
            while (true) {
                if (cancelRequested.get()) {
                    return TaskOutcome.success(TerminationReason.CANCELLED);
                }
                Optional<RawEvent> next = stream.poll(config.pollInterval());
                if (!session.hasChannelOpened() && (stream.isConnected() || next.isPresent())) {
                    session.markListening();
                    log.info("Listening for events on session {}", session.correlationId());
                    show(new DisplayAction.StatusLine("Event channel connected"));
                }
                if (next.isPresent()) {
                    process(next.get());
                    if (session.isTerminated()) {
                        return TaskOutcome.success(
                                session.terminationReason().orElse(TerminationReason.WORKFLOW_COMPLETE));
                    }
                } else if (stream.isFinished()) {
                    return TaskOutcome.success(TerminationReason.STREAM_CLOSED);
                }
            }
        } catch (ChannelException e) {
            return TaskOutcome.failure(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TaskOutcome.success(TerminationReason.CANCELLED);
        } catch (RuntimeException e) {
            log.error("Listener failed unexpectedly", e);
            return TaskOutcome.failure(new ChannelException("Listener failed: " + e.getMessage(), e));
        } finally {
            if (stream != null) {
                stream.close();
            }
            MdcContext.clear();
        }
    }

    /**
     * Classifies one event completely, including its session mutation, before the next.
     */
    private void process(RawEvent event) {
        if (metrics != null) {
            metrics.recordEventReceived(event.type());
        }
        DisplayAction action = classifier.classify(event, session);
        show(action);
    }

    // -- Finalization --

    /**
     * Runs once per supervisor, since {@link #run()} is single-use.
     */
    private MonitorResult finish(TerminationReason reason) {
        synchronized (dispatchLock) {
            dispatchClosed = true;
        }
        session.terminate(reason);
        TerminationReason finalReason = session.terminationReason().orElse(reason);
        logTermination(finalReason);

        SummaryArtifact summary = null;
        Path artifact = null;
        try {
            SummaryEmitter.WrittenSummary written = emitter.emit(session, config.outputDir());
            summary = written.artifact();
            artifact = written.path();
            if (metrics != null) {
                metrics.recordSession(finalReason.name(), written.elapsed());
            }
            show(new DisplayAction.SummaryPanel(session.correlationId(), summary.duration(),
                    summary.thoughtLog().size(), summary.findings().size(), summary.plan() != null,
                    finalReason.name(), artifact));
        } catch (UncheckedIOException e) {
            log.error("Summary for session {} could not be written", session.correlationId(), e);
            show(new DisplayAction.ErrorPanel("Summary not saved", e.getMessage()));
        }
        return new MonitorResult(session.correlationId(), finalReason, session.dispatchError().orElse(null),
                session.hasChannelOpened(), summary, artifact);
    }

    private void logTermination(TerminationReason reason) {
        switch (reason) {
            case WORKFLOW_COMPLETE -> log.info("Workflow {} reported completion", session.correlationId());
            case STREAM_CLOSED -> {
                log.warn("Event stream for {} closed without a completion event, finalizing partial state",
                        session.correlationId());
                show(new DisplayAction.StatusLine("Event stream closed before the workflow reported completion"));
            }
            case CHANNEL_ERROR -> log.warn("Session {} ended on a channel error, finalizing partial state",
                    session.correlationId());
            case CANCELLED -> {
                log.info("Session {} cancelled by operator", session.correlationId());
                show(new DisplayAction.StatusLine("Monitoring stopped by user"));
            }
        }
    }

    // -- Helpers --

    private void recordDispatch(boolean success) {
        if (metrics != null) {
            metrics.recordDispatchResult(success);
        }
    }

    /**
     * A renderer failure must not take the session down with it.
     */
    private void show(DisplayAction action) {
        try {
            renderer.render(action);
        } catch (RuntimeException e) {
            log.warn("Renderer failed on {}: {}", action.getClass().getSimpleName(), e.getMessage(), e);
        }
    }

    /**
     * Joins a task. Interrupting the waiting thread is treated as a cancellation request;
     * the wait continues so finalization still sees a quiescent session.
     */
    private <T> TaskOutcome<T> await(Future<TaskOutcome<T>> future) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return future.get();
                } catch (InterruptedException e) {
                    interrupted = true;
                    cancel();
                } catch (CancellationException e) {
                    return TaskOutcome.failure(new IllegalStateException("Task cancelled", e));
                } catch (ExecutionException e) {
                    return TaskOutcome.failure(new IllegalStateException("Task failed: " + e.getCause(), e.getCause()));
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
