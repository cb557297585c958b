package com.planwatch.core.session;

import com.planwatch.core.dispatch.DispatchException;
import com.planwatch.core.model.Finding;
import com.planwatch.core.model.MonitorState;
import com.planwatch.core.model.TerminationReason;
import com.planwatch.core.model.TestPlan;
import com.planwatch.core.model.ThoughtEntry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Accumulated state for one monitoring run, from dispatch to the written summary.
 * <p>
 * Owned by the supervisor, which lends it to the classifier while an event is
 * processed. Events are classified one at a time, so the thought log, plan and
 * findings have a single writer. The dispatch timestamp and error are written
 * from the dispatch thread and are volatile. {@code thoughtLog} and
 * {@code findings} only grow, and {@code terminated} flips exactly once.
 */
public class MonitorSession {

    public static final String INITIAL_PHASE = "Initializing";

    private final String correlationId;
    private final Instant createdAt;

    private volatile String phase = INITIAL_PHASE;
    private volatile Instant startedAt;
    private volatile DispatchException dispatchError;
    private volatile boolean channelOpened;
    private volatile TestPlan plan;

    private final List<ThoughtEntry> thoughtLog = new ArrayList<>();
    private final List<Finding> findings = new ArrayList<>();

    private final AtomicReference<MonitorState> state = new AtomicReference<>(MonitorState.INITIALIZING);
    private final AtomicReference<TerminationReason> terminationReason = new AtomicReference<>();

    public MonitorSession(String correlationId, Instant createdAt) {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be blank");
        }
        this.correlationId = correlationId;
        this.createdAt = createdAt;
    }

    /**
     * Starts a session with a fresh random correlation id.
     */
    public static MonitorSession start(Clock clock) {
        return new MonitorSession(UUID.randomUUID().toString(), clock.instant());
    }

    public String correlationId() { return correlationId; }
    public Instant createdAt() { return createdAt; }
    public String phase() { return phase; }
    public Optional<Instant> startedAt() { return Optional.ofNullable(startedAt); }
    public Optional<DispatchException> dispatchError() { return Optional.ofNullable(dispatchError); }
    public Optional<TestPlan> plan() { return Optional.ofNullable(plan); }
    public MonitorState state() { return state.get(); }
    public Optional<TerminationReason> terminationReason() { return Optional.ofNullable(terminationReason.get()); }
    public boolean isTerminated() { return terminationReason.get() != null; }
    public boolean hasChannelOpened() { return channelOpened; }

    public List<ThoughtEntry> thoughtLog() {
        return Collections.unmodifiableList(thoughtLog);
    }

    public List<Finding> findings() {
        return Collections.unmodifiableList(findings);
    }

    // -- Mutations --

    public void setPhase(String phase) {
        this.phase = phase;
    }

    public void appendThought(ThoughtEntry entry) {
        thoughtLog.add(entry);
    }

    public void appendFinding(Finding finding) {
        findings.add(finding);
    }

    /**
     * Last write wins; earlier plans are discarded, never merged.
     */
    public void replacePlan(TestPlan plan) {
        this.plan = plan;
    }

    /**
     * Records the moment the dispatch request went out. Only the first call counts.
     */
    public void markDispatchStarted(Instant at) {
        if (startedAt == null) {
            startedAt = at;
        }
    }

    public void recordDispatchError(DispatchException error) {
        this.dispatchError = error;
    }

    public void markDispatched() {
        advanceTo(MonitorState.DISPATCHED);
    }

    public void markListening() {
        channelOpened = true;
        advanceTo(MonitorState.LISTENING);
    }

    /**
     * Sets {@code terminated}. Only the first caller wins; later reasons are ignored.
     *
     * @return true if this call performed the transition
     */
    public boolean terminate(TerminationReason reason) {
        if (terminationReason.compareAndSet(null, reason)) {
            state.set(MonitorState.TERMINATED);
            return true;
        }
        return false;
    }

    /**
     * Elapsed time since dispatch, or since session creation when dispatch never
     * started. Never negative.
     */
    public Duration elapsed(Instant now) {
        Instant origin = startedAt != null ? startedAt : createdAt;
        Duration elapsed = Duration.between(origin, now);
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    private void advanceTo(MonitorState target) {
        state.getAndUpdate(current -> current.isBefore(target) ? target : current);
    }
}
