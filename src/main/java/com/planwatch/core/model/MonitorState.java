package com.planwatch.core.model;

/**
 * Supervisor lifecycle. Transitions only move forward.
 */
public enum MonitorState {
    INITIALIZING,
    DISPATCHED,
    LISTENING,
    TERMINATED;

    public boolean isBefore(MonitorState other) {
        return ordinal() < other.ordinal();
    }
}
