package com.planwatch.core.model;

/**
 * Why a monitoring session ended. Only {@link #CHANNEL_ERROR} is a failure;
 * a clean close without a terminal event is logged distinctly but finalized normally.
 */
public enum TerminationReason {
    WORKFLOW_COMPLETE,
    STREAM_CLOSED,
    CHANNEL_ERROR,
    CANCELLED
}
