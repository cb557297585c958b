package com.planwatch.core.model;

/**
 * Flags forwarded verbatim to the workflow engine. The monitor never interprets them.
 */
public record WorkflowOptions(
    boolean includeRecon,
    boolean includeSubdomains,
    boolean testAuthentication,
    boolean testApis,
    boolean verboseLogging,
    boolean captureAiReasoning,
    boolean showThoughtProcess,
    int maxInitialTests
) {

    public WorkflowOptions {
        if (maxInitialTests < 0) {
            throw new IllegalArgumentException("maxInitialTests must not be negative: " + maxInitialTests);
        }
    }
}
