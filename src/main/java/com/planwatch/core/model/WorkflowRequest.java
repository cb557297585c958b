package com.planwatch.core.model;

/**
 * The one-shot "start workflow" command sent to the engine.
 *
 * @param target      host or URL to test, never blank
 * @param description free-text objective
 * @param scope       path pattern, {@code /*} when not given
 * @param testType    engine test profile (e.g. "comprehensive")
 * @param options     flags forwarded verbatim
 */
public record WorkflowRequest(
    String target,
    String description,
    String scope,
    String testType,
    WorkflowOptions options
) {

    public static final String DEFAULT_SCOPE = "/*";

    public WorkflowRequest {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target must not be blank");
        }
        if (scope == null || scope.isBlank()) {
            scope = DEFAULT_SCOPE;
        }
        if (description == null) {
            description = "";
        }
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
    }
}
