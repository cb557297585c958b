package com.planwatch.core.engine;

/**
 * Result of one of the supervisor's concurrent tasks, with failures carried as data
 * instead of thrown across the join.
 *
 * @param value result on success, null on failure
 * @param error cause on failure, null on success
 */
public record TaskOutcome<T>(T value, RuntimeException error) {

    public static <T> TaskOutcome<T> success(T value) {
        return new TaskOutcome<>(value, null);
    }

    public static <T> TaskOutcome<T> failure(RuntimeException error) {
        return new TaskOutcome<>(null, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
