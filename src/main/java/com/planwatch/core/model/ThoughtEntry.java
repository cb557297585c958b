package com.planwatch.core.model;

import java.time.Instant;

/**
 * One reasoning event captured from the engine, in arrival order.
 */
public record ThoughtEntry(
    Instant timestamp,
    String phase,
    String text
) {}
