package com.planwatch.core.engine;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Where a session talks to and where it writes.
 *
 * @param backendUrl   engine REST base URL
 * @param wsUrl        engine event channel base URL
 * @param outputDir    directory for the summary artifact
 * @param pollInterval bounded wait between cancellation checks
 */
public record SessionConfig(
    URI backendUrl,
    URI wsUrl,
    Path outputDir,
    Duration pollInterval
) {

    public SessionConfig {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }
}
