package com.planwatch.core.summary;

import com.fasterxml.jackson.databind.JsonNode;
import com.planwatch.core.model.Finding;
import com.planwatch.core.model.ThoughtEntry;

import java.util.List;

/**
 * The persisted summary of one session, written as {@code ai-analysis-<correlationId>.json}.
 *
 * @param correlationId     workflow id the session monitored
 * @param duration          seconds since dispatch (or since session start if dispatch never began)
 * @param terminationReason how the session ended
 * @param thoughtLog        reasoning events in arrival order
 * @param plan              last plan payload as received, null when none arrived
 * @param findings          findings in arrival order
 */
public record SummaryArtifact(
    String correlationId,
    double duration,
    String terminationReason,
    List<ThoughtEntry> thoughtLog,
    JsonNode plan,
    List<Finding> findings
) {

    public SummaryArtifact {
        thoughtLog = thoughtLog == null ? List.of() : List.copyOf(thoughtLog);
        findings = findings == null ? List.of() : List.copyOf(findings);
        if (plan != null && plan.isNull()) {
            plan = null;
        }
    }
}
