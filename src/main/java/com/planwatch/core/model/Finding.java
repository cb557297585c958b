package com.planwatch.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.planwatch.core.events.RawEvent;

/**
 * A security finding reported by the engine. Fields the engine omitted stay null;
 * the display layer substitutes placeholders.
 *
 * @param type        finding category (e.g. "open-port")
 * @param description what was found
 * @param impact      consequence if exploited
 * @param severity    severity label as sent, {@code info} when absent
 */
public record Finding(
    String type,
    String description,
    String impact,
    String severity
) {

    public static final String DEFAULT_SEVERITY = "info";

    public Finding {
        if (severity == null || severity.isBlank()) {
            severity = DEFAULT_SEVERITY;
        }
    }

    public Severity severityLevel() {
        return Severity.fromLabel(severity);
    }

    public static Finding fromPayload(JsonNode payload) {
        return new Finding(
                textOrNull(payload, "type"),
                textOrNull(payload, "description"),
                textOrNull(payload, "impact"),
                textOrNull(payload, "severity"));
    }

    static String textOrNull(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        return RawEvent.asText(value);
    }
}
