package com.planwatch.core.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * An unclassified frame from the event channel, identified only by its discriminator.
 *
 * @param type       value of the frame's {@code type} field, {@code "unknown"} when absent
 * @param payload    the whole frame object
 * @param receivedAt when the channel client parsed the frame
 */
public record RawEvent(
    String type,
    ObjectNode payload,
    Instant receivedAt
) {

    public static final String UNKNOWN_TYPE = "unknown";

    public JsonNode field(String name) {
        return payload.path(name);
    }

    public String text(String name, String fallback) {
        JsonNode value = payload.get(name);
        if (value == null || value.isNull()) {
            return fallback;
        }
        return asText(value);
    }

    /**
     * Scalars as their text, objects and arrays as compact JSON so structured
     * content is never blanked.
     */
    public static String asText(JsonNode value) {
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
