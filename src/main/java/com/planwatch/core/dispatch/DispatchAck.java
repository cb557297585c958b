package com.planwatch.core.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The engine's acknowledgement of a start-workflow command.
 *
 * @param statusCode HTTP status (always 2xx)
 * @param body       parsed JSON body, or null when the body was empty or not JSON
 * @param rawBody    body text as received
 */
public record DispatchAck(
    int statusCode,
    JsonNode body,
    String rawBody
) {

    /**
     * Status reported by the engine in the acknowledgement, if any.
     */
    public String engineStatus() {
        if (body == null || !body.hasNonNull("status")) {
            return null;
        }
        return body.get("status").asText();
    }
}
