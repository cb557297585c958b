package com.planwatch.core.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwatch.core.events.RawEvent;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Turns one text frame into a {@link RawEvent}. Does not look at anything but the discriminator.
 */
@Component
public class FrameParser {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public FrameParser(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public FrameParser(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    public RawEvent parse(CharSequence frame) {
        if (frame == null || frame.length() == 0) {
            throw new FrameParseException("Empty frame");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(frame.toString());
        } catch (JsonProcessingException e) {
            throw new FrameParseException("Frame is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (!(node instanceof ObjectNode object)) {
            throw new FrameParseException("Frame is not a JSON object: " + node.getNodeType());
        }
        JsonNode type = object.get("type");
        String discriminator = type != null && type.isTextual() ? type.asText() : RawEvent.UNKNOWN_TYPE;
        return new RawEvent(discriminator, object, clock.instant());
    }
}
