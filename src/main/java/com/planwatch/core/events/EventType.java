package com.planwatch.core.events;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Semantic event cases, keyed by the wire discriminator.
 * Each case accepts the engine's namespaced name and a short alias.
 */
public enum EventType {
    THINKING("ai:thinking", "thinking"),
    STRATEGY("ai:strategy", "strategy"),
    CLASSIFICATION("ai:classification", "classification"),
    PLAN("test:plan", "plan"),
    TEST_START("test:start", "test-start"),
    FINDING("finding"),
    WORKFLOW_COMPLETE("workflow:complete", "workflow-complete"),
    ERROR("error"),
    CONNECTED("connected"),
    SUBSCRIBED("subscribed"),
    UNRECOGNIZED();

    private static final Map<String, EventType> BY_WIRE_NAME = new HashMap<>();

    static {
        for (EventType type : values()) {
            for (String name : type.wireNames) {
                BY_WIRE_NAME.put(name, type);
            }
        }
    }

    private final List<String> wireNames;

    EventType(String... wireNames) {
        this.wireNames = List.of(wireNames);
    }

    public List<String> wireNames() {
        return wireNames;
    }

    public static EventType fromWire(String discriminator) {
        if (discriminator == null) {
            return UNRECOGNIZED;
        }
        return BY_WIRE_NAME.getOrDefault(discriminator, UNRECOGNIZED);
    }
}
