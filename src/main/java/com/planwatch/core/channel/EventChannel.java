package com.planwatch.core.channel;

import java.net.URI;

/**
 * Transport that yields the raw events of one workflow.
 */
public interface EventChannel {

    /**
     * Starts connecting and subscribes with the correlation id once connected.
     * Returns immediately; connection failures surface from {@link EventStream#poll}.
     *
     * @param wsUrl         event channel base URL (e.g. ws://localhost:8001)
     * @param correlationId workflow to subscribe to
     * @return a single-use stream of raw events
     */
    EventStream open(URI wsUrl, String correlationId);
}
