package com.planwatch.core.channel;

import com.planwatch.core.events.RawEvent;

import java.time.Duration;
import java.util.Optional;

/**
 * Single-use sequence of raw events, consumed by one thread.
 */
public interface EventStream extends AutoCloseable {

    /**
     * Waits at most {@code timeout} for the next event. The wait is a scheduling tick,
     * not a protocol deadline: an empty result means "nothing yet" unless
     * {@link #isFinished()} has become true.
     *
     * @throws ChannelException     once the transport has failed and queued events are drained
     * @throws InterruptedException if the waiting thread is interrupted
     */
    Optional<RawEvent> poll(Duration timeout) throws InterruptedException;

    /**
     * True once the remote end closed the stream and every queued event was handed out.
     */
    boolean isFinished();

    /**
     * True once the connection is open and the subscription was sent.
     */
    boolean isConnected();

    @Override
    void close();
}
