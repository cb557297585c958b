package com.planwatch.core.channel;

import com.planwatch.core.events.RawEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Hands events from the socket's listener thread to the single consuming thread.
 * <p>
 * The producer side enqueues events followed by exactly one end signal (clean close
 * or failure); anything after the first end signal is ignored. Events queued before
 * a failure are still delivered before the failure is thrown.
 */
public class QueuedEventStream implements EventStream {

    private static final Logger log = LoggerFactory.getLogger(QueuedEventStream.class);

    private static final int NORMAL_CLOSURE = 1000;

    private final BlockingQueue<Signal> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean ended = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile WebSocket socket;
    private volatile boolean connected;

    // consumer-thread only
    private boolean finished;
    private ChannelException failure;

    // -- Producer side --

    void attach(WebSocket socket) {
        this.socket = socket;
        this.connected = true;
        if (closed.get()) {
            sendClose(socket);
        }
    }

    void offer(RawEvent event) {
        if (!ended.get()) {
            queue.add(new Signal(event, null));
        }
    }

    void complete() {
        if (ended.compareAndSet(false, true)) {
            queue.add(new Signal(null, null));
        }
    }

    void fail(ChannelException error) {
        if (ended.compareAndSet(false, true)) {
            queue.add(new Signal(null, error));
        } else {
            log.debug("Ignoring channel failure after stream end: {}", error.getMessage());
        }
    }

    // -- Consumer side --

    @Override
    public Optional<RawEvent> poll(Duration timeout) throws InterruptedException {
        if (finished) {
            if (failure != null) {
                throw failure;
            }
            return Optional.empty();
        }
        Signal signal = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (signal == null) {
            return Optional.empty();
        }
        if (signal.event() != null) {
            return Optional.of(signal.event());
        }
        finished = true;
        failure = signal.error();
        if (failure != null) {
            throw failure;
        }
        return Optional.empty();
    }

    @Override
    public boolean isFinished() {
        return finished;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    /**
     * Sends a normal-closure frame if the socket is open. Safe to call more than once,
     * and before the connection completes.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            WebSocket current = socket;
            if (current != null) {
                sendClose(current);
            }
        }
    }

    private static void sendClose(WebSocket socket) {
        if (!socket.isOutputClosed()) {
            socket.sendClose(NORMAL_CLOSURE, "monitor finished")
                    .exceptionally(ex -> {
                        log.debug("Close frame not sent: {}", ex.getMessage());
                        return null;
                    });
        }
    }

    private record Signal(RawEvent event, ChannelException error) {}
}
