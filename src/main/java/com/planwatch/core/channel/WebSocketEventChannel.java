package com.planwatch.core.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwatch.core.config.MonitorProperties;
import com.planwatch.core.events.RawEvent;
import com.planwatch.core.metrics.MonitorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.CompletionStage;

/**
 * Event channel over the engine's WebSocket endpoint ({@code /ws}).
 * <p>
 * After the socket opens, sends one {@code {"type":"subscribe","workflowId":...}}
 * frame, then reassembles text frames, parses each into a {@link RawEvent} and
 * queues it for the consumer. A frame that does not parse is logged and dropped.
 * A close from the remote end finishes the stream; any other fault fails it.
 */
@Component
public class WebSocketEventChannel implements EventChannel {

    private static final Logger log = LoggerFactory.getLogger(WebSocketEventChannel.class);

    static final String SOCKET_PATH = "/ws";

    private final HttpClient httpClient;
    private final FrameParser frameParser;
    private final ObjectMapper objectMapper;
    private final MonitorMetrics metrics;
    private final Duration connectTimeout;

    @Autowired
    public WebSocketEventChannel(HttpClient monitorHttpClient, FrameParser frameParser, ObjectMapper objectMapper,
                                 MonitorMetrics metrics, MonitorProperties properties) {
        this(monitorHttpClient, frameParser, objectMapper, metrics,
                Duration.ofSeconds(properties.getChannelConnectTimeoutSeconds()));
    }

    WebSocketEventChannel(HttpClient httpClient, FrameParser frameParser, ObjectMapper objectMapper,
                          MonitorMetrics metrics, Duration connectTimeout) {
        this.httpClient = httpClient;
        this.frameParser = frameParser;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public EventStream open(URI wsUrl, String correlationId) {
        URI uri = resolve(wsUrl);
        QueuedEventStream stream = new QueuedEventStream();
        FrameListener listener = new FrameListener(stream, subscribeFrame(correlationId), correlationId);

        log.info("Connecting event channel for workflow {} to {}", correlationId, uri);
        httpClient.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(uri, listener)
                .whenComplete((socket, error) -> {
                    if (error != null) {
                        log.warn("Event channel connect to {} failed: {}", uri, rootMessage(error));
                        stream.fail(new ChannelException("Cannot connect to event channel at " + uri
                                + ": " + rootMessage(error), error));
                    }
                });
        return stream;
    }

    String subscribeFrame(String correlationId) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", "subscribe");
        frame.put("workflowId", correlationId);
        return frame.toString();
    }

    /**
     * Listener callbacks run on the HttpClient's executor, one at a time per socket.
     */
    class FrameListener implements WebSocket.Listener {

        private final QueuedEventStream stream;
        private final String subscribeFrame;
        private final String correlationId;
        private final StringBuilder buffer = new StringBuilder();

        FrameListener(QueuedEventStream stream, String subscribeFrame, String correlationId) {
            this.stream = stream;
            this.subscribeFrame = subscribeFrame;
            this.correlationId = correlationId;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            log.info("Event channel open for workflow {}, subscribing", correlationId);
            webSocket.sendText(subscribeFrame, true)
                    .thenRun(() -> stream.attach(webSocket))
                    .exceptionally(ex -> {
                        stream.fail(new ChannelException("Subscribe frame not sent: " + rootMessage(ex), ex));
                        return null;
                    });
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buffer.append(data);
            if (last) {
                String frame = buffer.toString();
                buffer.setLength(0);
                accept(frame);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            log.debug("Ignoring binary frame ({} bytes) on workflow {}", data.remaining(), correlationId);
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.info("Event channel closed by remote end (code={}, reason={})", statusCode, reason);
            stream.complete();
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.warn("Event channel error on workflow {}: {}", correlationId, rootMessage(error));
            stream.fail(new ChannelException("Event channel failed: " + rootMessage(error), error));
        }

        private void accept(String frame) {
            try {
                stream.offer(frameParser.parse(frame));
            } catch (FrameParseException e) {
                log.warn("Dropping unparseable frame on workflow {}: {}", correlationId, e.getMessage());
                if (metrics != null) {
                    metrics.recordDroppedFrame();
                }
            }
        }
    }

    private static URI resolve(URI wsUrl) {
        String base = wsUrl.toString();
        if (base.endsWith(SOCKET_PATH)) {
            return wsUrl;
        }
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + SOCKET_PATH);
    }

    private static String rootMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
