package com.planwatch.core.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planwatch.core.model.WorkflowOptions;
import com.planwatch.core.model.WorkflowRequest;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CommandDispatcherTest {

    private static final WorkflowRequest REQUEST = new WorkflowRequest(
            "https://example.com", "Find injection bugs", null, "comprehensive",
            new WorkflowOptions(true, false, true, true, true, true, true, 5));

    private final ObjectMapper mapper = new ObjectMapper();
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
        dispatcher = new CommandDispatcher(client, mapper, Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("body carries the correlation id, request fields and options")
    void buildsBody() throws Exception {
        JsonNode body = mapper.readTree(dispatcher.buildBody("wf-1", REQUEST));

        assertEquals("wf-1", body.get("workflowId").asText());
        assertEquals("https://example.com", body.get("target").asText());
        assertEquals("/*", body.get("scope").asText());
        assertEquals("Find injection bugs", body.get("description").asText());
        assertEquals("comprehensive", body.get("testType").asText());
        JsonNode options = body.get("options");
        assertTrue(options.get("includeRecon").asBoolean());
        assertFalse(options.get("includeSubdomains").asBoolean());
        assertTrue(options.get("testAPIs").asBoolean());
        assertTrue(options.get("captureAIReasoning").asBoolean());
        assertEquals(5, options.get("maxInitialTests").asInt());
    }

    @Nested
    @DisplayName("Against a stub engine")
    class AgainstStubEngine {

        private HttpServer server;
        private final AtomicInteger requests = new AtomicInteger();
        private final AtomicReference<String> receivedHeader = new AtomicReference<>();
        private final AtomicReference<String> receivedBody = new AtomicReference<>();
        private volatile int status = 200;
        private volatile String responseBody = "{\"status\":\"started\"}";

        @BeforeEach
        void startServer() throws IOException {
            server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
            server.createContext(CommandDispatcher.RUN_PATH, exchange -> {
                requests.incrementAndGet();
                receivedHeader.set(exchange.getRequestHeaders().getFirst(CommandDispatcher.WORKFLOW_ID_HEADER));
                receivedBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
                byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
                exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
                if (bytes.length > 0) {
                    try (OutputStream out = exchange.getResponseBody()) {
                        out.write(bytes);
                    }
                }
                exchange.close();
            });
            server.start();
        }

        @AfterEach
        void stopServer() {
            server.stop(0);
        }

        private URI baseUrl() {
            return URI.create("http://127.0.0.1:" + server.getAddress().getPort());
        }

        @Test
        @DisplayName("2xx is acknowledged with the parsed body")
        void accepted() throws Exception {
            DispatchAck ack = dispatcher.dispatch(baseUrl(), "wf-1", REQUEST);

            assertEquals(200, ack.statusCode());
            assertEquals("started", ack.engineStatus());
            assertEquals(1, requests.get());
            assertEquals("wf-1", receivedHeader.get());
            assertEquals("wf-1", mapper.readTree(receivedBody.get()).get("workflowId").asText());
        }

        @Test
        @DisplayName("a trailing slash on the base URL is tolerated")
        void trailingSlash() {
            dispatcher.dispatch(URI.create(baseUrl() + "/"), "wf-1", REQUEST);
            assertEquals(1, requests.get());
        }

        @Test
        @DisplayName("non-JSON acknowledgement keeps the raw text")
        void nonJsonAck() {
            responseBody = "ok";
            DispatchAck ack = dispatcher.dispatch(baseUrl(), "wf-1", REQUEST);
            assertNull(ack.body());
            assertEquals("ok", ack.rawBody());
        }

        @Test
        @DisplayName("non-2xx is a protocol error carrying status and body, sent once")
        void rejected() {
            status = 503;
            responseBody = "engine busy";

            DispatchException e = assertThrows(DispatchException.class,
                    () -> dispatcher.dispatch(baseUrl(), "wf-1", REQUEST));

            assertEquals(DispatchException.Kind.PROTOCOL, e.kind());
            assertEquals(503, e.statusCode());
            assertEquals("engine busy", e.responseBody());
            assertEquals("Engine returned HTTP 503: engine busy", e.getMessage());
            assertEquals(1, requests.get());
        }
    }

    @Test
    @DisplayName("an unreachable engine is a transport error")
    void unreachable() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        DispatchException e = assertThrows(DispatchException.class,
                () -> dispatcher.dispatch(URI.create("http://127.0.0.1:" + port), "wf-1", REQUEST));

        assertEquals(DispatchException.Kind.TRANSPORT, e.kind());
        assertEquals(-1, e.statusCode());
        assertNotNull(e.getCause());
    }
}
