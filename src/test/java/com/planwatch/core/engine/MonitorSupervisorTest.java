package com.planwatch.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planwatch.core.channel.ChannelException;
import com.planwatch.core.channel.EventChannel;
import com.planwatch.core.channel.EventStream;
import com.planwatch.core.channel.FrameParser;
import com.planwatch.core.classify.DisplayAction;
import com.planwatch.core.classify.DisplayRenderer;
import com.planwatch.core.classify.EventClassifier;
import com.planwatch.core.dispatch.CommandDispatcher;
import com.planwatch.core.dispatch.DispatchAck;
import com.planwatch.core.dispatch.DispatchException;
import com.planwatch.core.events.RawEvent;
import com.planwatch.core.metrics.MonitorMetrics;
import com.planwatch.core.model.MonitorState;
import com.planwatch.core.model.Severity;
import com.planwatch.core.model.TerminationReason;
import com.planwatch.core.model.WorkflowOptions;
import com.planwatch.core.model.WorkflowRequest;
import com.planwatch.core.session.MonitorSession;
import com.planwatch.core.summary.SummaryEmitter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@Timeout(30)
class MonitorSupervisorTest {

    private static final Duration TICK = Duration.ofMillis(10);
    private static final WorkflowRequest REQUEST = new WorkflowRequest(
            "https://example.com", "Find leaky APIs", "/*", "comprehensive",
            new WorkflowOptions(true, true, true, true, true, true, true, 5));

    private final ObjectMapper mapper = new ObjectMapper();
    private final FrameParser parser = new FrameParser(mapper);

    @TempDir
    Path outputDir;

    private CommandDispatcher dispatcher;
    private FakeChannel channel;
    private RecordingRenderer renderer;
    private SummaryEmitter emitter;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        dispatcher = mock(CommandDispatcher.class);
        when(dispatcher.dispatch(any(), anyString(), any())).thenReturn(new DispatchAck(200, null, ""));
        channel = new FakeChannel();
        renderer = new RecordingRenderer();
        emitter = spy(new SummaryEmitter(mapper));
        registry = new SimpleMeterRegistry();
    }

    private MonitorSupervisor supervisor() {
        return supervisor(new MonitorSession("wf-test", Clock.systemUTC().instant()));
    }

    private MonitorSupervisor supervisor(MonitorSession session) {
        SessionConfig config = new SessionConfig(URI.create("http://engine"), URI.create("ws://engine"),
                outputDir, TICK);
        return new MonitorSupervisor(session, REQUEST, config, dispatcher, channel, new EventClassifier(),
                emitter, renderer, new MonitorMetrics(registry), Clock.systemUTC());
    }

    private RawEvent event(String json) {
        return parser.parse(json);
    }

    private JsonNode readArtifact(MonitorResult result) throws Exception {
        assertNotNull(result.artifact(), "summary should have been written");
        return mapper.readTree(result.artifact().toFile());
    }

    // =====================================================================
    //  Normal completion
    // =====================================================================

    @Nested
    @DisplayName("Workflow completion")
    class Completion {

        @Test
        @DisplayName("nmap scenario: one thought, one plan step, one finding, terminated")
        void nmapScenario() throws Exception {
            channel.stream.push(event("{\"type\":\"ai:thinking\",\"phase\":\"recon\",\"content\":\"Mapping hosts\"}"));
            channel.stream.push(event("{\"type\":\"test:plan\",\"plan\":{\"steps\":[{\"tool\":\"nmap\",\"purpose\":\"port scan\"}]}}"));
            channel.stream.push(event("{\"type\":\"finding\",\"description\":\"open-port 22\",\"severity\":\"high\"}"));
            channel.stream.push(event("{\"type\":\"workflow:complete\"}"));

            MonitorSupervisor supervisor = supervisor();
            MonitorResult result = supervisor.run();

            assertEquals(TerminationReason.WORKFLOW_COMPLETE, result.reason());
            assertTrue(supervisor.session().isTerminated());
            assertEquals(MonitorState.TERMINATED, supervisor.session().state());
            JsonNode json = readArtifact(result);
            assertEquals(1, json.get("thoughtLog").size());
            assertEquals(1, json.get("plan").get("steps").size());
            assertEquals("nmap", json.get("plan").get("steps").get(0).get("tool").asText());
            assertEquals(1, json.get("findings").size());
            assertEquals("WORKFLOW_COMPLETE", json.get("terminationReason").asText());
            assertTrue(json.get("duration").asDouble() >= 0);
            assertFalse(result.dispatchFailedBeforeListening());
            assertEquals(1, channel.stream.closes.get());
            verify(dispatcher, times(1)).dispatch(URI.create("http://engine"), "wf-test", REQUEST);
        }

        @Test
        @DisplayName("counts match thinking and finding events, in arrival order")
        void countsMatchArrivalOrder() throws Exception {
            channel.stream.push(event("{\"type\":\"ai:thinking\",\"content\":\"t1\"}"));
            channel.stream.push(event("{\"type\":\"finding\",\"description\":\"f1\"}"));
            channel.stream.push(event("{\"type\":\"progress\",\"pct\":10}"));
            channel.stream.push(event("{\"type\":\"ai:thinking\",\"content\":\"t2\"}"));
            channel.stream.push(event("{\"type\":\"ai:strategy\",\"strategy\":{}}"));
            channel.stream.push(event("{\"type\":\"finding\",\"description\":\"f2\"}"));
            channel.stream.push(event("{\"type\":\"ai:thinking\",\"content\":\"t3\"}"));
            channel.stream.push(event("{\"type\":\"workflow:complete\"}"));

            MonitorResult result = supervisor().run();

            JsonNode json = readArtifact(result);
            assertEquals(3, json.get("thoughtLog").size());
            assertEquals("t1", json.get("thoughtLog").get(0).get("text").asText());
            assertEquals("t3", json.get("thoughtLog").get(2).get("text").asText());
            assertEquals(2, json.get("findings").size());
            assertEquals("f1", json.get("findings").get(0).get("description").asText());
            assertEquals("f2", json.get("findings").get(1).get("description").asText());
        }

        @Test
        @DisplayName("the last plan is the one persisted")
        void lastPlanWins() throws Exception {
            channel.stream.push(event("{\"type\":\"test:plan\",\"plan\":{\"steps\":[{\"tool\":\"nmap\"}]}}"));
            channel.stream.push(event("{\"type\":\"test:plan\",\"plan\":{\"steps\":[{\"tool\":\"zap\"},{\"tool\":\"sqlmap\"}]}}"));
            channel.stream.push(event("{\"type\":\"workflow:complete\"}"));

            JsonNode json = readArtifact(supervisor().run());

            assertEquals(2, json.get("plan").get("steps").size());
            assertEquals("zap", json.get("plan").get("steps").get(0).get("tool").asText());
        }

        @Test
        @DisplayName("events after workflow complete are not processed")
        void stopsAtCompletion() throws Exception {
            channel.stream.push(event("{\"type\":\"workflow:complete\"}"));
            channel.stream.push(event("{\"type\":\"finding\",\"description\":\"late\"}"));

            JsonNode json = readArtifact(supervisor().run());

            assertEquals(0, json.get("findings").size());
        }

        @Test
        @DisplayName("renders request, finding and summary panels and records metrics")
        void rendersAndRecords() {
            channel.stream.push(event("{\"type\":\"finding\",\"severity\":\"critical\"}"));
            channel.stream.push(event("{\"type\":\"workflow:complete\"}"));

            MonitorResult result = supervisor().run();

            assertInstanceOf(DisplayAction.RequestPanel.class, renderer.actions().get(0));
            var finding = renderer.first(DisplayAction.FindingPanel.class);
            assertEquals(Severity.CRITICAL, finding.severity());
            var summary = renderer.first(DisplayAction.SummaryPanel.class);
            assertEquals(1, summary.findingCount());
            assertEquals(result.artifact(), summary.artifact());
            assertEquals(1.0, registry.find("planwatch.events.received").tag("type", "finding").counter().count());
            assertEquals(1.0, registry.find("planwatch.sessions.total")
                    .tag("reason", "WORKFLOW_COMPLETE").counter().count());
            assertEquals(1.0, registry.find("planwatch.dispatch.results")
                    .tag("result", "success").counter().count());
        }
    }

    // =====================================================================
    //  Other terminations
    // =====================================================================

    @Nested
    @DisplayName("Stream end and channel failure")
    class StreamEnd {

        @Test
        @DisplayName("a clean close without completion finalizes partial state as STREAM_CLOSED")
        void cleanClose() throws Exception {
            channel.stream.push(event("{\"type\":\"finding\",\"description\":\"f1\"}"));
            channel.stream.end();

            MonitorResult result = supervisor().run();

            assertEquals(TerminationReason.STREAM_CLOSED, result.reason());
            JsonNode json = readArtifact(result);
            assertEquals(1, json.get("findings").size());
            assertEquals("STREAM_CLOSED", json.get("terminationReason").asText());
        }

        @Test
        @DisplayName("a transport failure ends listening as CHANNEL_ERROR and keeps what arrived")
        void channelFailure() throws Exception {
            channel.stream.push(event("{\"type\":\"finding\",\"description\":\"before\"}"));
            channel.stream.fail(new ChannelException("connection reset"));

            MonitorResult result = supervisor().run();

            assertEquals(TerminationReason.CHANNEL_ERROR, result.reason());
            assertEquals(1, readArtifact(result).get("findings").size());
            var error = renderer.first(DisplayAction.ErrorPanel.class);
            assertEquals("connection reset", error.message());
        }

        @Test
        @DisplayName("a renderer failure does not stop the session")
        void rendererFailure() {
            DisplayRenderer exploding = action -> {
                if (action instanceof DisplayAction.FindingPanel) {
                    throw new IllegalStateException("terminal gone");
                }
            };
            channel.stream.push(event("{\"type\":\"finding\"}"));
            channel.stream.push(event("{\"type\":\"workflow:complete\"}"));
            SessionConfig config = new SessionConfig(URI.create("http://engine"), URI.create("ws://engine"),
                    outputDir, TICK);
            var supervisor = new MonitorSupervisor(new MonitorSession("wf-r", Clock.systemUTC().instant()),
                    REQUEST, config, dispatcher, channel, new EventClassifier(), emitter, exploding, null,
                    Clock.systemUTC());

            MonitorResult result = supervisor.run();

            assertEquals(TerminationReason.WORKFLOW_COMPLETE, result.reason());
            assertEquals(1, result.summary().findings().size());
        }
    }

    // =====================================================================
    //  Cancellation
    // =====================================================================

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("cancel before any event still writes a valid summary")
        void cancelBeforeAnyEvent() throws Exception {
            MonitorSupervisor supervisor = supervisor();
            CompletableFuture<MonitorResult> running = CompletableFuture.supplyAsync(supervisor::run);
            assertTrue(channel.opened.await(5, TimeUnit.SECONDS));

            supervisor.cancel();
            MonitorResult result = running.get(5, TimeUnit.SECONDS);

            assertEquals(TerminationReason.CANCELLED, result.reason());
            JsonNode json = readArtifact(result);
            assertEquals(0, json.get("thoughtLog").size());
            assertEquals(0, json.get("findings").size());
            assertTrue(json.get("plan").isNull());
            assertTrue(json.get("duration").asDouble() >= 0);
            assertTrue(supervisor.awaitFinished(Duration.ofSeconds(1)));
            assertEquals(1, channel.stream.closes.get());
        }

        @Test
        @DisplayName("cancel keeps events already received")
        void cancelKeepsPartialState() throws Exception {
            channel.stream.push(event("{\"type\":\"finding\",\"description\":\"kept\"}"));
            MonitorSupervisor supervisor = supervisor();
            CompletableFuture<MonitorResult> running = CompletableFuture.supplyAsync(supervisor::run);
            assertTrue(channel.stream.drained.await(5, TimeUnit.SECONDS));

            supervisor.cancel();
            MonitorResult result = running.get(5, TimeUnit.SECONDS);

            assertEquals(TerminationReason.CANCELLED, result.reason());
            assertEquals("kept", readArtifact(result).get("findings").get(0).get("description").asText());
        }

        @Test
        @DisplayName("completion racing cancellation finalizes exactly once")
        void completionRacingCancellation() throws Exception {
            for (int i = 0; i < 20; i++) {
                channel = new FakeChannel();
                emitter = spy(new SummaryEmitter(mapper));
                MonitorSupervisor supervisor = supervisor(new MonitorSession("wf-race-" + i, Clock.systemUTC().instant()));
                CompletableFuture<MonitorResult> running = CompletableFuture.supplyAsync(supervisor::run);
                assertTrue(channel.opened.await(5, TimeUnit.SECONDS));

                CountDownLatch go = new CountDownLatch(1);
                CompletableFuture<Void> canceller = CompletableFuture.runAsync(() -> {
                    awaitQuietly(go);
                    supervisor.cancel();
                });
                channel.stream.push(event("{\"type\":\"workflow:complete\"}"));
                go.countDown();

                MonitorResult result = running.get(5, TimeUnit.SECONDS);
                canceller.get(5, TimeUnit.SECONDS);

                verify(emitter, times(1)).emit(any(), any());
                assertTrue(result.reason() == TerminationReason.WORKFLOW_COMPLETE
                        || result.reason() == TerminationReason.CANCELLED);
                assertTrue(Files.exists(result.artifact()));
            }
        }

        @Test
        @DisplayName("cancel interrupts a hanging dispatch")
        void cancelInterruptsDispatch() throws Exception {
            CountDownLatch dispatching = new CountDownLatch(1);
            when(dispatcher.dispatch(any(), anyString(), any())).thenAnswer(invocation -> {
                dispatching.countDown();
                try {
                    Thread.sleep(60_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw DispatchException.transport("Dispatch interrupted", e);
                }
                return new DispatchAck(200, null, "");
            });
            MonitorSupervisor supervisor = supervisor();
            CompletableFuture<MonitorResult> running = CompletableFuture.supplyAsync(supervisor::run);
            assertTrue(dispatching.await(5, TimeUnit.SECONDS));

            supervisor.cancel();
            MonitorResult result = running.get(5, TimeUnit.SECONDS);

            assertEquals(TerminationReason.CANCELLED, result.reason());
            assertNull(result.dispatchError(), "an abandoned dispatch is not a dispatch failure");
        }

        @Test
        @DisplayName("a dispatch that answers after cancellation leaves the finalized session alone")
        void lateDispatchAfterCancel() throws Exception {
            CountDownLatch dispatching = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            CountDownLatch answered = new CountDownLatch(1);
            when(dispatcher.dispatch(any(), anyString(), any())).thenAnswer(invocation -> {
                dispatching.countDown();
                while (true) {
                    try {
                        release.await();
                        break;
                    } catch (InterruptedException ignored) {
                        // keep waiting, like a client that does not honour interrupts
                    }
                }
                answered.countDown();
                return new DispatchAck(202, com.fasterxml.jackson.databind.node.TextNode.valueOf("accepted"), "");
            });
            MonitorSession session = new MonitorSession("wf-late", Clock.systemUTC().instant());
            MonitorSupervisor supervisor = supervisor(session);
            CompletableFuture<MonitorResult> running = CompletableFuture.supplyAsync(supervisor::run);
            assertTrue(dispatching.await(5, TimeUnit.SECONDS));

            supervisor.cancel();
            MonitorResult result = running.get(5, TimeUnit.SECONDS);
            release.countDown();
            assertTrue(answered.await(5, TimeUnit.SECONDS));
            Thread.sleep(200);

            assertEquals(TerminationReason.CANCELLED, result.reason());
            assertTrue(session.startedAt().isEmpty());
            assertEquals(MonitorState.TERMINATED, session.state());
            assertTrue(renderer.actions().stream()
                    .filter(DisplayAction.StatusLine.class::isInstance)
                    .map(a -> ((DisplayAction.StatusLine) a).message())
                    .noneMatch(m -> m.startsWith("Workflow accepted")));
            assertTrue(renderer.actions().get(renderer.actions().size() - 1) instanceof DisplayAction.SummaryPanel);
        }

        @Test
        @DisplayName("a second run is rejected")
        void singleUse() {
            channel.stream.push(event("{\"type\":\"workflow:complete\"}"));
            MonitorSupervisor supervisor = supervisor();
            supervisor.run();
            assertThrows(IllegalStateException.class, supervisor::run);
        }
    }

    // =====================================================================
    //  Dispatch failure
    // =====================================================================

    @Nested
    @DisplayName("Dispatch failure")
    class DispatchFailure {

        @Test
        @DisplayName("transport failure: still listens, finalizes on cancel with empty logs from creation time")
        void transportFailureThenCancel() throws Exception {
            when(dispatcher.dispatch(any(), anyString(), any()))
                    .thenThrow(DispatchException.transport("Connection refused", null));
            channel.stream.connected = false;
            var session = new MonitorSession("wf-df", Clock.systemUTC().instant());
            MonitorSupervisor supervisor = supervisor(session);
            CompletableFuture<MonitorResult> running = CompletableFuture.supplyAsync(supervisor::run);
            assertTrue(channel.opened.await(5, TimeUnit.SECONDS));
            awaitDispatched(session);

            supervisor.cancel();
            MonitorResult result = running.get(5, TimeUnit.SECONDS);

            assertEquals(1, channel.openCount.get(), "listening is attempted despite the failed dispatch");
            assertEquals(TerminationReason.CANCELLED, result.reason());
            assertEquals(DispatchException.Kind.TRANSPORT, result.dispatchError().kind());
            assertFalse(result.channelOpened());
            assertTrue(result.dispatchFailedBeforeListening());
            assertTrue(session.startedAt().isEmpty());
            JsonNode json = readArtifact(result);
            assertEquals(0, json.get("thoughtLog").size());
            assertEquals(0, json.get("findings").size());
            assertTrue(json.get("duration").asDouble() >= 0);
            assertEquals("Connection refused", renderer.first(DisplayAction.ErrorPanel.class).message());
            assertEquals(1.0, registry.find("planwatch.dispatch.results")
                    .tag("result", "failure").counter().count());
        }

        @Test
        @DisplayName("protocol failure does not stop events from being recorded")
        void protocolFailureKeepsListening() throws Exception {
            when(dispatcher.dispatch(any(), anyString(), any()))
                    .thenThrow(DispatchException.protocol(500, "boom"));
            channel.stream.push(event("{\"type\":\"finding\",\"description\":\"still seen\"}"));
            channel.stream.push(event("{\"type\":\"workflow:complete\"}"));

            MonitorResult result = supervisor().run();

            assertEquals(TerminationReason.WORKFLOW_COMPLETE, result.reason());
            assertEquals(500, result.dispatchError().statusCode());
            assertTrue(result.channelOpened());
            assertFalse(result.dispatchFailedBeforeListening());
            assertEquals(1, readArtifact(result).get("findings").size());
        }

        @Test
        @DisplayName("channel that cannot connect after a failed dispatch ends as CHANNEL_ERROR")
        void bothChannelsFail() throws Exception {
            when(dispatcher.dispatch(any(), anyString(), any()))
                    .thenThrow(DispatchException.transport("Connection refused", null));
            channel.stream.connected = false;
            channel.stream.fail(new ChannelException("Cannot connect to event channel"));

            MonitorResult result = supervisor().run();

            assertEquals(TerminationReason.CHANNEL_ERROR, result.reason());
            assertTrue(result.dispatchFailedBeforeListening());
            assertNotNull(result.artifact());
        }

        private void awaitDispatched(MonitorSession session) throws InterruptedException {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (session.dispatchError().isEmpty() && System.nanoTime() < deadline) {
                Thread.sleep(5);
            }
            assertTrue(session.dispatchError().isPresent(), "dispatch should have failed by now");
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // =====================================================================
    //  Fakes
    // =====================================================================

    /**
     * In-memory channel handing out one scripted stream.
     */
    private static final class FakeChannel implements EventChannel {

        final FakeStream stream = new FakeStream();
        final CountDownLatch opened = new CountDownLatch(1);
        final AtomicInteger openCount = new AtomicInteger();

        @Override
        public EventStream open(URI wsUrl, String correlationId) {
            openCount.incrementAndGet();
            opened.countDown();
            return stream;
        }
    }

    private static final class FakeStream implements EventStream {

        private static final Object END = new Object();

        final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
        final AtomicInteger closes = new AtomicInteger();
        final CountDownLatch drained = new CountDownLatch(1);
        volatile boolean connected = true;
        private boolean finished;
        private ChannelException failure;

        void push(RawEvent event) {
            queue.add(event);
        }

        void end() {
            queue.add(END);
        }

        void fail(ChannelException error) {
            queue.add(error);
        }

        @Override
        public Optional<RawEvent> poll(Duration timeout) throws InterruptedException {
            if (finished) {
                if (failure != null) {
                    throw failure;
                }
                return Optional.empty();
            }
            Object next = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (next == null) {
                drained.countDown();
                return Optional.empty();
            }
            if (next instanceof RawEvent event) {
                return Optional.of(event);
            }
            finished = true;
            if (next instanceof ChannelException error) {
                failure = error;
                throw error;
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

        @Override
        public void close() {
            closes.incrementAndGet();
        }
    }

    private static final class RecordingRenderer implements DisplayRenderer {

        private final List<DisplayAction> actions = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void render(DisplayAction action) {
            actions.add(action);
        }

        List<DisplayAction> actions() {
            synchronized (actions) {
                return List.copyOf(actions);
            }
        }

        <A extends DisplayAction> A first(Class<A> type) {
            return actions().stream()
                    .filter(type::isInstance)
                    .map(type::cast)
                    .findFirst()
                    .orElseThrow(() -> new AssertionError("no " + type.getSimpleName() + " rendered"));
        }
    }
}
