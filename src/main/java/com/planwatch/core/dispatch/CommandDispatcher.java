package com.planwatch.core.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwatch.core.config.MonitorProperties;
import com.planwatch.core.model.WorkflowOptions;
import com.planwatch.core.model.WorkflowRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Sends the one-shot start-workflow command to the engine's REST API.
 *
 * <p>Issues exactly one {@code POST /api/workflows/run} per call carrying the
 * correlation id both in the body ({@code workflowId}) and in the
 * {@code X-Workflow-Id} header. There is no retry: a failed dispatch is reported
 * to the caller as a {@link DispatchException} and the session carries on listening.
 */
@Service
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    static final String RUN_PATH = "/api/workflows/run";
    static final String WORKFLOW_ID_HEADER = "X-Workflow-Id";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    @Autowired
    public CommandDispatcher(HttpClient monitorHttpClient, ObjectMapper objectMapper, MonitorProperties properties) {
        this(monitorHttpClient, objectMapper, Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
    }

    CommandDispatcher(HttpClient httpClient, ObjectMapper objectMapper, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Sends the start-workflow command.
     *
     * @param backendUrl    engine base URL (e.g. http://localhost:8001)
     * @param correlationId id that scopes the event subscription
     * @param request       target, objective, scope and options
     * @return the engine's acknowledgement on any 2xx response
     * @throws DispatchException TRANSPORT on connection failure, PROTOCOL on non-2xx
     */
    public DispatchAck dispatch(URI backendUrl, String correlationId, WorkflowRequest request) {
        URI uri = resolve(backendUrl);
        String body = buildBody(correlationId, request);

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header(WORKFLOW_ID_HEADER, correlationId)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();

        log.info("Dispatching workflow {} to {} (target={}, scope={})",
                correlationId, uri, request.target(), request.scope());

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw DispatchException.transport("Cannot reach workflow engine at " + uri + ": " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw DispatchException.transport("Dispatch interrupted", e);
        }

        int status = response.statusCode();
        String responseBody = response.body();
        if (status < 200 || status >= 300) {
            log.warn("Workflow engine rejected dispatch of {} with HTTP {}", correlationId, status);
            throw DispatchException.protocol(status, responseBody);
        }

        log.info("Workflow {} accepted (HTTP {})", correlationId, status);
        return new DispatchAck(status, parseBody(responseBody), responseBody);
    }

    String buildBody(String correlationId, WorkflowRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("workflowId", correlationId);
        body.put("target", request.target());
        body.put("scope", request.scope());
        body.put("description", request.description());
        body.put("testType", request.testType());

        WorkflowOptions options = request.options();
        ObjectNode optionsNode = body.putObject("options");
        optionsNode.put("includeRecon", options.includeRecon());
        optionsNode.put("includeSubdomains", options.includeSubdomains());
        optionsNode.put("testAuthentication", options.testAuthentication());
        optionsNode.put("testAPIs", options.testApis());
        optionsNode.put("verboseLogging", options.verboseLogging());
        optionsNode.put("captureAIReasoning", options.captureAiReasoning());
        optionsNode.put("showThoughtProcess", options.showThoughtProcess());
        optionsNode.put("maxInitialTests", options.maxInitialTests());
        return body.toString();
    }

    private JsonNode parseBody(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            log.debug("Acknowledgement body is not JSON, keeping raw text: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static URI resolve(URI backendUrl) {
        String base = backendUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + RUN_PATH);
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
