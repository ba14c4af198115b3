package com.automation.client;

import com.automation.core.exception.OrchestrationException;
import com.automation.core.orchestration.Deployment;
import com.automation.core.orchestration.FlowRun;
import com.automation.core.orchestration.FlowRunState;
import com.automation.core.orchestration.OrchestrationClient;
import com.automation.core.orchestration.StateChangeResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Orchestration client for the orchestrated system's REST API.
 *
 * Usage:
 * <pre>
 * OrchestrationClient client = new HttpOrchestrationClient(
 *     URI.create("http://orchestrator:4200/api"), objectMapper, Duration.ofSeconds(10));
 * StateChangeResult result = client.setFlowRunState(flowRunId, FlowRunState.suspended("late"));
 * </pre>
 *
 * Transport failures and unexpected statuses surface as {@link OrchestrationException};
 * a 404 on a read is reported as an empty result.
 */
public class HttpOrchestrationClient implements OrchestrationClient {

    private static final Logger log = LoggerFactory.getLogger(HttpOrchestrationClient.class);

    static final String ACCEPT = "ACCEPT";

    private final String apiUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpOrchestrationClient(URI apiUrl, ObjectMapper objectMapper, Duration requestTimeout) {
        String url = apiUrl.toString();
        this.apiUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(requestTimeout)
            .build();
    }

    @Override
    public Optional<FlowRun> readFlowRun(UUID flowRunId) {
        HttpResponse<String> response = send(get("/flow_runs/" + flowRunId));
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        requireSuccess(response, "read flow run " + flowRunId);
        return Optional.of(read(response, FlowRun.class));
    }

    /**
     * Propose a state. The API answers 201 when the state was applied and 200
     * when the proposal was rejected or the run was already in that state; the
     * body's status says which.
     */
    @Override
    public StateChangeResult setFlowRunState(UUID flowRunId, FlowRunState state) {
        Map<String, Object> body = new HashMap<>();
        body.put("state", state);
        body.put("force", false);

        HttpResponse<String> response = send(post("/flow_runs/" + flowRunId + "/set_state", body));
        if (response.statusCode() == 404) {
            return StateChangeResult.rejected(404, "Flow run " + flowRunId + " not found");
        }
        requireSuccess(response, "set state of flow run " + flowRunId);

        JsonNode result = read(response, JsonNode.class);
        String status = result.path("status").asText("");
        if (ACCEPT.equals(status)) {
            log.info("Flow run {} accepted state {}", flowRunId, state.name());
            return StateChangeResult.accepted(response.statusCode());
        }
        String reason = result.path("details").path("reason").asText(status);
        log.info("Flow run {} did not accept state {}: {}", flowRunId, state.name(), reason);
        return StateChangeResult.rejected(response.statusCode(), reason);
    }

    @Override
    public Optional<Deployment> readDeployment(UUID deploymentId) {
        HttpResponse<String> response = send(get("/deployments/" + deploymentId));
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        requireSuccess(response, "read deployment " + deploymentId);
        return Optional.of(read(response, Deployment.class));
    }

    @Override
    public FlowRun createFlowRun(UUID deploymentId, Map<String, Object> parameters, String idempotencyKey) {
        Map<String, Object> body = new HashMap<>();
        body.put("parameters", parameters == null ? Map.of() : parameters);
        body.put("idempotency_key", idempotencyKey);

        HttpResponse<String> response = send(post("/deployments/" + deploymentId + "/create_flow_run", body));
        requireSuccess(response, "create flow run from deployment " + deploymentId);
        FlowRun created = read(response, FlowRun.class);
        log.info("Created flow run {} from deployment {}", created.id(), deploymentId);
        return created;
    }

    @Override
    public int pauseDeployment(UUID deploymentId) {
        return send(post("/deployments/" + deploymentId + "/pause_deployment", Map.of())).statusCode();
    }

    @Override
    public int resumeDeployment(UUID deploymentId) {
        return send(post("/deployments/" + deploymentId + "/resume_deployment", Map.of())).statusCode();
    }

    // ========== Helper Methods ==========

    private HttpRequest get(String path) {
        return HttpRequest.newBuilder()
            .uri(URI.create(apiUrl + path))
            .timeout(requestTimeout)
            .header("Accept", "application/json")
            .GET()
            .build();
    }

    private HttpRequest post(String path, Object body) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new OrchestrationException("Cannot serialize request to " + path, e);
        }
        return HttpRequest.newBuilder()
            .uri(URI.create(apiUrl + path))
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json))
            .build();
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            log.debug("{} {} -> {}", request.method(), request.uri(), response.statusCode());
            return response;
        } catch (IOException e) {
            throw new OrchestrationException(request.method() + " " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrchestrationException("Interrupted during " + request.method() + " " + request.uri(), e);
        }
    }

    private static void requireSuccess(HttpResponse<String> response, String operation) {
        if (response.statusCode() / 100 != 2) {
            throw new OrchestrationException(response.statusCode(),
                "Could not " + operation + ": HTTP " + response.statusCode() + " " + response.body());
        }
    }

    private <T> T read(HttpResponse<String> response, Class<T> type) {
        try {
            return objectMapper.readValue(response.body(), type);
        } catch (IOException e) {
            throw new OrchestrationException("Unreadable response from " + response.uri(), e);
        }
    }
}
