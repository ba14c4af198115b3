package com.automation.core.orchestration;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.UUID;

/**
 * The slice of a flow run that actions need to read.
 */
public record FlowRun(
    UUID id,
    String name,
    @JsonProperty("deployment_id")
    UUID deploymentId,
    FlowRunState state,
    Map<String, Object> parameters,
    @JsonProperty("idempotency_key")
    String idempotencyKey
) {

    public FlowRun {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public String resourceId() {
        return resourceId(id);
    }

    public static String resourceId(UUID flowRunId) {
        return "prefect.flow-run." + flowRunId;
    }

    public FlowRun withState(FlowRunState newState) {
        return new FlowRun(id, name, deploymentId, newState, parameters, idempotencyKey);
    }
}
