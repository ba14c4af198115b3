package com.automation.core.orchestration;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Port to the orchestrated system's state-transition API.
 * Implementations throw {@link com.automation.core.exception.OrchestrationException}
 * when a request cannot be completed.
 */
public interface OrchestrationClient {

    /**
     * Read a flow run.
     *
     * @return the flow run, or empty if it does not exist
     */
    Optional<FlowRun> readFlowRun(UUID flowRunId);

    /**
     * Propose a new state for a flow run.
     */
    StateChangeResult setFlowRunState(UUID flowRunId, FlowRunState state);

    Optional<Deployment> readDeployment(UUID deploymentId);

    /**
     * Create a flow run from a deployment. Repeated calls with the same
     * idempotency key return the run created by the first call.
     */
    FlowRun createFlowRun(UUID deploymentId, Map<String, Object> parameters, String idempotencyKey);

    /**
     * @return HTTP-style status of the request
     */
    int pauseDeployment(UUID deploymentId);

    /**
     * @return HTTP-style status of the request
     */
    int resumeDeployment(UUID deploymentId);
}
