package com.automation.engine.orchestration;

import com.automation.core.exception.OrchestrationException;
import com.automation.core.orchestration.Deployment;
import com.automation.core.orchestration.FlowRun;
import com.automation.core.orchestration.FlowRunState;
import com.automation.core.orchestration.OrchestrationClient;
import com.automation.core.orchestration.StateChangeResult;
import com.automation.core.orchestration.StateType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Orchestrated system held in memory.
 *
 * Used when no orchestration API is configured, and by tests. It applies
 * proposals the way the real API answers them: 201 for an accepted state,
 * 409 when the run is already in a final state, 404 for unknown runs.
 */
public class InMemoryOrchestrationClient implements OrchestrationClient {

    private static final Logger log = LoggerFactory.getLogger(InMemoryOrchestrationClient.class);

    private final Clock clock;
    private final Map<UUID, FlowRun> flowRuns = new ConcurrentHashMap<>();
    private final Map<UUID, Deployment> deployments = new ConcurrentHashMap<>();
    private final Map<String, FlowRun> runsByIdempotencyKey = new ConcurrentHashMap<>();
    private final Map<UUID, List<FlowRunState>> proposals = new ConcurrentHashMap<>();

    public InMemoryOrchestrationClient(Clock clock) {
        this.clock = clock;
    }

    public void register(FlowRun flowRun) {
        flowRuns.put(flowRun.id(), flowRun);
    }

    public void register(Deployment deployment) {
        deployments.put(deployment.id(), deployment);
    }

    @Override
    public Optional<FlowRun> readFlowRun(UUID flowRunId) {
        return Optional.ofNullable(flowRuns.get(flowRunId));
    }

    @Override
    public StateChangeResult setFlowRunState(UUID flowRunId, FlowRunState state) {
        proposals.computeIfAbsent(flowRunId, id -> new ArrayList<>()).add(state);
        FlowRun[] applied = new FlowRun[1];
        StateChangeResult[] result = new StateChangeResult[1];
        flowRuns.computeIfPresent(flowRunId, (id, run) -> {
            if (run.state() != null && run.state().type().isFinal()) {
                result[0] = StateChangeResult.rejected(409,
                    "Flow run is already in final state " + run.state().name());
                return run;
            }
            applied[0] = run.withState(state.at(clock.instant()));
            result[0] = StateChangeResult.accepted(201);
            return applied[0];
        });
        if (result[0] == null) {
            return StateChangeResult.rejected(404, "Flow run " + flowRunId + " not found");
        }
        if (applied[0] != null) {
            log.info("Flow run {} moved to {}", flowRunId, state.name());
        }
        return result[0];
    }

    @Override
    public Optional<Deployment> readDeployment(UUID deploymentId) {
        return Optional.ofNullable(deployments.get(deploymentId));
    }

    @Override
    public FlowRun createFlowRun(UUID deploymentId, Map<String, Object> parameters, String idempotencyKey) {
        Deployment deployment = deployments.get(deploymentId);
        if (deployment == null) {
            throw new OrchestrationException(404, "Deployment " + deploymentId + " not found");
        }
        if (idempotencyKey == null) {
            return newRun(deployment, parameters, null);
        }
        return runsByIdempotencyKey.computeIfAbsent(idempotencyKey,
            key -> newRun(deployment, parameters, key));
    }

    private FlowRun newRun(Deployment deployment, Map<String, Object> parameters, String idempotencyKey) {
        FlowRun run = new FlowRun(
            UUID.randomUUID(),
            deployment.name() + "-run",
            deployment.id(),
            new FlowRunState(StateType.SCHEDULED, "Scheduled", null, clock.instant()),
            parameters,
            idempotencyKey
        );
        flowRuns.put(run.id(), run);
        log.info("Created flow run {} from deployment {}", run.id(), deployment.id());
        return run;
    }

    @Override
    public int pauseDeployment(UUID deploymentId) {
        return setPaused(deploymentId, true);
    }

    @Override
    public int resumeDeployment(UUID deploymentId) {
        return setPaused(deploymentId, false);
    }

    private int setPaused(UUID deploymentId, boolean paused) {
        Deployment updated = deployments.computeIfPresent(deploymentId, (id, d) -> d.withPaused(paused));
        return updated == null ? 404 : 204;
    }

    /**
     * Every state proposed for a flow run, accepted or not, in call order.
     */
    public List<FlowRunState> proposals(UUID flowRunId) {
        return List.copyOf(proposals.getOrDefault(flowRunId, List.of()));
    }

    public int flowRunCount() {
        return flowRuns.size();
    }
}
