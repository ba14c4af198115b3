package com.automation.core.action;

import com.automation.core.exception.ActionFailedException;
import com.automation.core.exception.OrchestrationException;
import com.automation.core.model.RelatedResource;
import com.automation.core.orchestration.FlowRun;
import com.automation.core.orchestration.FlowRunState;
import com.automation.core.orchestration.OrchestrationClient;
import com.automation.core.orchestration.StateChangeResult;

import java.util.UUID;
import java.util.function.Predicate;

/**
 * Shared read-before-write logic for actions that move a flow run into a new state.
 */
final class FlowRunStateActions {

    private FlowRunStateActions() {
    }

    /**
     * Propose {@code desired} unless the run already satisfies {@code alreadyDone}.
     *
     * @return 200 when nothing needed changing, otherwise the orchestrated system's status
     */
    static ActionResult transition(ActionContext context, UUID flowRunId, FlowRunState desired,
                                   Predicate<FlowRunState> alreadyDone) throws ActionFailedException {
        OrchestrationClient client = context.orchestration();
        RelatedResource target = RelatedResource.of(FlowRun.resourceId(flowRunId), ActionEvents.TARGET_ROLE);
        try {
            FlowRun run = client.readFlowRun(flowRunId)
                .orElseThrow(() -> new ActionFailedException("Flow run " + flowRunId + " not found"));
            if (run.state() != null && alreadyDone.test(run.state())) {
                return ActionResult.of(ActionResult.OK, target);
            }
            StateChangeResult result = client.setFlowRunState(flowRunId, desired.at(context.clock().instant()));
            if (!result.accepted()) {
                throw new ActionFailedException(
                    "Failed to set state of flow run " + flowRunId + ": " + result.details());
            }
            return ActionResult.of(result.statusCode(), target);
        } catch (OrchestrationException e) {
            throw new ActionFailedException(e.getMessage(), e);
        }
    }
}
