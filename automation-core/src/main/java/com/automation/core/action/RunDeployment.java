package com.automation.core.action;

import com.automation.core.exception.ActionFailedException;
import com.automation.core.exception.OrchestrationException;
import com.automation.core.model.RelatedResource;
import com.automation.core.model.TriggeredAction;
import com.automation.core.orchestration.Deployment;
import com.automation.core.orchestration.FlowRun;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.UUID;

/**
 * Creates a flow run from a deployment.
 * The invocation id is the idempotency key, so redelivery never creates a second run.
 */
public record RunDeployment(
    @JsonProperty("deployment_id")
    UUID deploymentId,
    Map<String, Object> parameters
) implements Action {

    public static final String TYPE = "run-deployment";
    public static final String FLOW_RUN_ROLE = "flow-run";

    public RunDeployment {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public ActionResult act(TriggeredAction triggeredAction, ActionContext context) throws ActionFailedException {
        UUID target = ActionTargets.deployment(triggeredAction, deploymentId);
        try {
            FlowRun run = context.orchestration().createFlowRun(target, parameters, triggeredAction.id().toString());
            return ActionResult.of(
                ActionResult.CREATED,
                RelatedResource.of(Deployment.resourceId(target), ActionEvents.TARGET_ROLE),
                RelatedResource.of(run.resourceId(), FLOW_RUN_ROLE)
            );
        } catch (OrchestrationException e) {
            throw new ActionFailedException(e.getMessage(), e);
        }
    }
}
