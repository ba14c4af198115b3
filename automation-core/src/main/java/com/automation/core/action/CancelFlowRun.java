package com.automation.core.action;

import com.automation.core.exception.ActionFailedException;
import com.automation.core.model.TriggeredAction;
import com.automation.core.orchestration.FlowRunState;
import com.automation.core.orchestration.StateType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Moves a flow run to Cancelling.
 */
public record CancelFlowRun(
    @JsonProperty("flow_run_id")
    UUID flowRunId
) implements Action {

    public static final String TYPE = "cancel-flow-run";

    public static CancelFlowRun inferred() {
        return new CancelFlowRun(null);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public ActionResult act(TriggeredAction triggeredAction, ActionContext context) throws ActionFailedException {
        UUID target = ActionTargets.flowRun(triggeredAction, flowRunId);
        return FlowRunStateActions.transition(
            context,
            target,
            FlowRunState.cancelling("Cancelled by automation " + triggeredAction.automation().id()),
            current -> current.type() == StateType.CANCELLING || current.type() == StateType.CANCELLED
        );
    }
}
