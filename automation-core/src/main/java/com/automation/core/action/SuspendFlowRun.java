package com.automation.core.action;

import com.automation.core.exception.ActionFailedException;
import com.automation.core.model.TriggeredAction;
import com.automation.core.orchestration.FlowRunState;
import com.automation.core.orchestration.StateType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Pauses a flow run and releases its infrastructure.
 * The run is inferred from the firing when no id is configured.
 */
public record SuspendFlowRun(
    @JsonProperty("flow_run_id")
    UUID flowRunId
) implements Action {

    public static final String TYPE = "suspend-flow-run";

    public static SuspendFlowRun inferred() {
        return new SuspendFlowRun(null);
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
            FlowRunState.suspended("Suspended by automation " + triggeredAction.automation().id()),
            current -> current.type() == StateType.PAUSED
        );
    }
}
