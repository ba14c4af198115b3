package com.automation.core.action;

import com.automation.core.exception.ActionFailedException;
import com.automation.core.model.TriggeredAction;
import com.automation.core.orchestration.FlowRunState;
import com.automation.core.orchestration.StateType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Proposes an arbitrary state for a flow run.
 *
 * @param name display name of the new state, defaults to the type's name
 */
public record ChangeFlowRunState(
    @JsonProperty("flow_run_id")
    UUID flowRunId,
    StateType state,
    String name,
    String message
) implements Action {

    public static final String TYPE = "change-flow-run-state";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public ActionResult act(TriggeredAction triggeredAction, ActionContext context) throws ActionFailedException {
        if (state == null) {
            throw new ActionFailedException("No state configured");
        }
        UUID target = ActionTargets.flowRun(triggeredAction, flowRunId);
        String message = this.message != null
            ? this.message
            : "State changed by automation " + triggeredAction.automation().id();
        FlowRunState desired = new FlowRunState(state, displayName(), message, null);
        return FlowRunStateActions.transition(context, target, desired, desired::sameAs);
    }

    String displayName() {
        if (name != null) {
            return name;
        }
        String lower = state.name().toLowerCase();
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
