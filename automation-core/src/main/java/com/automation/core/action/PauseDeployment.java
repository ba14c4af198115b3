package com.automation.core.action;

import com.automation.core.exception.ActionFailedException;
import com.automation.core.model.TriggeredAction;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

public record PauseDeployment(
    @JsonProperty("deployment_id")
    UUID deploymentId
) implements Action {

    public static final String TYPE = "pause-deployment";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public ActionResult act(TriggeredAction triggeredAction, ActionContext context) throws ActionFailedException {
        return DeploymentActions.setPaused(context, ActionTargets.deployment(triggeredAction, deploymentId), true);
    }
}
