package com.automation.core.action;

import com.automation.core.exception.ActionFailedException;
import com.automation.core.exception.OrchestrationException;
import com.automation.core.model.RelatedResource;
import com.automation.core.orchestration.Deployment;
import com.automation.core.orchestration.OrchestrationClient;

import java.util.UUID;

/**
 * Shared read-before-write logic for pausing and resuming deployments.
 */
final class DeploymentActions {

    private DeploymentActions() {
    }

    static ActionResult setPaused(ActionContext context, UUID deploymentId, boolean paused) throws ActionFailedException {
        OrchestrationClient client = context.orchestration();
        RelatedResource target = RelatedResource.of(Deployment.resourceId(deploymentId), ActionEvents.TARGET_ROLE);
        try {
            Deployment deployment = client.readDeployment(deploymentId)
                .orElseThrow(() -> new ActionFailedException("Deployment " + deploymentId + " not found"));
            if (deployment.paused() == paused) {
                return ActionResult.of(ActionResult.OK, target);
            }
            int status = paused ? client.pauseDeployment(deploymentId) : client.resumeDeployment(deploymentId);
            if (status >= 300) {
                throw new ActionFailedException(
                    "Unexpected status " + status + " updating deployment " + deploymentId);
            }
            return ActionResult.of(status, target);
        } catch (OrchestrationException e) {
            throw new ActionFailedException(e.getMessage(), e);
        }
    }
}
