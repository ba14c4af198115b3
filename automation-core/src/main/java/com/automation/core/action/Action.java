package com.automation.core.action;

import com.automation.core.exception.ActionFailedException;
import com.automation.core.model.TriggeredAction;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Something an automation does when it fires.
 *
 * The set of actions is closed: every variant is listed here and in the
 * Jackson subtype registry, keyed by the {@code type} discriminator.
 *
 * Implementations must be idempotent under redelivery of the same
 * TriggeredAction: they read the target's current state before writing,
 * and pass the invocation id as idempotency key where the target supports one.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = DoNothing.class, name = DoNothing.TYPE),
    @JsonSubTypes.Type(value = SuspendFlowRun.class, name = SuspendFlowRun.TYPE),
    @JsonSubTypes.Type(value = CancelFlowRun.class, name = CancelFlowRun.TYPE),
    @JsonSubTypes.Type(value = ChangeFlowRunState.class, name = ChangeFlowRunState.TYPE),
    @JsonSubTypes.Type(value = RunDeployment.class, name = RunDeployment.TYPE),
    @JsonSubTypes.Type(value = PauseDeployment.class, name = PauseDeployment.TYPE),
    @JsonSubTypes.Type(value = ResumeDeployment.class, name = ResumeDeployment.TYPE),
    @JsonSubTypes.Type(value = SendNotification.class, name = SendNotification.TYPE)
})
public sealed interface Action permits DoNothing, SuspendFlowRun, CancelFlowRun, ChangeFlowRunState,
        RunDeployment, PauseDeployment, ResumeDeployment, SendNotification {

    /**
     * The discriminator this action is registered under.
     */
    String type();

    /**
     * Apply the action's effect.
     *
     * @return status code and the resources the action touched
     * @throws ActionFailedException if the effect cannot be applied
     */
    ActionResult act(TriggeredAction triggeredAction, ActionContext context) throws ActionFailedException;

    /**
     * Report a successful invocation by publishing an action.executed event.
     */
    default void succeed(TriggeredAction triggeredAction, ActionResult result, ActionContext context) {
        context.publisher().publish(List.of(ActionEvents.executed(triggeredAction, result, context)));
    }

    /**
     * Report a failed invocation by publishing an action.failed event.
     */
    default void fail(TriggeredAction triggeredAction, String reason, ActionContext context) {
        context.publisher().publish(List.of(ActionEvents.failed(triggeredAction, reason, context)));
    }
}
