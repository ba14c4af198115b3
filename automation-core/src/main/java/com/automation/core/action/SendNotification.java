package com.automation.core.action;

import com.automation.core.exception.ActionFailedException;
import com.automation.core.exception.OrchestrationException;
import com.automation.core.model.TriggeredAction;
import com.automation.core.orchestration.Notification;

/**
 * Sends a templated message through the configured notification sender.
 * Subject and body may reference the firing, see {@link ActionTemplates}.
 *
 * @param destination sender-specific address; null uses the sender's default
 */
public record SendNotification(
    String subject,
    String body,
    String destination
) implements Action {

    public static final String TYPE = "send-notification";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public ActionResult act(TriggeredAction triggeredAction, ActionContext context) throws ActionFailedException {
        Notification notification = new Notification(
            ActionTemplates.render(subject, triggeredAction),
            ActionTemplates.render(body, triggeredAction),
            destination
        );
        try {
            context.notifications().send(notification);
        } catch (OrchestrationException e) {
            throw new ActionFailedException("Notification delivery failed: " + e.getMessage(), e);
        }
        return ActionResult.of(ActionResult.OK);
    }
}
