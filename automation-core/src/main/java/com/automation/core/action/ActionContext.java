package com.automation.core.action;

import com.automation.core.messaging.EventPublisher;
import com.automation.core.orchestration.NotificationSender;
import com.automation.core.orchestration.OrchestrationClient;

import java.time.Clock;

/**
 * Collaborators available to actions while they run.
 *
 * @param namespace prefix of the outcome event names, e.g. {@code prefect-cloud}
 */
public record ActionContext(
    OrchestrationClient orchestration,
    NotificationSender notifications,
    EventPublisher publisher,
    Clock clock,
    String namespace
) {
}
