package com.automation.core.orchestration;

/**
 * Port to notification delivery.
 */
public interface NotificationSender {

    /**
     * Deliver a notification.
     *
     * @throws com.automation.core.exception.OrchestrationException if delivery fails
     */
    void send(Notification notification);
}
