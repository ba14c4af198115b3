package com.automation.core.orchestration;

/**
 * A rendered notification ready for delivery.
 */
public record Notification(String subject, String body, String destination) {
}
