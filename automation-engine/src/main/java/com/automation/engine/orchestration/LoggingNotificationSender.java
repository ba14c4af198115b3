package com.automation.engine.orchestration;

import com.automation.core.orchestration.Notification;
import com.automation.core.orchestration.NotificationSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Writes notifications to the log. Used when no webhook is configured.
 */
public class LoggingNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSender.class);

    private final List<Notification> sent = new CopyOnWriteArrayList<>();

    @Override
    public void send(Notification notification) {
        log.info("Notification to {}: {} - {}",
            notification.destination() == null ? "default" : notification.destination(),
            notification.subject(), notification.body());
        sent.add(notification);
    }

    public List<Notification> sent() {
        return List.copyOf(sent);
    }
}
