package com.automation.client;

import com.automation.core.exception.OrchestrationException;
import com.automation.core.orchestration.Notification;
import com.automation.core.orchestration.NotificationSender;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Delivers notifications as JSON POSTs to a webhook.
 * A notification with its own destination URL is sent there instead.
 */
public class WebhookNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationSender.class);

    private final URI webhookUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public WebhookNotificationSender(URI webhookUrl, ObjectMapper objectMapper, Duration requestTimeout) {
        this.webhookUrl = webhookUrl;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(requestTimeout)
            .build();
    }

    @Override
    public void send(Notification notification) {
        URI target = resolveTarget(notification);
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(target)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(notification)))
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new OrchestrationException(response.statusCode(),
                    "Webhook " + target + " answered HTTP " + response.statusCode());
            }
            log.info("Delivered notification '{}' to {}", notification.subject(), target);
        } catch (IOException e) {
            throw new OrchestrationException("Webhook " + target + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrchestrationException("Interrupted delivering notification to " + target, e);
        }
    }

    private URI resolveTarget(Notification notification) {
        String destination = notification.destination();
        if (destination != null && (destination.startsWith("http://") || destination.startsWith("https://"))) {
            return URI.create(destination);
        }
        return webhookUrl;
    }
}
