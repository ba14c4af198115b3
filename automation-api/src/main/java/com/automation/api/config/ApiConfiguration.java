package com.automation.api.config;

import com.automation.client.HttpOrchestrationClient;
import com.automation.client.WebhookNotificationSender;
import com.automation.core.orchestration.NotificationSender;
import com.automation.core.orchestration.OrchestrationClient;
import com.automation.core.repository.ActionInvocationRepository;
import com.automation.engine.config.AutomationProperties;
import com.automation.engine.dispatch.ActionDispatcher;
import com.automation.engine.execution.ActionExecutor;
import com.automation.engine.lifecycle.GracefulShutdownHandler;
import com.automation.engine.metrics.AutomationMetrics;
import com.automation.engine.orchestration.InMemoryOrchestrationClient;
import com.automation.engine.orchestration.LoggingNotificationSender;
import com.automation.engine.trigger.TriggerEngine;
import com.automation.recovery.ActionRecoveryEngine;
import com.automation.scheduler.DeadlineScheduler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Application-level wiring: outbound clients and the background services.
 *
 * Without {@code automation.orchestration.api-url} the service runs against an
 * in-memory orchestrated system; without {@code automation.notifications.webhook-url}
 * notifications are only logged.
 */
@Configuration
public class ApiConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ApiConfiguration.class);

    @Bean
    @ConditionalOnExpression("'${automation.orchestration.api-url:}' != ''")
    public OrchestrationClient httpOrchestrationClient(AutomationProperties properties, ObjectMapper objectMapper) {
        AutomationProperties.Orchestration orchestration = properties.getOrchestration();
        log.info("Using orchestration API at {}", orchestration.getApiUrl());
        return new HttpOrchestrationClient(orchestration.getApiUrl(), objectMapper, orchestration.getRequestTimeout());
    }

    @Bean
    @ConditionalOnExpression("'${automation.orchestration.api-url:}' == ''")
    public OrchestrationClient inMemoryOrchestrationClient(Clock clock) {
        log.warn("No orchestration API configured, actions run against an in-memory orchestrated system");
        return new InMemoryOrchestrationClient(clock);
    }

    @Bean
    @ConditionalOnExpression("'${automation.notifications.webhook-url:}' != ''")
    public NotificationSender webhookNotificationSender(AutomationProperties properties, ObjectMapper objectMapper) {
        return new WebhookNotificationSender(properties.getNotifications().getWebhookUrl(), objectMapper,
            properties.getOrchestration().getRequestTimeout());
    }

    @Bean
    @ConditionalOnExpression("'${automation.notifications.webhook-url:}' == ''")
    public NotificationSender loggingNotificationSender() {
        return new LoggingNotificationSender();
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public DeadlineScheduler deadlineScheduler(TriggerEngine triggerEngine, ActionDispatcher dispatcher,
                                               Clock clock, AutomationProperties properties) {
        return new DeadlineScheduler(triggerEngine, dispatcher, clock, properties.getEngine().getSweepInterval());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(prefix = "automation.recovery", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ActionRecoveryEngine actionRecoveryEngine(ActionInvocationRepository ledger, ActionExecutor executor,
                                                     GracefulShutdownHandler shutdownHandler,
                                                     AutomationMetrics metrics, Clock clock,
                                                     AutomationProperties properties) {
        AutomationProperties.Recovery recovery = properties.getRecovery();
        return new ActionRecoveryEngine(ledger, executor, shutdownHandler, metrics, clock,
            recovery.getActingTimeout(), recovery.getScanInterval(), recovery.getBatchSize());
    }
}
