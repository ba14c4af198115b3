package com.automation.engine.config;

import com.automation.core.action.ActionContext;
import com.automation.core.json.AutomationJson;
import com.automation.core.messaging.EventPublisher;
import com.automation.core.orchestration.NotificationSender;
import com.automation.core.orchestration.OrchestrationClient;
import com.automation.core.repository.ActionInvocationRepository;
import com.automation.core.repository.AutomationRepository;
import com.automation.core.repository.EventRepository;
import com.automation.engine.coordinator.AutomationCoordinator;
import com.automation.engine.coordinator.EventCoordinator;
import com.automation.engine.dispatch.ActionDispatcher;
import com.automation.engine.execution.ActionExecutor;
import com.automation.engine.health.AutomationHealthIndicator;
import com.automation.engine.health.KafkaHealthIndicator;
import com.automation.engine.lifecycle.GracefulShutdownHandler;
import com.automation.engine.messaging.EventForwarder;
import com.automation.engine.messaging.EventPipeline;
import com.automation.engine.messaging.KafkaEventForwarder;
import com.automation.engine.metrics.AutomationMetrics;
import com.automation.engine.query.PageTokenCodec;
import com.automation.engine.service.AutomationService;
import com.automation.engine.service.EventService;
import com.automation.engine.trigger.AutomationCatalog;
import com.automation.engine.trigger.TriggerEngine;
import com.automation.engine.window.WindowTracker;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the evaluation and execution pipeline.
 *
 * Repositories come from the persistence package, selected by
 * {@code automation.storage.type}. The orchestration client and the
 * notification sender are supplied by the application.
 */
@Configuration
@EnableConfigurationProperties(AutomationProperties.class)
public class AutomationEngineConfiguration {

    @Bean
    @Primary
    public ObjectMapper automationObjectMapper() {
        return AutomationJson.mapper();
    }

    @Bean
    public Clock automationClock() {
        return Clock.systemUTC();
    }

    @Bean
    public WindowTracker windowTracker(AutomationProperties properties) {
        return new WindowTracker(properties.getEngine().getWindowGrace());
    }

    @Bean
    public AutomationCatalog automationCatalog(AutomationRepository automationRepository, Clock clock,
                                               AutomationProperties properties) {
        return new AutomationCatalog(automationRepository, clock, properties.getEngine().getCatalogRefresh());
    }

    @Bean
    public TriggerEngine triggerEngine(AutomationCatalog catalog, WindowTracker tracker, Clock clock,
                                       AutomationMetrics metrics) {
        return new TriggerEngine(catalog, tracker, clock, metrics);
    }

    @Bean
    public GracefulShutdownHandler gracefulShutdownHandler(AutomationProperties properties) {
        return new GracefulShutdownHandler(properties.getEngine().getShutdownTimeout());
    }

    /**
     * Outcome events go back through the pipeline, which is created after
     * the executor; the provider breaks the construction cycle.
     */
    @Bean
    public ActionContext actionContext(OrchestrationClient orchestrationClient,
                                       NotificationSender notificationSender,
                                       ObjectProvider<EventPipeline> pipeline,
                                       Clock clock,
                                       AutomationProperties properties) {
        EventPublisher outcomes = events -> pipeline.getObject().publish(events);
        return new ActionContext(orchestrationClient, notificationSender, outcomes, clock,
            properties.getEvents().getNamespace());
    }

    @Bean
    public ActionExecutor actionExecutor(ActionInvocationRepository ledger, ActionContext context,
                                         AutomationMetrics metrics, GracefulShutdownHandler shutdownHandler,
                                         AutomationProperties properties) {
        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(properties.getEngine().getActionThreads(), r -> {
            Thread thread = new Thread(r, "automation-action-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        return new ActionExecutor(ledger, context, metrics, pool, shutdownHandler);
    }

    @Bean
    public ActionDispatcher actionDispatcher(ActionExecutor executor, AutomationCatalog catalog) {
        return new ActionDispatcher(executor, catalog);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "automation.kafka", name = "bootstrap-servers")
    public EventForwarder kafkaEventForwarder(AutomationProperties properties, ObjectMapper objectMapper,
                                              AutomationMetrics metrics) {
        return new KafkaEventForwarder(properties.getKafka().getBootstrapServers(),
            properties.getKafka().getTopic(), objectMapper, metrics);
    }

    @Bean(destroyMethod = "close")
    public EventPipeline eventPipeline(EventRepository eventRepository, TriggerEngine triggerEngine,
                                       ActionDispatcher dispatcher, ObjectProvider<EventForwarder> forwarder,
                                       AutomationMetrics metrics, Clock clock, AutomationProperties properties) {
        return new EventPipeline(eventRepository, triggerEngine, dispatcher, forwarder.getIfAvailable(),
            metrics, clock, properties.getEngine().getEvaluationShards());
    }

    @Bean
    public PageTokenCodec pageTokenCodec(ObjectMapper objectMapper, AutomationProperties properties) {
        return new PageTokenCodec(objectMapper, properties.getEvents().getPageTokenSecret());
    }

    @Bean
    public EventService eventService(EventPipeline pipeline, EventRepository eventRepository,
                                     PageTokenCodec pageTokenCodec, Clock clock) {
        return new EventCoordinator(pipeline, eventRepository, pageTokenCodec, clock);
    }

    @Bean
    public AutomationService automationService(AutomationRepository automationRepository,
                                               AutomationCatalog catalog, WindowTracker tracker, Clock clock) {
        return new AutomationCoordinator(automationRepository, catalog, tracker, clock);
    }

    @Bean
    public AutomationHealthIndicator automationHealthIndicator(
            AutomationCatalog catalog, ActionInvocationRepository ledger, WindowTracker tracker,
            AutomationMetrics metrics, GracefulShutdownHandler shutdownHandler,
            AutomationProperties properties, Clock clock) {
        return new AutomationHealthIndicator(catalog, ledger, tracker, metrics, shutdownHandler, properties, clock);
    }

    @Bean
    public KafkaHealthIndicator kafkaHealthIndicator(AutomationProperties properties) {
        return new KafkaHealthIndicator(properties);
    }
}
