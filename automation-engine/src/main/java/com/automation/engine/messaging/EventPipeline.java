package com.automation.engine.messaging;

import com.automation.core.messaging.EventPublisher;
import com.automation.core.model.Event;
import com.automation.core.model.Firing;
import com.automation.core.repository.EventRepository;
import com.automation.engine.dispatch.ActionDispatcher;
import com.automation.engine.metrics.AutomationMetrics;
import com.automation.engine.trigger.TriggerEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Ingestion path shared by the HTTP API, the websocket and the engine's own
 * outcome events.
 *
 * publish() validates the whole batch, stores it (duplicates by id are
 * dropped), forwards the stored events and queues them for evaluation.
 * Evaluation runs on single-threaded shards chosen by resource id, so the
 * events of one resource are evaluated in arrival order.
 */
public class EventPipeline implements EventPublisher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventPipeline.class);

    private final EventRepository eventRepository;
    private final TriggerEngine triggerEngine;
    private final ActionDispatcher dispatcher;
    private final EventForwarder forwarder;
    private final AutomationMetrics metrics;
    private final Clock clock;
    private final ExecutorService[] shards;

    /**
     * @param forwarder may be null when no external log is configured
     */
    public EventPipeline(
            EventRepository eventRepository,
            TriggerEngine triggerEngine,
            ActionDispatcher dispatcher,
            EventForwarder forwarder,
            AutomationMetrics metrics,
            Clock clock,
            int shardCount
    ) {
        this.eventRepository = eventRepository;
        this.triggerEngine = triggerEngine;
        this.dispatcher = dispatcher;
        this.forwarder = forwarder;
        this.metrics = metrics;
        this.clock = clock;
        this.shards = new ExecutorService[Math.max(1, shardCount)];
        for (int i = 0; i < shards.length; i++) {
            int shard = i;
            shards[i] = Executors.newSingleThreadExecutor(r -> {
                Thread thread = new Thread(r, "automation-eval-" + shard);
                thread.setDaemon(true);
                return thread;
            });
        }
    }

    /**
     * Store and evaluate a batch of events.
     *
     * @throws com.automation.core.exception.EventValidationException if any event is invalid;
     *         nothing from the batch is stored in that case
     */
    @Override
    public void publish(List<Event> events) {
        if (events.isEmpty()) {
            return;
        }
        List<Event> received = new ArrayList<>(events.size());
        for (Event event : events) {
            Event stamped = event.received() == null ? event.receive(clock.instant()) : event;
            received.add(stamped.validate());
        }

        List<Event> stored = eventRepository.appendAll(received);
        metrics.eventsIngested(stored.size());
        if (stored.size() < received.size()) {
            metrics.eventsDuplicate(received.size() - stored.size());
            log.debug("Dropped {} duplicate events", received.size() - stored.size());
        }
        if (stored.isEmpty()) {
            return;
        }

        if (forwarder != null) {
            try {
                forwarder.forward(stored);
            } catch (RuntimeException e) {
                log.warn("Event forwarding failed: {}", e.getMessage());
            }
        }

        for (Event event : stored) {
            shardFor(event).execute(() -> evaluate(event));
        }
    }

    private void evaluate(Event event) {
        try {
            List<Firing> firings = triggerEngine.observe(event);
            if (!firings.isEmpty()) {
                dispatcher.dispatch(firings);
            }
        } catch (RuntimeException e) {
            log.error("Evaluation of event {} failed", event.id(), e);
            metrics.evaluationFailed(e.getClass().getSimpleName());
        }
    }

    private ExecutorService shardFor(Event event) {
        return shards[Math.floorMod(event.resourceId().hashCode(), shards.length)];
    }

    /**
     * Wait until every event queued so far has been evaluated.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitEvaluated(Duration timeout) throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(shards.length);
        for (ExecutorService shard : shards) {
            shard.execute(latch::countDown);
        }
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        for (ExecutorService shard : shards) {
            shard.shutdown();
        }
        try {
            for (ExecutorService shard : shards) {
                if (!shard.awaitTermination(5, TimeUnit.SECONDS)) {
                    shard.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (forwarder != null) {
            forwarder.close();
        }
    }
}
