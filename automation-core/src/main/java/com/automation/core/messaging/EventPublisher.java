package com.automation.core.messaging;

import com.automation.core.model.Event;

import java.util.List;

/**
 * Single entry point for events entering the system, both ingested ones and
 * the outcome events emitted by actions.
 */
public interface EventPublisher {

    /**
     * Publish a batch of events. Order within the batch is preserved per resource.
     */
    void publish(List<Event> events);

    default void publish(Event event) {
        publish(List.of(event));
    }
}
