package com.automation.engine.messaging;

import com.automation.core.model.Event;

import java.util.List;

/**
 * Copies newly stored events to an external log for other consumers.
 * Forwarding is best effort; it never blocks or fails ingestion.
 */
public interface EventForwarder extends AutoCloseable {

    void forward(List<Event> events);

    @Override
    void close();
}
