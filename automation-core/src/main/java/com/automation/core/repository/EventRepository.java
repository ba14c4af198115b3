package com.automation.core.repository;

import com.automation.core.model.Event;
import com.automation.core.query.EventFilter;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Event persistence.
 * Events are append-only and immutable; append is idempotent by event id.
 */
public interface EventRepository {

    /**
     * Append an event to the store.
     *
     * @param event The event to append
     * @return true if stored, false if an event with the same id already exists
     */
    boolean append(Event event);

    /**
     * Append a batch of events, skipping ids that already exist.
     *
     * @param events The events to append, in order
     * @return The events that were newly stored, in input order
     */
    List<Event> appendAll(List<Event> events);

    /**
     * Find an event by ID.
     *
     * @param eventId The event ID
     * @return The event if found
     */
    Optional<Event> findById(UUID eventId);

    /**
     * Get one page of events matching a resolved filter, in the filter's order.
     *
     * @param filter A filter with a concrete occurred window
     * @param offset Number of matching events to skip
     * @param limit Maximum number of events to return
     * @return Matching events
     */
    List<Event> query(EventFilter filter, int offset, int limit);

    /**
     * Get every event matching a resolved filter, in the filter's order.
     *
     * @param filter A filter with a concrete occurred window
     * @return Matching events
     */
    List<Event> findAll(EventFilter filter);

    /**
     * Count events matching a resolved filter.
     *
     * @param filter A filter with a concrete occurred window
     * @return Number of matching events
     */
    long count(EventFilter filter);
}
