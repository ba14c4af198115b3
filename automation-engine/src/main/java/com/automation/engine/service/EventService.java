package com.automation.engine.service;

import com.automation.core.model.Event;
import com.automation.core.query.Countable;
import com.automation.core.query.EventCount;
import com.automation.core.query.EventFilter;
import com.automation.core.query.EventPage;
import com.automation.core.query.TimeUnit;

import java.util.List;

/**
 * Event ingestion and querying.
 */
public interface EventService {

    int INTERACTIVE_PAGE_SIZE = 50;

    /**
     * Ingest a batch of events. Duplicate ids are ignored.
     *
     * @param events The events
     * @throws com.automation.core.exception.EventValidationException if any event is malformed
     */
    void publish(List<Event> events);

    /**
     * Get the first page of events matching a filter.
     *
     * @param filter The filter; a missing occurred window defaults to the last day
     * @param limit Page size, between 0 and {@link #INTERACTIVE_PAGE_SIZE}
     * @return The page, with a token when more events match
     */
    EventPage queryEvents(EventFilter filter, int limit);

    /**
     * Follow a page token.
     *
     * @param pageToken Token from a previous page
     * @return The next page
     * @throws com.automation.core.exception.InvalidPageTokenException if the token is empty or tampered with
     */
    EventPage nextPage(String pageToken);

    /**
     * Count matching events grouped by a countable.
     *
     * @param countable How to group
     * @param filter The filter
     * @param timeUnit Bucket unit for time countables
     * @param timeInterval Bucket width in units for time countables
     * @return Counts, in countable order
     */
    List<EventCount> countEvents(Countable countable, EventFilter filter, TimeUnit timeUnit, double timeInterval);
}
