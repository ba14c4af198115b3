package com.automation.engine.coordinator;

import com.automation.core.exception.InvalidEventQueryException;
import com.automation.core.messaging.EventPublisher;
import com.automation.core.model.Event;
import com.automation.core.query.Countable;
import com.automation.core.query.EventCount;
import com.automation.core.query.EventCounter;
import com.automation.core.query.EventFilter;
import com.automation.core.query.EventPage;
import com.automation.core.query.TimeUnit;
import com.automation.core.repository.EventRepository;
import com.automation.engine.query.PageToken;
import com.automation.engine.query.PageTokenCodec;
import com.automation.engine.service.EventService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Event ingestion and query coordinator.
 *
 * Filters are resolved once, on the first page; page tokens carry the
 * resolved filter so later pages see the same occurred window.
 */
public class EventCoordinator implements EventService {

    private static final Logger log = LoggerFactory.getLogger(EventCoordinator.class);

    private final EventPublisher publisher;
    private final EventRepository eventRepository;
    private final PageTokenCodec pageTokens;
    private final Clock clock;

    public EventCoordinator(EventPublisher publisher, EventRepository eventRepository,
                            PageTokenCodec pageTokens, Clock clock) {
        this.publisher = publisher;
        this.eventRepository = eventRepository;
        this.pageTokens = pageTokens;
        this.clock = clock;
    }

    @Override
    public void publish(List<Event> events) {
        if (events == null || events.isEmpty()) {
            return;
        }
        log.debug("Publishing {} events", events.size());
        publisher.publish(events);
    }

    @Override
    public EventPage queryEvents(EventFilter filter, int limit) {
        if (limit < 0 || limit > INTERACTIVE_PAGE_SIZE) {
            throw new InvalidEventQueryException(
                "limit must be between 0 and " + INTERACTIVE_PAGE_SIZE + ", got " + limit);
        }
        EventFilter resolved = (filter == null ? EventFilter.all() : filter).resolve(clock.instant());
        return page(resolved, 0, limit);
    }

    @Override
    public EventPage nextPage(String pageToken) {
        PageToken token = pageTokens.decode(pageToken);
        return page(token.filter(), token.offset(), token.pageSize());
    }

    private EventPage page(EventFilter resolved, int offset, int pageSize) {
        long total = eventRepository.count(resolved);
        List<Event> events = pageSize == 0 ? List.of() : eventRepository.query(resolved, offset, pageSize);
        int nextOffset = offset + events.size();
        String next = pageSize > 0 && nextOffset < total
            ? pageTokens.encode(new PageToken(resolved, nextOffset, pageSize))
            : null;
        return new EventPage(events, total, next);
    }

    @Override
    public List<EventCount> countEvents(Countable countable, EventFilter filter, TimeUnit timeUnit, double timeInterval) {
        EventFilter resolved = (filter == null ? EventFilter.all() : filter).resolve(clock.instant());
        TimeUnit unit = timeUnit == null ? TimeUnit.DAY : timeUnit;
        // The interval is checked for every countable, not only the bucketed ones
        unit.bucketWidth(timeInterval);
        if (countable.isTimeBased()) {
            unit.validateBuckets(resolved.occurred().since(), resolved.occurred().until(), timeInterval);
        }
        return EventCounter.count(resolved, eventRepository.findAll(resolved), countable, unit, timeInterval);
    }
}
