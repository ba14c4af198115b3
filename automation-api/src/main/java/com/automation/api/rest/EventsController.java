package com.automation.api.rest;

import com.automation.core.exception.InvalidEventCountParametersException;
import com.automation.core.model.Event;
import com.automation.core.query.Countable;
import com.automation.core.query.EventCount;
import com.automation.core.query.EventFilter;
import com.automation.core.query.EventPage;
import com.automation.core.query.TimeUnit;
import com.automation.engine.service.EventService;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for event ingestion, queries and counts.
 */
@RestController
@RequestMapping("/api/events")
public class EventsController {

    private final EventService eventService;

    public EventsController(EventService eventService) {
        this.eventService = eventService;
    }

    /**
     * Publish a batch of events.
     */
    @PostMapping
    public ResponseEntity<Void> createEvents(@RequestBody List<Event> events) {
        eventService.publish(events);
        return ResponseEntity.noContent().build();
    }

    /**
     * Query events, newest first unless the filter orders otherwise.
     */
    @PostMapping("/filter")
    public ResponseEntity<EventPage> readEvents(@RequestBody(required = false) EventQueryRequest request) {
        EventFilter filter = request != null ? request.filter() : null;
        int limit = request != null && request.limit() != null ? request.limit() : EventService.INTERACTIVE_PAGE_SIZE;
        return ResponseEntity.ok(eventService.queryEvents(filter, limit));
    }

    /**
     * Follow a page token from a previous query.
     */
    @GetMapping("/filter/next")
    public ResponseEntity<EventPage> readNextPage(@RequestParam(name = "page-token", defaultValue = "") String pageToken) {
        return ResponseEntity.ok(eventService.nextPage(pageToken));
    }

    /**
     * Count events grouped by day, time bucket, event name or resource.
     */
    @PostMapping("/count-by/{countable}")
    public ResponseEntity<List<EventCount>> countEvents(
            @PathVariable String countable,
            @RequestBody(required = false) EventCountRequest request) {

        EventCountRequest body = request != null ? request : new EventCountRequest(null, null, null);
        TimeUnit timeUnit = body.timeUnit() != null ? TimeUnit.fromValue(body.timeUnit()) : TimeUnit.DAY;
        double interval = body.timeInterval() != null ? body.timeInterval() : 1.0;

        return ResponseEntity.ok(eventService.countEvents(parseCountable(countable), body.filter(), timeUnit, interval));
    }

    private static Countable parseCountable(String value) {
        try {
            return Countable.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidEventCountParametersException("Unknown countable: " + value);
        }
    }

    // ========== DTOs ==========

    public record EventQueryRequest(
        EventFilter filter,
        Integer limit
    ) {}

    public record EventCountRequest(
        EventFilter filter,
        @JsonProperty("time_unit")
        String timeUnit,
        @JsonProperty("time_interval")
        Double timeInterval
    ) {}
}
