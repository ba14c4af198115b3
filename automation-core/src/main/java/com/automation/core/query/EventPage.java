package com.automation.core.query;

import com.automation.core.model.Event;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of query results.
 *
 * @param total number of events matching the filter across all pages
 * @param nextPage opaque token for the following page, null on the last page
 */
public record EventPage(
    List<Event> events,
    long total,
    @JsonProperty("next_page")
    String nextPage
) {

    public EventPage {
        events = events == null ? List.of() : List.copyOf(events);
    }
}
