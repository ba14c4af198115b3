package com.automation.engine.query;

import com.automation.core.query.EventFilter;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Continuation of an event query: the resolved filter and where the next page starts.
 */
public record PageToken(
    EventFilter filter,
    int offset,
    @JsonProperty("page_size")
    int pageSize
) {
}
