package com.automation.core.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One group of counted events.
 *
 * @param value the grouping key (bucket start, event name or resource id)
 * @param label human-readable form of the key
 * @param startTime earliest time covered by this group
 * @param endTime latest time covered by this group
 */
public record EventCount(
    String value,
    String label,
    long count,
    @JsonProperty("start_time")
    Instant startTime,
    @JsonProperty("end_time")
    Instant endTime
) {
}
