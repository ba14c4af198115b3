package com.automation.core.query;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What events can be grouped by when counting.
 */
public enum Countable {
    @JsonProperty("day")
    DAY,
    @JsonProperty("time")
    TIME,
    @JsonProperty("event")
    EVENT,
    @JsonProperty("resource")
    RESOURCE;

    /**
     * Time countables produce contiguous, zero-filled buckets.
     */
    public boolean isTimeBased() {
        return this == DAY || this == TIME;
    }

    public static Countable fromValue(String value) {
        for (Countable c : values()) {
            if (c.name().equalsIgnoreCase(value)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown countable: " + value);
    }
}
