package com.automation.core.query;

import com.automation.core.exception.InvalidEventCountParametersException;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Bucket width units for time-based counting.
 */
public enum TimeUnit {
    @JsonProperty("week")
    WEEK(Duration.ofDays(7)),
    @JsonProperty("day")
    DAY(Duration.ofDays(1)),
    @JsonProperty("hour")
    HOUR(Duration.ofHours(1)),
    @JsonProperty("minute")
    MINUTE(Duration.ofMinutes(1)),
    @JsonProperty("second")
    SECOND(Duration.ofSeconds(1));

    public static final double MINIMUM_INTERVAL = 0.01;
    public static final int MAXIMUM_BUCKETS = 1000;

    private final Duration unit;

    TimeUnit(Duration unit) {
        this.unit = unit;
    }

    public Duration unit() {
        return unit;
    }

    /**
     * Width of one bucket of {@code interval} units.
     *
     * @throws InvalidEventCountParametersException if the interval is below the minimum
     */
    public Duration bucketWidth(double interval) {
        if (Double.isNaN(interval) || interval < MINIMUM_INTERVAL) {
            throw new InvalidEventCountParametersException(
                "time_interval must be at least " + MINIMUM_INTERVAL + ", got " + interval);
        }
        long nanos = Math.round(unit.toNanos() * interval);
        if (nanos <= 0) {
            throw new InvalidEventCountParametersException("time_interval is too small for unit " + this);
        }
        return Duration.ofNanos(nanos);
    }

    /**
     * Check that [since, until] splits into an acceptable number of buckets.
     *
     * @return the number of buckets
     * @throws InvalidEventCountParametersException if the range is inverted or too many buckets result
     */
    public long validateBuckets(Instant since, Instant until, double interval) {
        if (until.isBefore(since)) {
            throw new InvalidEventCountParametersException("occurred.until must not be before occurred.since");
        }
        Duration width = bucketWidth(interval);
        Duration range = Duration.between(since, until);
        long buckets = Math.max(1, ceilDiv(range.toNanos(), width.toNanos()));
        if (buckets > MAXIMUM_BUCKETS) {
            throw new InvalidEventCountParametersException(String.format(
                "The given interval would produce %d buckets, which exceeds the maximum of %d",
                buckets, MAXIMUM_BUCKETS));
        }
        return buckets;
    }

    private static long ceilDiv(long x, long y) {
        return -Math.floorDiv(-x, y);
    }

    public static TimeUnit fromValue(String value) {
        for (TimeUnit t : values()) {
            if (t.name().equalsIgnoreCase(value)) {
                return t;
            }
        }
        throw new InvalidEventCountParametersException("Unknown time_unit: " + value);
    }
}
