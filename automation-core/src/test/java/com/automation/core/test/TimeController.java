package com.automation.core.test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable clock for testing time-dependent behavior.
 * Inject it wherever a {@link Clock} is expected and move time explicitly.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * TimeController time = TimeController.frozenAt(Instant.parse("2024-01-01T00:00:00Z"));
 * TriggerEngine engine = new TriggerEngine(catalog, tracker, time, metrics);
 *
 * engine.observe(runningEvent);
 * time.advance(Duration.ofMinutes(1));
 * List<Firing> fired = engine.sweep(time.instant());
 * }</pre>
 */
public class TimeController extends Clock {

    private final AtomicReference<Instant> currentTime;
    private final ZoneId zone;

    public TimeController(Instant startTime) {
        this(new AtomicReference<>(startTime), ZoneOffset.UTC);
    }

    private TimeController(AtomicReference<Instant> currentTime, ZoneId zone) {
        this.currentTime = currentTime;
        this.zone = zone;
    }

    /**
     * Create a frozen time controller at a specific time.
     */
    public static TimeController frozenAt(Instant time) {
        return new TimeController(time);
    }

    /**
     * Create a frozen time controller at a fixed, whole-minute instant.
     */
    public static TimeController frozen() {
        return new TimeController(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Override
    public Instant instant() {
        return currentTime.get();
    }

    public Instant now() {
        return currentTime.get();
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId newZone) {
        return new TimeController(currentTime, newZone);
    }

    /**
     * Advance time by a duration.
     */
    public Instant advance(Duration duration) {
        return currentTime.updateAndGet(t -> t.plus(duration));
    }

    public Instant advanceSeconds(long seconds) {
        return advance(Duration.ofSeconds(seconds));
    }

    public Instant advanceMinutes(long minutes) {
        return advance(Duration.ofMinutes(minutes));
    }

    /**
     * Set time to a specific instant.
     */
    public void setTime(Instant newTime) {
        currentTime.set(newTime);
    }
}
