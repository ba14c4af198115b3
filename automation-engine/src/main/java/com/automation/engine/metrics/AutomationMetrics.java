package com.automation.engine.metrics;

import com.automation.core.model.ActionState;
import com.automation.core.model.Posture;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntSupplier;

/**
 * Prometheus metrics for the automation engine.
 * Exposes key operational metrics for monitoring and alerting.
 *
 * Metrics exposed:
 * - Events ingested and deduplicated
 * - Trigger evaluation failures
 * - Firings by posture
 * - Action outcomes by type, duplicates and recoveries
 * - Live window and in-flight invocation gauges
 */
public class AutomationMetrics implements MeterBinder {

    // Metric names
    public static final String EVENTS_INGESTED = "automation.events.ingested";
    public static final String EVENTS_DUPLICATE = "automation.events.duplicate";
    public static final String EVENTS_FORWARDED = "automation.events.forwarded";

    public static final String EVALUATION_FAILURES = "automation.evaluation.failures";
    public static final String FIRINGS = "automation.firings";

    public static final String ACTIONS = "automation.actions";
    public static final String ACTION_DURATION = "automation.action.duration";
    public static final String ACTIONS_DUPLICATE = "automation.actions.duplicate";
    public static final String ACTIONS_RECOVERED = "automation.actions.recovered";

    public static final String WINDOWS_LIVE = "automation.windows.live";
    public static final String ACTIONS_IN_FLIGHT = "automation.actions.in_flight";

    private volatile MeterRegistry registry = new SimpleMeterRegistry();

    private final AtomicInteger inFlight = new AtomicInteger(0);
    private volatile IntSupplier liveWindows = () -> 0;

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(WINDOWS_LIVE, this, m -> m.liveWindows.getAsInt())
            .description("Number of trigger windows currently held in memory")
            .register(registry);

        Gauge.builder(ACTIONS_IN_FLIGHT, inFlight, AtomicInteger::get)
            .description("Number of action invocations currently executing")
            .register(registry);
    }

    /**
     * Source for the live window gauge.
     */
    public void trackWindows(IntSupplier liveWindows) {
        this.liveWindows = liveWindows;
    }

    // ========== Event Metrics ==========

    public void eventsIngested(int count) {
        Counter.builder(EVENTS_INGESTED)
            .description("Events newly appended to the event store")
            .register(registry)
            .increment(count);
    }

    public void eventsDuplicate(int count) {
        Counter.builder(EVENTS_DUPLICATE)
            .description("Events skipped because their id was already stored")
            .register(registry)
            .increment(count);
    }

    public void eventForwarded(boolean success) {
        Counter.builder(EVENTS_FORWARDED)
            .tag("success", String.valueOf(success))
            .description("Events forwarded to Kafka")
            .register(registry)
            .increment();
    }

    // ========== Trigger Metrics ==========

    public void evaluationFailed(String errorType) {
        Counter.builder(EVALUATION_FAILURES)
            .tag("error_type", errorType)
            .description("Trigger evaluations that raised an unexpected error")
            .register(registry)
            .increment();
    }

    public void fired(Posture posture) {
        Counter.builder(FIRINGS)
            .tag("posture", posture.name().toLowerCase())
            .description("Trigger firings")
            .register(registry)
            .increment();
    }

    // ========== Action Metrics ==========

    public void actionStarted() {
        inFlight.incrementAndGet();
    }

    public void actionFinished(String actionType, ActionState outcome, Duration duration) {
        inFlight.decrementAndGet();

        Counter.builder(ACTIONS)
            .tag("type", actionType)
            .tag("outcome", outcome.name().toLowerCase())
            .description("Action invocations by outcome")
            .register(registry)
            .increment();

        Timer.builder(ACTION_DURATION)
            .tag("type", actionType)
            .tag("outcome", outcome.name().toLowerCase())
            .description("Action execution duration")
            .register(registry)
            .record(duration);
    }

    public void actionDuplicate(String actionType) {
        Counter.builder(ACTIONS_DUPLICATE)
            .tag("type", actionType)
            .description("Invocations skipped because their id was already claimed")
            .register(registry)
            .increment();
    }

    public void actionRecovered(String actionType, boolean success) {
        Counter.builder(ACTIONS_RECOVERED)
            .tag("type", actionType)
            .tag("success", String.valueOf(success))
            .description("Invocations re-driven by recovery")
            .register(registry)
            .increment();
    }

    public int getInFlightCount() {
        return inFlight.get();
    }

    /**
     * Registry the counters are recorded in. Exposed for tests and health details.
     */
    public MeterRegistry registry() {
        return registry;
    }
}
