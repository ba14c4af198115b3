package com.automation.scheduler;

import com.automation.core.model.Firing;
import com.automation.engine.dispatch.ActionDispatcher;
import com.automation.engine.trigger.TriggerEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Time-based driver for proactive triggers.
 *
 * Responsibilities:
 * - Sweep trigger windows on a fixed delay
 * - Dispatch firings for deadlines that passed without the expected events
 * - Let the tracker close stale reactive epochs and drop idle windows
 */
public class DeadlineScheduler {

    private static final Logger log = LoggerFactory.getLogger(DeadlineScheduler.class);

    private final TriggerEngine triggerEngine;
    private final ActionDispatcher dispatcher;
    private final Clock clock;
    private final Duration sweepInterval;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public DeadlineScheduler(
            TriggerEngine triggerEngine,
            ActionDispatcher dispatcher,
            Clock clock,
            Duration sweepInterval) {
        if (sweepInterval.isZero() || sweepInterval.isNegative()) {
            throw new IllegalArgumentException("sweepInterval must be positive: " + sweepInterval);
        }
        this.triggerEngine = triggerEngine;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.sweepInterval = sweepInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "automation-deadlines");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Deadline scheduler already running");
            return;
        }

        running = true;
        log.info("Starting deadline scheduler (interval: {}ms)", sweepInterval.toMillis());

        scheduler.scheduleWithFixedDelay(
            this::poll,
            sweepInterval.toMillis(),
            sweepInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );
    }

    /**
     * Stop the scheduler. Windows stay in memory; a restart loses them.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Deadline scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Run one sweep at the current time and dispatch what fired.
     *
     * @return the firings produced by this sweep
     */
    public List<Firing> sweepOnce() {
        List<Firing> firings = triggerEngine.sweep(clock.instant());
        if (!firings.isEmpty()) {
            log.info("Deadline sweep produced {} firings", firings.size());
            dispatcher.dispatch(firings);
        }
        return firings;
    }

    private void poll() {
        if (!running) return;

        try {
            sweepOnce();
        } catch (Exception e) {
            log.error("Error sweeping trigger deadlines", e);
        }
    }
}
