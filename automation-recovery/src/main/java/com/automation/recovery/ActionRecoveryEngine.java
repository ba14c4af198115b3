package com.automation.recovery;

import com.automation.core.model.ActionInvocation;
import com.automation.core.model.ActionState;
import com.automation.core.repository.ActionInvocationRepository;
import com.automation.engine.execution.ActionExecutor;
import com.automation.engine.lifecycle.GracefulShutdownHandler;
import com.automation.engine.metrics.AutomationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Recovery engine for the action ledger.
 *
 * Responsibilities:
 * - Find invocations left ACTING by a crash and act on them again
 * - Start invocations that were claimed PENDING but never ran, e.g. during shutdown
 *
 * Only invocations untouched for longer than the acting timeout are picked up,
 * so live executions are left alone. Actions are at-least-once across a crash.
 */
public class ActionRecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(ActionRecoveryEngine.class);

    private final ActionInvocationRepository ledger;
    private final ActionExecutor executor;
    private final GracefulShutdownHandler shutdownHandler;
    private final AutomationMetrics metrics;
    private final Clock clock;
    private final Duration actingTimeout;
    private final Duration scanInterval;
    private final int batchSize;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public ActionRecoveryEngine(
            ActionInvocationRepository ledger,
            ActionExecutor executor,
            GracefulShutdownHandler shutdownHandler,
            AutomationMetrics metrics,
            Clock clock,
            Duration actingTimeout,
            Duration scanInterval,
            int batchSize) {
        this.ledger = ledger;
        this.executor = executor;
        this.shutdownHandler = shutdownHandler;
        this.metrics = metrics;
        this.clock = clock;
        this.actingTimeout = actingTimeout;
        this.scanInterval = scanInterval;
        this.batchSize = batchSize;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "automation-recovery");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start the recovery engine. The first scan runs immediately so that work
     * left by a previous process is picked up on startup.
     */
    public void start() {
        if (running) {
            log.warn("Recovery engine already running");
            return;
        }

        running = true;
        log.info("Starting action recovery (scan interval: {}s, acting timeout: {}s)",
            scanInterval.toSeconds(), actingTimeout.toSeconds());

        scheduler.scheduleWithFixedDelay(
            this::poll,
            0,
            scanInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );
    }

    /**
     * Stop the recovery engine.
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
        log.info("Action recovery stopped");
    }

    /**
     * Re-drive every stale PENDING and ACTING invocation once.
     *
     * @return the number of invocations that reached SUCCEEDED
     */
    public int recoverOnce() {
        Instant cutoff = clock.instant().minus(actingTimeout);
        int succeeded = 0;
        succeeded += recover(ActionState.ACTING, cutoff);
        succeeded += recover(ActionState.PENDING, cutoff);
        return succeeded;
    }

    private int recover(ActionState state, Instant cutoff) {
        List<ActionInvocation> stale = ledger.findByState(state, cutoff, batchSize);
        if (stale.isEmpty()) {
            return 0;
        }

        log.info("Found {} {} invocations not updated since {}", stale.size(), state, cutoff);

        int succeeded = 0;
        for (ActionInvocation invocation : stale) {
            if (shutdownHandler.isShuttingDown()) {
                log.info("Shutdown in progress, leaving remaining invocations for the next start");
                break;
            }
            try {
                ActionInvocation result = executor.resume(invocation);
                boolean success = result.state() == ActionState.SUCCEEDED;
                metrics.actionRecovered(invocation.actionType(), success);
                if (success) {
                    succeeded++;
                }
                log.info("Recovered invocation {} ({}): {} -> {}",
                    invocation.invocationId(), invocation.actionType(), state, result.state());
            } catch (Exception e) {
                metrics.actionRecovered(invocation.actionType(), false);
                log.error("Failed to recover invocation: {}", invocation.invocationId(), e);
            }
        }
        return succeeded;
    }

    private void poll() {
        if (!running) return;

        try {
            recoverOnce();
        } catch (Exception e) {
            log.error("Error in action recovery", e);
        }
    }
}
