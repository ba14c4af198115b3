package com.automation.engine.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Manages graceful shutdown of action execution.
 *
 * On shutdown:
 * 1. Stops accepting new dispatches
 * 2. Waits for in-flight invocations to finish (with timeout)
 * 3. Runs registered stop hooks, in registration order
 *
 * Invocations still running when the timeout is reached stay in ACTING
 * and are picked up by recovery on the next start.
 */
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);
    private static final long POLL_MILLIS = 100;

    private final Duration timeout;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final Set<UUID> activeInvocations = ConcurrentHashMap.newKeySet();
    private final List<Runnable> stopHooks = new CopyOnWriteArrayList<>();

    public GracefulShutdownHandler(Duration timeout) {
        this.timeout = timeout;
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Check if new dispatches can be accepted.
     */
    public boolean canAcceptDispatches() {
        return !shuttingDown.get();
    }

    /**
     * Register an invocation as in flight.
     *
     * @throws IllegalStateException once shutdown has started
     */
    public void registerActiveInvocation(UUID invocationId) {
        if (shuttingDown.get()) {
            throw new IllegalStateException("Cannot accept new dispatches during shutdown");
        }
        activeInvocations.add(invocationId);
        log.debug("Registered active invocation: {}", invocationId);
    }

    public void unregisterActiveInvocation(UUID invocationId) {
        activeInvocations.remove(invocationId);
        log.debug("Unregistered active invocation: {}", invocationId);
    }

    public int getActiveInvocationCount() {
        return activeInvocations.size();
    }

    /**
     * Add a hook run after in-flight invocations have drained.
     */
    public void onStop(Runnable hook) {
        stopHooks.add(hook);
    }

    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        shutdown();
    }

    /**
     * Stop accepting dispatches, drain and run stop hooks. Runs once.
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Initiating graceful shutdown of action execution");

        waitForActiveInvocations();

        for (Runnable hook : stopHooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                log.error("Stop hook failed: {}", e.getMessage(), e);
            }
        }

        log.info("Graceful shutdown complete");
    }

    private void waitForActiveInvocations() {
        if (activeInvocations.isEmpty()) {
            log.info("No in-flight invocations to wait for");
            return;
        }

        log.info("Waiting for {} in-flight invocations (timeout: {}s)",
            activeInvocations.size(), timeout.toSeconds());

        long deadline = System.currentTimeMillis() + timeout.toMillis();
        while (!activeInvocations.isEmpty() && System.currentTimeMillis() < deadline) {
            try {
                Thread.sleep(POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for invocations to complete");
                break;
            }
        }

        if (!activeInvocations.isEmpty()) {
            log.warn("Shutdown timeout reached, {} invocations left in ACTING for recovery: {}",
                activeInvocations.size(), activeInvocations);
        } else {
            log.info("All in-flight invocations completed");
        }
    }
}
