package com.automation.engine.execution;

import com.automation.core.action.Action;
import com.automation.core.action.ActionContext;
import com.automation.core.action.ActionResult;
import com.automation.core.exception.ActionFailedException;
import com.automation.core.model.ActionInvocation;
import com.automation.core.model.ActionState;
import com.automation.core.model.TriggeredAction;
import com.automation.core.repository.ActionInvocationRepository;
import com.automation.engine.lifecycle.GracefulShutdownHandler;
import com.automation.engine.logging.LoggingContext;
import com.automation.engine.metrics.AutomationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs triggered actions through the invocation ledger.
 *
 * State machine per invocation id:
 * <pre>
 *   PENDING -> ACTING -> SUCCEEDED
 *                    \-> FAILED
 * </pre>
 *
 * The ledger claim makes execution at-most-once per id. Moving from
 * PENDING to ACTING is a compare-and-set, so two concurrent deliveries
 * of the same triggered action cannot both call act().
 */
public class ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(ActionExecutor.class);

    private final ActionInvocationRepository ledger;
    private final ActionContext context;
    private final AutomationMetrics metrics;
    private final ExecutorService pool;
    private final GracefulShutdownHandler shutdownHandler;

    public ActionExecutor(
            ActionInvocationRepository ledger,
            ActionContext context,
            AutomationMetrics metrics,
            ExecutorService pool,
            GracefulShutdownHandler shutdownHandler
    ) {
        this.ledger = ledger;
        this.context = context;
        this.metrics = metrics;
        this.pool = pool;
        this.shutdownHandler = shutdownHandler;
        shutdownHandler.onStop(this::stop);
    }

    /**
     * Run a triggered action asynchronously on the action pool.
     *
     * During shutdown the invocation is only claimed as PENDING and left
     * for recovery.
     */
    public CompletableFuture<Optional<ActionInvocation>> submit(TriggeredAction triggeredAction) {
        try {
            shutdownHandler.registerActiveInvocation(triggeredAction.id());
        } catch (IllegalStateException e) {
            log.warn("Shutting down, leaving invocation {} pending", triggeredAction.id());
            claim(triggeredAction);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return Optional.of(execute(triggeredAction));
                } finally {
                    shutdownHandler.unregisterActiveInvocation(triggeredAction.id());
                }
            }, pool);
        } catch (RejectedExecutionException e) {
            shutdownHandler.unregisterActiveInvocation(triggeredAction.id());
            log.warn("Action pool rejected invocation {}, leaving it pending", triggeredAction.id());
            claim(triggeredAction);
            return CompletableFuture.completedFuture(Optional.empty());
        }
    }

    /**
     * Claim and run a triggered action on the calling thread.
     *
     * @return the invocation as stored when this call finished with it
     */
    public ActionInvocation execute(TriggeredAction triggeredAction) {
        try (var ctx = LoggingContext.forInvocation(triggeredAction.automation().id(), triggeredAction.id())) {
            ActionInvocation pending = ActionInvocation.create(triggeredAction, context.clock().instant());
            if (!ledger.tryCreate(pending)) {
                ActionInvocation existing = ledger.findById(triggeredAction.id()).orElse(pending);
                if (existing.state() != ActionState.PENDING) {
                    log.info("Skipping duplicate invocation {} already {}", existing.invocationId(), existing.state());
                    metrics.actionDuplicate(existing.actionType());
                    return existing;
                }
                pending = existing;
            }
            return start(pending);
        }
    }

    /**
     * Re-drive an invocation whose outcome is unknown.
     * PENDING invocations are started, ACTING ones are acted on again;
     * terminal ones are returned unchanged.
     */
    public ActionInvocation resume(ActionInvocation invocation) {
        try (var ctx = LoggingContext.forInvocation(invocation.automationId(), invocation.invocationId())) {
            return switch (invocation.state()) {
                case PENDING -> start(invocation);
                case ACTING -> retry(invocation);
                default -> invocation;
            };
        }
    }

    private ActionInvocation retry(ActionInvocation acting) {
        ActionInvocation retried = acting.withRetriedAttempt(context.clock().instant());
        if (!ledger.update(retried, ActionState.ACTING)) {
            return current(acting);
        }
        log.info("Resuming invocation {} (attempt {})", retried.invocationId(), retried.attempts());
        return act(retried);
    }

    private ActionInvocation start(ActionInvocation pending) {
        ActionInvocation acting = pending.withState(ActionState.ACTING, context.clock().instant(), null);
        if (!ledger.update(acting, ActionState.PENDING)) {
            ActionInvocation stored = current(pending);
            log.info("Invocation {} was claimed concurrently, now {}", stored.invocationId(), stored.state());
            metrics.actionDuplicate(stored.actionType());
            return stored;
        }
        return act(acting);
    }

    private ActionInvocation act(ActionInvocation acting) {
        TriggeredAction triggeredAction = acting.triggeredAction();
        Action action = triggeredAction.action();
        Instant started = context.clock().instant();
        metrics.actionStarted();

        ActionState outcome = ActionState.FAILED;
        try {
            ActionResult result;
            try {
                result = action.act(triggeredAction, context);
            } catch (ActionFailedException e) {
                return failed(acting, e.getReason());
            } catch (RuntimeException e) {
                log.error("Action {} threw unexpectedly", action.type(), e);
                return failed(acting, "Unexpected error: " + e.getMessage());
            }

            try {
                action.succeed(triggeredAction, result, context);
            } catch (RuntimeException e) {
                log.error("Could not record outcome of invocation {}, leaving it for recovery",
                    acting.invocationId(), e);
                outcome = ActionState.ACTING;
                return acting;
            }
            ActionInvocation succeeded = acting.withState(ActionState.SUCCEEDED, context.clock().instant(), null);
            ledger.update(succeeded, ActionState.ACTING);
            outcome = ActionState.SUCCEEDED;
            log.info("Action {} of automation {} succeeded with status {}",
                action.type(), acting.automationId(), result.statusCode());
            return succeeded;
        } finally {
            metrics.actionFinished(action.type(), outcome, Duration.between(started, context.clock().instant()));
        }
    }

    private ActionInvocation failed(ActionInvocation acting, String reason) {
        TriggeredAction triggeredAction = acting.triggeredAction();
        log.warn("Action {} of automation {} failed: {}",
            triggeredAction.action().type(), acting.automationId(), reason);
        try {
            triggeredAction.action().fail(triggeredAction, reason, context);
        } catch (RuntimeException e) {
            log.error("Could not record failure of invocation {}, leaving it for recovery",
                acting.invocationId(), e);
            return acting;
        }
        ActionInvocation failed = acting.withState(ActionState.FAILED, context.clock().instant(), reason);
        ledger.update(failed, ActionState.ACTING);
        return failed;
    }

    private void claim(TriggeredAction triggeredAction) {
        try {
            ledger.tryCreate(ActionInvocation.create(triggeredAction, context.clock().instant()));
        } catch (RuntimeException e) {
            log.error("Could not claim invocation {}, the action is lost", triggeredAction.id(), e);
        }
    }

    private ActionInvocation current(ActionInvocation fallback) {
        return ledger.findById(fallback.invocationId()).orElse(fallback);
    }

    /**
     * Stop the action pool. Invoked by the shutdown handler after draining.
     */
    public void stop() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
