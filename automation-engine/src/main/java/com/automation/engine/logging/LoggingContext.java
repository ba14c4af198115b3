package com.automation.engine.logging;

import com.automation.engine.window.TriggerInstanceKey;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures logs carry the automation, invocation and event they concern.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forAutomation(automationId, eventId)) {
 *     log.info("Evaluating trigger"); // Automatically includes automationId, eventId
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [eval-3] INFO  c.a.e.t.TriggerEngine - Trigger fired
 *   automationId=abc-123 triggerKey=prefect.flow-run.456 eventId=789 traceId=1a2b3c4d
 */
public final class LoggingContext implements AutoCloseable {

    public static final String AUTOMATION_ID = "automationId";
    public static final String INVOCATION_ID = "invocationId";
    public static final String TRIGGER_KEY = "triggerKey";
    public static final String EVENT_ID = "eventId";
    public static final String SESSION_ID = "sessionId";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
    }

    /**
     * Create a logging context for evaluating one automation against an event.
     */
    public static LoggingContext forAutomation(UUID automationId, UUID eventId) {
        LoggingContext ctx = new LoggingContext();
        if (automationId != null) {
            MDC.put(AUTOMATION_ID, automationId.toString());
        }
        if (eventId != null) {
            MDC.put(EVENT_ID, eventId.toString());
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for work on one trigger instance.
     */
    public static LoggingContext forWindow(TriggerInstanceKey key) {
        LoggingContext ctx = forAutomation(key.automationId(), null);
        MDC.put(TRIGGER_KEY, key.describe());
        return ctx;
    }

    /**
     * Create a logging context for one action invocation.
     */
    public static LoggingContext forInvocation(UUID automationId, UUID invocationId) {
        LoggingContext ctx = forAutomation(automationId, null);
        if (invocationId != null) {
            MDC.put(INVOCATION_ID, invocationId.toString());
        }
        return ctx;
    }

    /**
     * Create a logging context for a streaming ingestion session.
     */
    public static LoggingContext forSession(String sessionId) {
        LoggingContext ctx = new LoggingContext();
        if (sessionId != null) {
            MDC.put(SESSION_ID, sessionId);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Add the current event to the context.
     */
    public static void setEventId(UUID eventId) {
        if (eventId != null) {
            MDC.put(EVENT_ID, eventId.toString());
        }
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(AUTOMATION_ID);
        MDC.remove(INVOCATION_ID);
        MDC.remove(TRIGGER_KEY);
        MDC.remove(EVENT_ID);
        MDC.remove(SESSION_ID);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request or worker loop.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
