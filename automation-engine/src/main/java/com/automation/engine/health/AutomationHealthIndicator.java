package com.automation.engine.health;

import com.automation.core.model.ActionState;
import com.automation.core.repository.ActionInvocationRepository;
import com.automation.engine.config.AutomationProperties;
import com.automation.engine.lifecycle.GracefulShutdownHandler;
import com.automation.engine.metrics.AutomationMetrics;
import com.automation.engine.trigger.AutomationCatalog;
import com.automation.engine.window.WindowTracker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of the automation engine.
 * Reports:
 * - Storage reachability (through the automation catalog and the ledger)
 * - Live trigger windows and in-flight actions
 * - Invocations stuck in ACTING beyond the recovery timeout
 */
public class AutomationHealthIndicator implements HealthIndicator {

    private static final int STUCK_SCAN_LIMIT = 100;

    private final AutomationCatalog catalog;
    private final ActionInvocationRepository ledger;
    private final WindowTracker tracker;
    private final AutomationMetrics metrics;
    private final GracefulShutdownHandler shutdownHandler;
    private final AutomationProperties properties;
    private final Clock clock;

    public AutomationHealthIndicator(
            AutomationCatalog catalog,
            ActionInvocationRepository ledger,
            WindowTracker tracker,
            AutomationMetrics metrics,
            GracefulShutdownHandler shutdownHandler,
            AutomationProperties properties,
            Clock clock) {
        this.catalog = catalog;
        this.ledger = ledger;
        this.tracker = tracker;
        this.metrics = metrics;
        this.shutdownHandler = shutdownHandler;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("storage", properties.getStorage().getType());

        try {
            details.put("enabledAutomations", catalog.enabled().size());
        } catch (RuntimeException e) {
            details.put("storageError", e.getMessage());
            return Health.down().withDetails(details).build();
        }

        details.put("liveWindows", tracker.size());
        details.put("actionsInFlight", metrics.getInFlightCount());

        try {
            Instant cutoff = clock.instant().minus(properties.getRecovery().getActingTimeout());
            int stuck = ledger.findByState(ActionState.ACTING, cutoff, STUCK_SCAN_LIMIT).size();
            details.put("stuckInvocations", stuck);
            if (stuck >= STUCK_SCAN_LIMIT) {
                details.put("recoveryWarning", "Many invocations stuck in ACTING - recovery may be behind");
            }
        } catch (RuntimeException e) {
            details.put("ledgerError", e.getMessage());
            return Health.down().withDetails(details).build();
        }

        if (shutdownHandler.isShuttingDown()) {
            return Health.outOfService().withDetails(details).build();
        }
        return Health.up().withDetails(details).build();
    }
}
