package com.automation.engine.trigger;

import com.automation.core.matching.ResourceMatcher;
import com.automation.core.model.Automation;
import com.automation.core.model.Event;
import com.automation.core.model.EventTrigger;
import com.automation.core.model.Firing;
import com.automation.engine.logging.LoggingContext;
import com.automation.engine.metrics.AutomationMetrics;
import com.automation.engine.window.TriggerInstanceKey;
import com.automation.engine.window.WindowClosure;
import com.automation.engine.window.WindowTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates events against every enabled automation and turns closed
 * window epochs into firings.
 *
 * Evaluation of one automation never affects another: failures are logged,
 * counted and skipped. Neither {@link #observe} nor {@link #sweep} throws.
 */
public class TriggerEngine {

    private static final Logger log = LoggerFactory.getLogger(TriggerEngine.class);

    private final AutomationCatalog catalog;
    private final WindowTracker tracker;
    private final Clock clock;
    private final AutomationMetrics metrics;

    public TriggerEngine(AutomationCatalog catalog, WindowTracker tracker, Clock clock, AutomationMetrics metrics) {
        this.catalog = catalog;
        this.tracker = tracker;
        this.clock = clock;
        this.metrics = metrics;
        metrics.trackWindows(tracker::size);
    }

    /**
     * Evaluate one event.
     *
     * @return firings completed by this event, at most one per automation
     */
    public List<Firing> observe(Event event) {
        List<Automation> automations;
        try {
            automations = catalog.enabled();
        } catch (RuntimeException e) {
            log.error("Cannot load automations, event {} not evaluated", event.id(), e);
            metrics.evaluationFailed(e.getClass().getSimpleName());
            return List.of();
        }

        List<Firing> firings = new ArrayList<>();
        for (Automation automation : automations) {
            try (var ctx = LoggingContext.forAutomation(automation.id(), event.id())) {
                evaluate(automation, event).ifPresent(firings::add);
            } catch (RuntimeException e) {
                log.error("Failed to evaluate automation {} against event {}", automation.id(), event.id(), e);
                metrics.evaluationFailed(e.getClass().getSimpleName());
            }
        }
        return firings;
    }

    Optional<Firing> evaluate(Automation automation, Event event) {
        EventTrigger trigger = automation.trigger();
        if (!ResourceMatcher.matches(trigger.match(), event.resource())) {
            return Optional.empty();
        }
        if (!ResourceMatcher.matchesRelated(trigger.matchRelated(), event.related())) {
            return Optional.empty();
        }
        boolean isAfter = ResourceMatcher.matchesAnyEvent(trigger.after(), event.event());
        boolean isExpect = ResourceMatcher.matchesEvent(trigger.expect(), event.event());
        if (!isAfter && !isExpect) {
            return Optional.empty();
        }

        TriggerInstanceKey key = new TriggerInstanceKey(automation.id(), trigger.triggeringLabels(event.resource()));
        return tracker.observe(key, trigger, event, isAfter, isExpect, clock.instant())
            .map(closure -> toFiring(closure));
    }

    /**
     * Fire expired proactive deadlines and drop idle windows.
     */
    public List<Firing> sweep(Instant now) {
        List<WindowClosure> closures;
        try {
            closures = tracker.sweep(now);
        } catch (RuntimeException e) {
            log.error("Window sweep failed", e);
            metrics.evaluationFailed(e.getClass().getSimpleName());
            return List.of();
        }

        List<Firing> firings = new ArrayList<>();
        for (WindowClosure closure : closures) {
            try (var ctx = LoggingContext.forWindow(closure.key())) {
                if (catalog.find(closure.key().automationId()).isEmpty()) {
                    log.info("Dropping expired deadline of automation {} which is no longer enabled",
                        closure.key().automationId());
                    continue;
                }
                firings.add(toFiring(closure));
            } catch (RuntimeException e) {
                log.error("Failed to fire expired deadline for {}", closure.key().describe(), e);
                metrics.evaluationFailed(e.getClass().getSimpleName());
            }
        }
        return firings;
    }

    private Firing toFiring(WindowClosure closure) {
        Firing firing = Firing.create(
            closure.key().automationId(),
            closure.trigger(),
            closure.key().labels(),
            closure.epochId(),
            closure.triggered(),
            closure.triggeringEvent()
        );
        metrics.fired(closure.trigger().posture());
        log.info("Automation {} fired for {} (firing={}, posture={})",
            firing.automationId(), firing.triggeringLabels(), firing.id(), closure.trigger().posture());
        return firing;
    }

    public AutomationCatalog catalog() {
        return catalog;
    }
}
