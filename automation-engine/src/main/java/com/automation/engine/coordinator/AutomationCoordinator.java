package com.automation.engine.coordinator;

import com.automation.core.action.Action;
import com.automation.core.action.ChangeFlowRunState;
import com.automation.core.action.SendNotification;
import com.automation.core.exception.AutomationValidationException;
import com.automation.core.exception.NotFoundException;
import com.automation.core.matching.ResourceMatcher;
import com.automation.core.model.Automation;
import com.automation.core.model.EventTrigger;
import com.automation.core.repository.AutomationRepository;
import com.automation.engine.service.AutomationService;
import com.automation.engine.trigger.AutomationCatalog;
import com.automation.engine.window.WindowTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Automation authoring coordinator.
 *
 * Every definition is validated before it is stored; a stored automation
 * never fails evaluation because of its own shape. Writes invalidate the
 * catalog, and edits, disables and deletes discard the automation's
 * open windows so a changed trigger starts from a clean state.
 */
public class AutomationCoordinator implements AutomationService {

    private static final Logger log = LoggerFactory.getLogger(AutomationCoordinator.class);

    private final AutomationRepository automationRepository;
    private final AutomationCatalog catalog;
    private final WindowTracker tracker;
    private final Clock clock;

    public AutomationCoordinator(
            AutomationRepository automationRepository,
            AutomationCatalog catalog,
            WindowTracker tracker,
            Clock clock) {
        this.automationRepository = automationRepository;
        this.catalog = catalog;
        this.tracker = tracker;
        this.clock = clock;
    }

    @Override
    public Automation createAutomation(AutomationRequest request) {
        validate(request);

        Automation automation = Automation.create(
            request.name(), request.description(), request.trigger(), request.actions(), clock.instant());
        if (Boolean.FALSE.equals(request.enabled())) {
            automation = automation.withEnabled(false, automation.created());
        }
        automationRepository.save(automation);
        catalog.invalidate();

        log.info("Created automation {} ({}) with {} actions",
            automation.id(), automation.name(), automation.actions().size());
        return automation;
    }

    @Override
    public Automation getAutomation(UUID automationId) {
        return automationRepository.findById(automationId)
            .orElseThrow(() -> new NotFoundException("Automation", automationId.toString()));
    }

    @Override
    public List<Automation> listAutomations() {
        return automationRepository.findAll();
    }

    @Override
    public Automation updateAutomation(UUID automationId, AutomationRequest request) {
        Automation existing = getAutomation(automationId);
        validate(request);

        boolean enabled = request.enabled() == null ? existing.enabled() : request.enabled();
        Automation updated = existing.withDefinition(
            request.name(), request.description(), enabled, request.trigger(), request.actions(), clock.instant());
        automationRepository.save(updated);
        tracker.forget(automationId);
        catalog.invalidate();

        log.info("Updated automation {} ({})", automationId, updated.name());
        return updated;
    }

    @Override
    public Automation setEnabled(UUID automationId, boolean enabled) {
        Automation existing = getAutomation(automationId);
        if (existing.enabled() == enabled) {
            return existing;
        }
        Automation updated = existing.withEnabled(enabled, clock.instant());
        automationRepository.save(updated);
        if (!enabled) {
            tracker.forget(automationId);
        }
        catalog.invalidate();

        log.info("{} automation {}", enabled ? "Enabled" : "Disabled", automationId);
        return updated;
    }

    @Override
    public void deleteAutomation(UUID automationId) {
        if (!automationRepository.delete(automationId)) {
            throw new NotFoundException("Automation", automationId.toString());
        }
        tracker.forget(automationId);
        catalog.invalidate();
        log.info("Deleted automation {}", automationId);
    }

    // ========== Validation ==========

    private void validate(AutomationRequest request) {
        List<String> problems = new ArrayList<>();

        if (request.name() == null || request.name().isBlank()) {
            problems.add("name: is required");
        }

        EventTrigger trigger = request.trigger();
        if (trigger == null) {
            problems.add("trigger: is required");
        } else {
            problems.addAll(validateTrigger(trigger));
        }

        if (request.actions() == null || request.actions().isEmpty()) {
            problems.add("actions: at least one action is required");
        } else {
            for (int i = 0; i < request.actions().size(); i++) {
                problems.addAll(validateAction(i, request.actions().get(i)));
            }
        }

        if (!problems.isEmpty()) {
            throw new AutomationValidationException(problems);
        }
    }

    private List<String> validateTrigger(EventTrigger trigger) {
        List<String> problems = new ArrayList<>();
        problems.addAll(ResourceMatcher.validate("match", trigger.match()));
        problems.addAll(ResourceMatcher.validate("match_related", trigger.matchRelated()));
        problems.addAll(ResourceMatcher.validateEventPatterns("after", trigger.after()));
        problems.addAll(ResourceMatcher.validateEventPatterns("expect", trigger.expect()));

        for (String label : trigger.forEach()) {
            if (label == null || label.isBlank()) {
                problems.add("for_each: label names must not be empty");
            }
        }
        if (trigger.threshold() < 0) {
            problems.add("threshold: must not be negative");
        }
        if (trigger.within().isNegative()) {
            problems.add("within: must not be negative");
        }
        if (trigger.isProactive() && trigger.within().isZero()) {
            problems.add("within: a proactive trigger needs a positive deadline");
        }
        return problems;
    }

    private List<String> validateAction(int index, Action action) {
        String field = "actions[" + index + "]";
        if (action == null) {
            return List.of(field + ": must not be null");
        }
        List<String> problems = new ArrayList<>();
        if (action instanceof ChangeFlowRunState change && change.state() == null) {
            problems.add(field + ".state: is required");
        }
        if (action instanceof SendNotification notification
                && (notification.body() == null || notification.body().isBlank())) {
            problems.add(field + ".body: is required");
        }
        return problems;
    }
}
