package com.automation.engine.dispatch;

import com.automation.core.model.Automation;
import com.automation.core.model.Firing;
import com.automation.core.model.TriggeredAction;
import com.automation.engine.execution.ActionExecutor;
import com.automation.engine.logging.LoggingContext;
import com.automation.engine.trigger.AutomationCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns firings into triggered actions, one per action of the automation,
 * and hands them to the executor without waiting for them.
 *
 * Triggered action ids derive from the firing id and action index, so
 * re-dispatching a firing produces the same ids and the ledger skips them.
 */
public class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    private final ActionExecutor executor;
    private final AutomationCatalog catalog;

    public ActionDispatcher(ActionExecutor executor, AutomationCatalog catalog) {
        this.executor = executor;
        this.catalog = catalog;
    }

    /**
     * Dispatch firings, resolving their automations from the catalog.
     * Firings of automations that are no longer enabled are dropped.
     *
     * @return the triggered actions handed to the executor
     */
    public List<TriggeredAction> dispatch(List<Firing> firings) {
        List<TriggeredAction> submitted = new ArrayList<>();
        for (Firing firing : firings) {
            Optional<Automation> automation = catalog.find(firing.automationId());
            if (automation.isEmpty()) {
                log.info("Dropping firing {} of automation {} which is no longer enabled",
                    firing.id(), firing.automationId());
                continue;
            }
            submitted.addAll(dispatch(firing, automation.get()));
        }
        return submitted;
    }

    /**
     * Dispatch every action of the automation for one firing.
     * Outcomes are recorded in the invocation ledger under each triggered action's id.
     */
    public List<TriggeredAction> dispatch(Firing firing, Automation automation) {
        List<TriggeredAction> submitted = new ArrayList<>();
        try (var ctx = LoggingContext.forAutomation(automation.id(), firing.triggeringEvent() == null
                ? null : firing.triggeringEvent().id())) {
            for (int index = 0; index < automation.actions().size(); index++) {
                TriggeredAction triggeredAction = TriggeredAction.create(automation, firing, index);
                log.debug("Dispatching action {} ({}) as {}",
                    index, triggeredAction.action().type(), triggeredAction.id());
                executor.submit(triggeredAction);
                submitted.add(triggeredAction);
            }
        }
        return submitted;
    }
}
