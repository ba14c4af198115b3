package com.automation.core.action;

import com.automation.core.exception.ActionFailedException;
import com.automation.core.model.Event;
import com.automation.core.model.RelatedResource;
import com.automation.core.model.Resource;
import com.automation.core.model.TriggeredAction;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Infers the object of an action from the firing that caused it.
 *
 * Lookup order: the firing's triggering labels, then the triggering event's
 * primary resource, then its related resources in event order.
 */
public final class ActionTargets {

    public static final String FLOW_RUN_PREFIX = "prefect.flow-run.";
    public static final String DEPLOYMENT_PREFIX = "prefect.deployment.";

    private ActionTargets() {
    }

    /**
     * Resolve the flow run to act on.
     *
     * @param selected explicitly configured id, or null to infer
     */
    public static UUID flowRun(TriggeredAction triggeredAction, UUID selected) throws ActionFailedException {
        if (selected != null) {
            return selected;
        }
        return infer(triggeredAction, FLOW_RUN_PREFIX)
            .orElseThrow(() -> new ActionFailedException("Unable to determine the flow run to act on"));
    }

    /**
     * Resolve the deployment to act on.
     *
     * @param selected explicitly configured id, or null to infer
     */
    public static UUID deployment(TriggeredAction triggeredAction, UUID selected) throws ActionFailedException {
        if (selected != null) {
            return selected;
        }
        return infer(triggeredAction, DEPLOYMENT_PREFIX)
            .orElseThrow(() -> new ActionFailedException("Unable to determine the deployment to act on"));
    }

    static Optional<UUID> infer(TriggeredAction triggeredAction, String prefix) {
        List<String> candidates = new ArrayList<>();
        String labelled = triggeredAction.triggeringLabels().get(Resource.ID);
        if (labelled != null) {
            candidates.add(labelled);
        }
        Event event = triggeredAction.triggeringEvent();
        if (event != null) {
            candidates.add(event.resourceId());
            for (RelatedResource related : event.related()) {
                candidates.add(related.id());
            }
        }
        for (String candidate : candidates) {
            Optional<UUID> id = parse(candidate, prefix);
            if (id.isPresent()) {
                return id;
            }
        }
        return Optional.empty();
    }

    static Optional<UUID> parse(String resourceId, String prefix) {
        if (resourceId == null || !resourceId.startsWith(prefix)) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(resourceId.substring(prefix.length())));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
