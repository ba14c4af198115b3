package com.automation.core.model;

import com.automation.core.action.Action;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One action invocation bound to a specific firing.
 *
 * Invariants:
 * - id is derived from (firing.id, actionIndex) and is therefore stable
 *   across redelivery of the same firing
 */
public record TriggeredAction(
    UUID id,
    Automation automation,
    Firing firing,
    Instant triggered,
    @JsonProperty("triggering_labels")
    Map<String, String> triggeringLabels,
    @JsonProperty("triggering_event")
    Event triggeringEvent,
    Action action,
    @JsonProperty("action_index")
    int actionIndex
) {

    /**
     * Bind the action at {@code actionIndex} of {@code automation} to a firing.
     */
    public static TriggeredAction create(Automation automation, Firing firing, int actionIndex) {
        return new TriggeredAction(
            invocationId(firing.id(), actionIndex),
            automation,
            firing,
            firing.triggered(),
            firing.triggeringLabels(),
            firing.triggeringEvent(),
            automation.actions().get(actionIndex),
            actionIndex
        );
    }

    public static UUID invocationId(UUID firingId, int actionIndex) {
        String name = firingId + "|" + actionIndex;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
    }
}
