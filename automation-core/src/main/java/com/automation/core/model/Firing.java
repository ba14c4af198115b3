package com.automation.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * A single qualifying evaluation of a trigger. Immutable.
 *
 * Invariants:
 * - id is derived from (automationId, triggeringLabels, epochId), so the same
 *   window epoch always yields the same firing id
 * - triggeringEvent is null for proactive firings caused by a deadline
 */
public record Firing(
    UUID id,
    @JsonProperty("automation_id")
    UUID automationId,
    EventTrigger trigger,
    @JsonProperty("trigger_states")
    Set<TriggerState> triggerStates,
    Instant triggered,
    @JsonProperty("triggering_labels")
    Map<String, String> triggeringLabels,
    @JsonProperty("triggering_event")
    Event triggeringEvent
) {

    public Firing {
        triggerStates = triggerStates == null ? Set.of(TriggerState.TRIGGERED) : Set.copyOf(triggerStates);
        triggeringLabels = triggeringLabels == null ? Map.of() : Map.copyOf(triggeringLabels);
    }

    /**
     * Create a firing for a closed window epoch.
     *
     * @param epochId id of the event that opened the epoch
     * @param triggeringEvent the event that completed the condition, or null for a timeout
     */
    public static Firing create(
            UUID automationId,
            EventTrigger trigger,
            Map<String, String> triggeringLabels,
            UUID epochId,
            Instant triggered,
            Event triggeringEvent) {
        return new Firing(
            firingId(automationId, triggeringLabels, epochId),
            automationId,
            trigger,
            Set.of(TriggerState.TRIGGERED),
            triggered,
            triggeringLabels,
            triggeringEvent
        );
    }

    /**
     * Deterministic firing identity.
     */
    public static UUID firingId(UUID automationId, Map<String, String> triggeringLabels, UUID epochId) {
        String name = automationId + "|" + new TreeMap<>(triggeringLabels) + "|" + epochId;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
    }

    public boolean hasTriggeringEvent() {
        return triggeringEvent != null;
    }
}
