package com.automation.core.model;

import com.automation.core.action.Action;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A user-defined rule: one trigger plus the ordered actions to run when it fires.
 * Read on every event by the trigger engine, written by the administrative API.
 *
 * Primary Key: id
 */
public record Automation(
    UUID id,
    String name,
    String description,
    boolean enabled,
    EventTrigger trigger,
    List<Action> actions,
    Instant created,
    Instant updated
) {

    public Automation {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    /**
     * Create a new enabled automation.
     */
    public static Automation create(String name, String description, EventTrigger trigger,
                                    List<Action> actions, Instant now) {
        return new Automation(UUID.randomUUID(), name, description, true, trigger, actions, now, now);
    }

    /**
     * Create a copy carrying an edited definition. Identity and creation time are kept.
     */
    public Automation withDefinition(String name, String description, boolean enabled,
                                     EventTrigger trigger, List<Action> actions, Instant now) {
        return new Automation(id, name, description, enabled, trigger, actions, created, now);
    }

    /**
     * Create a copy with the enabled flag changed.
     */
    public Automation withEnabled(boolean enabled, Instant now) {
        return new Automation(id, name, description, enabled, trigger, actions, created, now);
    }
}
