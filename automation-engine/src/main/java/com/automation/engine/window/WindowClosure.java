package com.automation.engine.window;

import com.automation.core.model.Event;
import com.automation.core.model.EventTrigger;

import java.time.Instant;
import java.util.UUID;

/**
 * A window epoch that closed with a firing.
 *
 * @param epochId id of the event that opened the epoch
 * @param triggeringEvent the event that completed the condition, or null for a deadline
 */
public record WindowClosure(
    TriggerInstanceKey key,
    EventTrigger trigger,
    UUID epochId,
    Instant triggered,
    Event triggeringEvent
) {
}
