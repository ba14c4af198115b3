package com.automation.engine.window;

import com.automation.core.model.Event;
import com.automation.core.model.EventTrigger;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Waits for expected events after an arming event and fires when they do
 * not arrive before the deadline.
 *
 * With after patterns, each new after event re-arms the deadline at
 * {@code occurred + within}. Without after patterns every resolving
 * expect arms the next deadline from itself, so the trigger acts as a heartbeat.
 */
final class ProactiveWindow extends Window {

    private boolean armed;
    private UUID epochId;
    private Instant armedAt;
    private Instant deadline;
    private int expectCount;

    ProactiveWindow(TriggerInstanceKey key, EventTrigger trigger, Instant now) {
        super(key, trigger, now);
    }

    @Override
    Optional<WindowClosure> accept(Event event, boolean isAfter, boolean isExpect, Instant now) {
        Instant occurred = event.occurred();
        if (trigger.hasAfter()) {
            if (isAfter) {
                if (!armed || !occurred.isBefore(armedAt)) {
                    arm(event);
                }
                return Optional.empty();
            }
            if (isExpect && armed && inEpoch(occurred)) {
                expectCount++;
                if (expectCount >= trigger.requiredExpectCount()) {
                    resolve();
                }
            }
            return Optional.empty();
        }

        if (!isExpect) {
            return Optional.empty();
        }
        if (!armed) {
            arm(event);
        } else if (inEpoch(occurred)) {
            expectCount++;
            if (expectCount >= trigger.requiredExpectCount()) {
                arm(event);
            }
        }
        return Optional.empty();
    }

    private boolean inEpoch(Instant occurred) {
        return !occurred.isBefore(armedAt) && !occurred.isAfter(deadline);
    }

    private void arm(Event event) {
        armed = true;
        epochId = event.id();
        armedAt = event.occurred();
        deadline = armedAt.plus(trigger.within());
        expectCount = 0;
    }

    private void resolve() {
        armed = false;
        epochId = null;
        armedAt = null;
        deadline = null;
        expectCount = 0;
    }

    @Override
    Optional<WindowClosure> expire(Instant now) {
        if (!armed || !now.isAfter(deadline)) {
            return Optional.empty();
        }
        WindowClosure closure = closure(epochId, now, null);
        resolve();
        return Optional.of(closure);
    }

    @Override
    boolean hasObligation() {
        return armed;
    }

    @Override
    boolean isQuiescent() {
        return !armed;
    }

    Instant deadline() {
        return deadline;
    }
}
