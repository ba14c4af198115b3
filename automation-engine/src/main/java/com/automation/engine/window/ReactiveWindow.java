package com.automation.engine.window;

import com.automation.core.model.Event;
import com.automation.core.model.EventTrigger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Optional;
import java.util.UUID;

/**
 * Counts expected events and fires when the threshold is reached.
 *
 * With after patterns, an after event arms an epoch lasting {@code within}
 * (unbounded when within is zero) and only expects in that epoch count.
 * Without after patterns the window slides: expects older than
 * {@code within} before the newest one fall out of the count.
 */
final class ReactiveWindow extends Window {

    private final Deque<Event> expected = new ArrayDeque<>();
    private boolean armed;
    private UUID epochId;
    private Instant armedAt;
    private Instant latestOccurred;

    ReactiveWindow(TriggerInstanceKey key, EventTrigger trigger, Instant now) {
        super(key, trigger, now);
    }

    @Override
    Optional<WindowClosure> accept(Event event, boolean isAfter, boolean isExpect, Instant now) {
        Instant occurred = event.occurred();
        Duration within = trigger.within();
        if (latestOccurred == null || occurred.isAfter(latestOccurred)) {
            latestOccurred = occurred;
        } else if (!within.isZero() && occurred.isBefore(latestOccurred.minus(within))) {
            // outside the current window
            return Optional.empty();
        }

        if (trigger.hasAfter()) {
            if (armed && !within.isZero() && occurred.isAfter(armedAt.plus(within))) {
                disarm();
            }
            if (isAfter && !armed) {
                armed = true;
                epochId = event.id();
                armedAt = occurred;
                return Optional.empty();
            }
            if (!isExpect || !armed || occurred.isBefore(armedAt)) {
                return Optional.empty();
            }
            insert(event);
        } else {
            if (!isExpect) {
                return Optional.empty();
            }
            insert(event);
            prune();
            armed = true;
        }

        if (expected.size() >= trigger.threshold()) {
            UUID epoch = trigger.hasAfter() ? epochId : expected.peekFirst().id();
            disarm();
            return Optional.of(closure(epoch, now, event));
        }
        return Optional.empty();
    }

    /**
     * Keep the deque ordered by occurred time so pruning can stop early.
     */
    private void insert(Event event) {
        if (expected.isEmpty() || !event.occurred().isBefore(expected.peekLast().occurred())) {
            expected.addLast(event);
            return;
        }
        Deque<Event> tail = new ArrayDeque<>();
        while (!expected.isEmpty() && expected.peekLast().occurred().isAfter(event.occurred())) {
            tail.addFirst(expected.pollLast());
        }
        expected.addLast(event);
        expected.addAll(tail);
    }

    private void prune() {
        if (trigger.within().isZero()) {
            return;
        }
        Instant cutoff = latestOccurred.minus(trigger.within());
        Iterator<Event> it = expected.iterator();
        while (it.hasNext() && it.next().occurred().isBefore(cutoff)) {
            it.remove();
        }
    }

    private void disarm() {
        armed = false;
        epochId = null;
        armedAt = null;
        expected.clear();
    }

    @Override
    Optional<WindowClosure> expire(Instant now) {
        if (trigger.hasAfter() && armed && !trigger.within().isZero()
                && now.isAfter(armedAt.plus(trigger.within()))) {
            disarm();
        }
        return Optional.empty();
    }

    @Override
    boolean isQuiescent() {
        return !armed && expected.isEmpty();
    }

    int count() {
        return expected.size();
    }

    boolean isArmed() {
        return armed;
    }
}
