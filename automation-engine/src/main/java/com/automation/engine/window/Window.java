package com.automation.engine.window;

import com.automation.core.model.Event;
import com.automation.core.model.EventTrigger;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-instance evaluation state. All methods are called with {@link #lock} held.
 */
abstract sealed class Window permits ReactiveWindow, ProactiveWindow {

    static final int SEEN_CAPACITY = 1024;

    final TriggerInstanceKey key;
    final EventTrigger trigger;
    final ReentrantLock lock = new ReentrantLock();

    private final Map<UUID, Boolean> seen = new LinkedHashMap<>(16, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<UUID, Boolean> eldest) {
            return size() > SEEN_CAPACITY;
        }
    };

    private Instant lastTouched;
    private volatile boolean retired;

    Window(TriggerInstanceKey key, EventTrigger trigger, Instant now) {
        this.key = key;
        this.trigger = trigger;
        this.lastTouched = now;
    }

    static Window create(TriggerInstanceKey key, EventTrigger trigger, Instant now) {
        return trigger.isProactive()
            ? new ProactiveWindow(key, trigger, now)
            : new ReactiveWindow(key, trigger, now);
    }

    /**
     * Feed an event that matched the trigger's after or expect patterns.
     *
     * @return a closure when this event completed the trigger's condition
     */
    final Optional<WindowClosure> observe(Event event, boolean isAfter, boolean isExpect, Instant now) {
        lastTouched = now;
        if (seen.containsKey(event.id())) {
            return Optional.empty();
        }
        seen.put(event.id(), Boolean.TRUE);
        return accept(event, isAfter, isExpect, now);
    }

    abstract Optional<WindowClosure> accept(Event event, boolean isAfter, boolean isExpect, Instant now);

    /**
     * Close or fire whatever has timed out by {@code now}.
     */
    abstract Optional<WindowClosure> expire(Instant now);

    /**
     * True when nothing is pending, so the window can be dropped without losing a firing.
     */
    abstract boolean isQuiescent();

    /**
     * True while a deadline is outstanding; such windows are never dropped as idle.
     */
    boolean hasObligation() {
        return false;
    }

    final boolean isIdle(Instant now, Duration grace) {
        if (hasObligation()) {
            return false;
        }
        Instant touchedCutoff = now.minus(grace);
        if (isQuiescent() && lastTouched.isBefore(touchedCutoff)) {
            return true;
        }
        return lastTouched.isBefore(touchedCutoff.minus(trigger.within()));
    }

    final boolean isRetired() {
        return retired;
    }

    final void retire() {
        retired = true;
    }

    WindowClosure closure(UUID epochId, Instant triggered, Event triggeringEvent) {
        return new WindowClosure(key, trigger, epochId, triggered, triggeringEvent);
    }
}
