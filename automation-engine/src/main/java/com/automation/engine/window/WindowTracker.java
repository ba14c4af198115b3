package com.automation.engine.window;

import com.automation.core.model.Event;
import com.automation.core.model.EventTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds window state for every live trigger instance.
 *
 * Updates to one key are serialized by that window's lock; different keys
 * proceed in parallel. Windows are created on the first relevant event and
 * removed only by {@link #sweep} or {@link #forget}.
 */
public class WindowTracker {

    private static final Logger log = LoggerFactory.getLogger(WindowTracker.class);

    private final Map<TriggerInstanceKey, Window> windows = new ConcurrentHashMap<>();
    private final Duration grace;

    public WindowTracker(Duration grace) {
        this.grace = grace;
    }

    /**
     * Record an event that matched the trigger's after or expect patterns.
     *
     * @param now processing time, used for idle tracking and as the firing time
     * @return a closure when this event made the trigger fire
     */
    public Optional<WindowClosure> observe(TriggerInstanceKey key, EventTrigger trigger, Event event,
                                           boolean isAfter, boolean isExpect, Instant now) {
        while (true) {
            Window window = windows.compute(key, (k, existing) -> {
                if (existing != null && existing.trigger.equals(trigger)) {
                    return existing;
                }
                if (existing != null) {
                    existing.retire();
                }
                return Window.create(k, trigger, now);
            });
            window.lock.lock();
            try {
                if (window.isRetired()) {
                    continue;
                }
                return window.observe(event, isAfter, isExpect, now);
            } finally {
                window.lock.unlock();
            }
        }
    }

    /**
     * Fire expired proactive deadlines, close stale reactive epochs and drop idle windows.
     *
     * @return closures for every deadline that expired
     */
    public List<WindowClosure> sweep(Instant now) {
        List<WindowClosure> fired = new ArrayList<>();
        int removed = 0;
        for (Window window : windows.values()) {
            window.lock.lock();
            try {
                if (window.isRetired()) {
                    continue;
                }
                window.expire(now).ifPresent(fired::add);
                if (window.isIdle(now, grace) && windows.remove(window.key, window)) {
                    window.retire();
                    removed++;
                }
            } finally {
                window.lock.unlock();
            }
        }
        if (removed > 0 || !fired.isEmpty()) {
            log.debug("Window sweep: {} deadlines expired, {} idle windows removed, {} live",
                fired.size(), removed, windows.size());
        }
        return fired;
    }

    /**
     * Drop every window of an automation, e.g. after it was edited or deleted.
     */
    public void forget(UUID automationId) {
        int removed = 0;
        for (Map.Entry<TriggerInstanceKey, Window> entry : windows.entrySet()) {
            if (entry.getKey().automationId().equals(automationId)) {
                Window window = entry.getValue();
                window.lock.lock();
                try {
                    if (windows.remove(entry.getKey(), window)) {
                        window.retire();
                        removed++;
                    }
                } finally {
                    window.lock.unlock();
                }
            }
        }
        if (removed > 0) {
            log.info("Forgot {} windows of automation {}", removed, automationId);
        }
    }

    public int size() {
        return windows.size();
    }

    boolean contains(TriggerInstanceKey key) {
        return windows.containsKey(key);
    }
}
