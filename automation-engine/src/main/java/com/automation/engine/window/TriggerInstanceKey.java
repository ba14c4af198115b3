package com.automation.engine.window;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Identity of one trigger instance: an automation plus the values of its
 * for_each labels on the triggering resource.
 */
public record TriggerInstanceKey(UUID automationId, Map<String, String> labels) {

    public TriggerInstanceKey {
        labels = labels == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(labels));
    }

    /**
     * Compact form for logs.
     */
    public String describe() {
        return automationId + String.valueOf(labels.values());
    }
}
