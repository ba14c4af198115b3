package com.automation.core.orchestration;

import java.util.UUID;

/**
 * The slice of a deployment that actions need to read.
 */
public record Deployment(UUID id, String name, boolean paused) {

    public String resourceId() {
        return resourceId(id);
    }

    public static String resourceId(UUID deploymentId) {
        return "prefect.deployment." + deploymentId;
    }

    public Deployment withPaused(boolean newPaused) {
        return new Deployment(id, name, newPaused);
    }
}
