package com.automation.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How a trigger decides to fire.
 */
public enum Posture {
    /**
     * Count-based: fires when enough expected events occur within the window.
     */
    @JsonProperty("Reactive")
    REACTIVE,

    /**
     * Absence-based: fires when the expected events do not arrive before the deadline.
     */
    @JsonProperty("Proactive")
    PROACTIVE
}
