package com.automation.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Why a firing occurred. Further states (resolved, acknowledged) slot in here.
 */
public enum TriggerState {
    @JsonProperty("Triggered")
    TRIGGERED
}
