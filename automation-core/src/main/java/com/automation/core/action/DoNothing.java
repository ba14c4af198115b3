package com.automation.core.action;

import com.automation.core.model.TriggeredAction;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Records that the automation fired without touching anything.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DoNothing() implements Action {

    public static final String TYPE = "do-nothing";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public ActionResult act(TriggeredAction triggeredAction, ActionContext context) {
        return ActionResult.of(ActionResult.OK);
    }
}
