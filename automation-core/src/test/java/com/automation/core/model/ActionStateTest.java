package com.automation.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ActionStateTest {

    @Test
    void isTerminal_shouldIdentifyTerminalStates() {
        assertTrue(ActionState.SUCCEEDED.isTerminal());
        assertTrue(ActionState.FAILED.isTerminal());

        assertFalse(ActionState.PENDING.isTerminal());
        assertFalse(ActionState.ACTING.isTerminal());
    }

    @Test
    void canTransitionTo_fromPending_shouldAllowActingOrFailed() {
        assertTrue(ActionState.PENDING.canTransitionTo(ActionState.ACTING));
        assertTrue(ActionState.PENDING.canTransitionTo(ActionState.FAILED));

        assertFalse(ActionState.PENDING.canTransitionTo(ActionState.SUCCEEDED));
        assertFalse(ActionState.PENDING.canTransitionTo(ActionState.PENDING));
    }

    @Test
    void canTransitionTo_fromActing_shouldAllowOutcomesOnly() {
        assertTrue(ActionState.ACTING.canTransitionTo(ActionState.SUCCEEDED));
        assertTrue(ActionState.ACTING.canTransitionTo(ActionState.FAILED));

        assertFalse(ActionState.ACTING.canTransitionTo(ActionState.PENDING));
        assertFalse(ActionState.ACTING.canTransitionTo(ActionState.ACTING));
    }

    @Test
    void canTransitionTo_fromTerminalStates_shouldNotAllowAny() {
        for (ActionState target : ActionState.values()) {
            assertFalse(ActionState.SUCCEEDED.canTransitionTo(target));
            assertFalse(ActionState.FAILED.canTransitionTo(target));
        }
    }
}
