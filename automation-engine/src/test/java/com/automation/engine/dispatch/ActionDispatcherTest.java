package com.automation.engine.dispatch;

import com.automation.core.action.DoNothing;
import com.automation.core.action.SendNotification;
import com.automation.core.model.ActionInvocation;
import com.automation.core.model.ActionState;
import com.automation.core.model.Automation;
import com.automation.core.model.EventTrigger;
import com.automation.core.model.Firing;
import com.automation.core.model.Resource;
import com.automation.core.model.TriggeredAction;
import com.automation.core.test.Events;
import com.automation.engine.test.EngineHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class ActionDispatcherTest {

    private EngineHarness harness;
    private Automation automation;
    private Firing firing;

    @BeforeEach
    void setUp() {
        harness = new EngineHarness();
        automation = harness.save(Automation.create("notify", null,
            EventTrigger.builder().expect("prefect.flow-run.Failed").build(),
            List.of(new DoNothing(), new SendNotification("Run failed", "{{ event.event }}", null)),
            harness.clock.instant()));
        firing = Firing.create(automation.id(), automation.trigger(),
            Map.of(Resource.ID, Events.flowRunResource(UUID.randomUUID())), UUID.randomUUID(),
            harness.clock.instant(), null);
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void dispatch_shouldRunEveryActionOfAutomation() {
        List<TriggeredAction> dispatched = harness.dispatcher.dispatch(firing, automation);

        assertThat(dispatched).extracting(TriggeredAction::actionIndex).containsExactly(0, 1);
        assertThat(dispatched).extracting(TriggeredAction::id).containsExactly(
            TriggeredAction.invocationId(firing.id(), 0),
            TriggeredAction.invocationId(firing.id(), 1));

        harness.settle();
        assertThat(harness.ledger.findByAutomation(automation.id()))
            .extracting(ActionInvocation::state)
            .containsOnly(ActionState.SUCCEEDED)
            .hasSize(2);
        assertThat(harness.notifications.sent()).hasSize(1);
    }

    @Test
    void dispatch_sameFiringTwice_shouldYieldSameIdsAndSkipSecondRun() {
        List<TriggeredAction> first = harness.dispatcher.dispatch(firing, automation);
        harness.settle();
        List<TriggeredAction> second = harness.dispatcher.dispatch(firing, automation);
        harness.settle();

        assertThat(second).extracting(TriggeredAction::id)
            .containsExactlyElementsOf(first.stream().map(TriggeredAction::id).collect(Collectors.toList()));
        assertThat(harness.notifications.sent()).hasSize(1);
        assertThat(harness.ledger.findByAutomation(automation.id()))
            .extracting(ActionInvocation::invocationId)
            .containsExactlyInAnyOrder(
                TriggeredAction.invocationId(firing.id(), 0),
                TriggeredAction.invocationId(firing.id(), 1));
    }

    @Test
    void dispatch_fromCatalog_shouldDropFiringsOfDisabledAutomations() {
        harness.save(automation.withEnabled(false, harness.clock.instant()));

        assertThat(harness.dispatcher.dispatch(List.of(firing))).isEmpty();
        assertThat(harness.ledger.findByAutomation(automation.id())).isEmpty();
    }
}
