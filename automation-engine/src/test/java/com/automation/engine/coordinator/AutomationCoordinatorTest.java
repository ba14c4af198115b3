package com.automation.engine.coordinator;

import com.automation.core.action.ChangeFlowRunState;
import com.automation.core.action.DoNothing;
import com.automation.core.action.SendNotification;
import com.automation.core.exception.AutomationValidationException;
import com.automation.core.exception.NotFoundException;
import com.automation.core.model.Automation;
import com.automation.core.model.EventTrigger;
import com.automation.core.model.Posture;
import com.automation.core.test.Events;
import com.automation.engine.service.AutomationService.AutomationRequest;
import com.automation.engine.test.EngineHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AutomationCoordinatorTest {

    private EngineHarness harness;
    private AutomationCoordinator coordinator;

    @BeforeEach
    void setUp() {
        harness = new EngineHarness();
        coordinator = new AutomationCoordinator(harness.automations, harness.catalog, harness.tracker, harness.clock);
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private static EventTrigger countFailures(int threshold) {
        return EventTrigger.builder()
            .match(Map.of("prefect.resource.id", "prefect.flow-run.*"))
            .expect("prefect.flow-run.Failed")
            .threshold(threshold)
            .within(Duration.ofMinutes(10))
            .build();
    }

    private static AutomationRequest request(String name, EventTrigger trigger) {
        return new AutomationRequest(name, null, null, trigger, List.of(new DoNothing()));
    }

    @Test
    void createAutomation_shouldStoreEnabledAndBeVisibleToCatalog() {
        Automation created = coordinator.createAutomation(request("failures", countFailures(3)));

        assertThat(created.enabled()).isTrue();
        assertThat(coordinator.getAutomation(created.id())).isEqualTo(created);
        assertThat(harness.catalog.enabled()).extracting(Automation::id).containsExactly(created.id());
    }

    @Test
    void createAutomation_disabledRequest_shouldNotBeEvaluated() {
        Automation created = coordinator.createAutomation(
            new AutomationRequest("off", null, false, countFailures(1), List.of(new DoNothing())));

        assertThat(created.enabled()).isFalse();
        assertThat(harness.catalog.enabled()).isEmpty();
    }

    @Test
    void createAutomation_shouldCollectEveryProblem() {
        EventTrigger bad = EventTrigger.builder()
            .expect("prefect.*.Failed")
            .posture(Posture.PROACTIVE)
            .threshold(-1)
            .build();
        AutomationRequest request = new AutomationRequest(" ", null, null, bad,
            List.of(new ChangeFlowRunState(null, null, null, null), new SendNotification("s", "", null)));

        assertThatThrownBy(() -> coordinator.createAutomation(request))
            .isInstanceOfSatisfying(AutomationValidationException.class, e -> assertThat(e.getProblems())
                .containsExactlyInAnyOrder(
                    "name: is required",
                    "expect: 'prefect.*.Failed' may only use * as its final character",
                    "threshold: must not be negative",
                    "within: a proactive trigger needs a positive deadline",
                    "actions[0].state: is required",
                    "actions[1].body: is required"));
        assertThat(harness.automations.findAll()).isEmpty();
    }

    @Test
    void createAutomation_withoutActionsOrTrigger_shouldBeRejected() {
        AutomationRequest request = new AutomationRequest("empty", null, null, null, List.of());

        assertThatThrownBy(() -> coordinator.createAutomation(request))
            .isInstanceOfSatisfying(AutomationValidationException.class, e -> assertThat(e.getProblems())
                .containsExactly("trigger: is required", "actions: at least one action is required"));
    }

    @Test
    void updateAutomation_shouldDiscardOpenWindows() {
        Automation created = coordinator.createAutomation(request("failures", countFailures(3)));
        harness.publish(Events.flowRun(UUID.randomUUID(), "Failed", harness.clock.instant()));
        assertThat(harness.tracker.size()).isEqualTo(1);

        Automation updated = coordinator.updateAutomation(created.id(), request("failures v2", countFailures(2)));

        assertThat(updated.name()).isEqualTo("failures v2");
        assertThat(updated.trigger().threshold()).isEqualTo(2);
        assertThat(updated.enabled()).isTrue();
        assertThat(harness.tracker.size()).isZero();
    }

    @Test
    void setEnabled_disable_shouldDiscardWindowsAndLeaveCatalog() {
        Automation created = coordinator.createAutomation(request("failures", countFailures(3)));
        harness.publish(Events.flowRun(UUID.randomUUID(), "Failed", harness.clock.instant()));

        Automation disabled = coordinator.setEnabled(created.id(), false);

        assertThat(disabled.enabled()).isFalse();
        assertThat(harness.tracker.size()).isZero();
        assertThat(harness.catalog.enabled()).isEmpty();
        assertThat(coordinator.setEnabled(created.id(), false)).isEqualTo(disabled);
    }

    @Test
    void deleteAutomation_shouldRemoveAndRejectRepeat() {
        Automation created = coordinator.createAutomation(request("failures", countFailures(3)));

        coordinator.deleteAutomation(created.id());

        assertThat(coordinator.listAutomations()).isEmpty();
        assertThatThrownBy(() -> coordinator.deleteAutomation(created.id()))
            .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> coordinator.getAutomation(created.id()))
            .isInstanceOf(NotFoundException.class);
    }
}
