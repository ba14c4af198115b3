package com.automation.core.action;

import com.automation.core.exception.ActionFailedException;
import com.automation.core.model.Automation;
import com.automation.core.model.Event;
import com.automation.core.model.EventTrigger;
import com.automation.core.model.Firing;
import com.automation.core.model.Resource;
import com.automation.core.model.TriggeredAction;
import com.automation.core.test.Events;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActionTargetsTest {

    private final Instant now = Instant.parse("2024-03-01T12:00:00Z");
    private final EventTrigger trigger = EventTrigger.builder().expect("prefect.flow-run.*").build();
    private final Automation automation = Automation.create("targets", null, trigger,
        List.of(SuspendFlowRun.inferred()), now);

    @Test
    void flowRun_shouldPreferTriggeringLabels() throws Exception {
        UUID run = UUID.randomUUID();
        TriggeredAction ta = triggered(Map.of(Resource.ID, Events.flowRunResource(run)), null);

        assertThat(ActionTargets.flowRun(ta, null)).isEqualTo(run);
    }

    @Test
    void flowRun_explicitSelection_shouldWin() throws Exception {
        UUID selected = UUID.randomUUID();
        TriggeredAction ta = triggered(Map.of(Resource.ID, Events.flowRunResource(UUID.randomUUID())), null);

        assertThat(ActionTargets.flowRun(ta, selected)).isEqualTo(selected);
    }

    @Test
    void deployment_shouldFallBackToRelatedResources() throws Exception {
        UUID deployment = UUID.randomUUID();
        Event event = Events.flowRun(UUID.randomUUID(), "Failed", now, deployment);
        TriggeredAction ta = triggered(Map.of(Resource.ID, event.resourceId()), event);

        assertThat(ActionTargets.deployment(ta, null)).isEqualTo(deployment);
    }

    @Test
    void flowRun_withoutAnyCandidate_shouldFailWithReason() {
        TriggeredAction ta = triggered(Map.of(Resource.ID, "prefect.work-queue.abc"), null);

        assertThatThrownBy(() -> ActionTargets.flowRun(ta, null))
            .isInstanceOf(ActionFailedException.class)
            .hasMessageContaining("flow run");
    }

    @Test
    void parse_shouldIgnoreNonUuidSuffixes() {
        assertThat(ActionTargets.parse("prefect.flow-run.not-a-uuid", ActionTargets.FLOW_RUN_PREFIX)).isEmpty();
    }

    private TriggeredAction triggered(Map<String, String> labels, Event event) {
        Firing firing = Firing.create(automation.id(), trigger, labels, UUID.randomUUID(), now, event);
        return TriggeredAction.create(automation, firing, 0);
    }
}
