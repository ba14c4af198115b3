package com.automation.core.action;

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

class ActionTemplatesTest {

    private final Instant now = Instant.parse("2024-03-01T12:00:00Z");
    private final EventTrigger trigger = EventTrigger.builder().expect("prefect.flow-run.Failed").build();
    private final Automation automation = Automation.create("alert on failure", "pages on-call", trigger,
        List.of(new SendNotification("s", "b", null)), now);

    @Test
    void render_shouldSubstituteKnownPlaceholders() {
        UUID run = UUID.randomUUID();
        Event event = Events.flowRun(run, "Failed", now);
        TriggeredAction ta = triggered(event);

        String rendered = ActionTemplates.render(
            "{{ automation.name }}: {{event.event}} on {{ event.resource.prefect.resource.name }} ({{ labels.prefect.resource.id }})",
            ta);

        assertThat(rendered).isEqualTo(
            "alert on failure: prefect.flow-run.Failed on run-" + run + " (" + Events.flowRunResource(run) + ")");
    }

    @Test
    void render_shouldLeaveUnknownPlaceholdersAlone() {
        TriggeredAction ta = triggered(null);

        assertThat(ActionTemplates.render("{{ nope }} {{ event.event }}!", ta)).isEqualTo("{{ nope }} !");
    }

    @Test
    void render_shouldNotInterpretReplacementCharacters() {
        Automation dollars = Automation.create("cost $5 \\ day", null, trigger, List.of(new DoNothing()), now);
        Firing firing = Firing.create(dollars.id(), trigger, Map.of(), UUID.randomUUID(), now, null);

        assertThat(ActionTemplates.render("{{ automation.name }}", TriggeredAction.create(dollars, firing, 0)))
            .isEqualTo("cost $5 \\ day");
    }

    private TriggeredAction triggered(Event event) {
        Map<String, String> labels = event == null ? Map.of() : Map.of(Resource.ID, event.resourceId());
        Firing firing = Firing.create(automation.id(), trigger, labels, UUID.randomUUID(), now, event);
        return TriggeredAction.create(automation, firing, 0);
    }
}
