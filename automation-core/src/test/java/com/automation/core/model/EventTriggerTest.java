package com.automation.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EventTriggerTest {

    @Test
    void builder_shouldDefaultForEachToResourceId() {
        EventTrigger trigger = EventTrigger.builder().expect("prefect.flow-run.Failed").build();

        assertThat(trigger.forEach()).containsExactly(Resource.ID);
        assertThat(trigger.posture()).isEqualTo(Posture.REACTIVE);
        assertThat(trigger.match().isEmpty()).isTrue();
    }

    @Test
    void triggeringLabels_shouldPickForEachLabelsPresentOnResource() {
        EventTrigger trigger = EventTrigger.builder()
            .forEach(Resource.ID, "prefect.resource.name", "missing.label")
            .build();
        Resource resource = Resource.of(Map.of(
            Resource.ID, "prefect.flow-run.1",
            Resource.NAME, "nightly",
            "other", "ignored"
        ));

        assertThat(trigger.triggeringLabels(resource))
            .containsOnly(
                Map.entry(Resource.ID, "prefect.flow-run.1"),
                Map.entry(Resource.NAME, "nightly"));
    }

    @Test
    void requiredExpectCount_shouldNeverBeBelowOne() {
        EventTrigger zero = EventTrigger.builder().posture(Posture.PROACTIVE).threshold(0)
            .within(Duration.ofMinutes(1)).build();
        EventTrigger three = EventTrigger.builder().posture(Posture.PROACTIVE).threshold(3)
            .within(Duration.ofMinutes(1)).build();

        assertThat(zero.requiredExpectCount()).isEqualTo(1);
        assertThat(three.requiredExpectCount()).isEqualTo(3);
        assertThat(three.isProactive()).isTrue();
    }
}
