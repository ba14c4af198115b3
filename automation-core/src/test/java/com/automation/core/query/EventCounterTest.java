package com.automation.core.query;

import com.automation.core.exception.InvalidEventCountParametersException;
import com.automation.core.model.Event;
import com.automation.core.test.Events;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventCounterTest {

    private final Instant since = Instant.parse("2024-03-01T00:00:00Z");
    private final Instant until = Instant.parse("2024-03-01T00:10:00Z");
    private final EventFilter filter = EventFilter.builder().since(since).until(until).build();

    @Test
    void countByTime_shouldProduceContiguousZeroFilledBuckets() {
        UUID run = UUID.randomUUID();
        List<Event> events = List.of(
            Events.flowRun(run, "Pending", since.plusSeconds(30)),
            Events.flowRun(run, "Running", since.plusSeconds(45)),
            Events.flowRun(run, "Completed", since.plus(Duration.ofMinutes(7)))
        );

        List<EventCount> counts = EventCounter.count(filter, events, Countable.TIME, TimeUnit.MINUTE, 1.0);

        assertThat(counts).hasSize(10);
        assertThat(counts.get(0).count()).isEqualTo(2);
        assertThat(counts.get(7).count()).isEqualTo(1);
        assertThat(counts.stream().mapToLong(EventCount::count).sum()).isEqualTo(3);
        for (int i = 1; i < counts.size(); i++) {
            assertThat(counts.get(i).startTime()).isEqualTo(counts.get(i - 1).startTime().plus(Duration.ofMinutes(1)));
        }
        assertThat(counts.get(0).startTime()).isEqualTo(since);
    }

    @Test
    void countByTime_eventAtUntil_shouldLandInLastBucket() {
        List<Event> events = List.of(Events.flowRun(UUID.randomUUID(), "Running", until));

        List<EventCount> counts = EventCounter.count(filter, events, Countable.TIME, TimeUnit.MINUTE, 1.0);

        assertThat(counts.get(counts.size() - 1).count()).isEqualTo(1);
    }

    @Test
    void countByDay_shouldUseWholeUtcDays() {
        EventFilter twoDays = EventFilter.builder()
            .since(Instant.parse("2024-03-01T06:00:00Z"))
            .until(Instant.parse("2024-03-02T06:00:00Z"))
            .build();

        List<EventCount> counts = EventCounter.count(twoDays, List.of(), Countable.DAY, TimeUnit.HOUR, 1.0);

        assertThat(counts).extracting(EventCount::value)
            .containsExactly("2024-03-01T00:00:00Z", "2024-03-02T00:00:00Z");
    }

    @Test
    void countByEvent_shouldGroupByNameMostFrequentFirst() {
        UUID run = UUID.randomUUID();
        List<Event> events = List.of(
            Events.flowRun(run, "Running", since.plusSeconds(1)),
            Events.flowRun(run, "Failed", since.plusSeconds(2)),
            Events.flowRun(UUID.randomUUID(), "Failed", since.plusSeconds(3))
        );

        List<EventCount> counts = EventCounter.count(filter, events, Countable.EVENT, TimeUnit.DAY, 1.0);

        assertThat(counts).extracting(EventCount::value)
            .containsExactly("prefect.flow-run.Failed", "prefect.flow-run.Running");
        assertThat(counts.get(0).count()).isEqualTo(2);
        assertThat(counts.get(0).startTime()).isEqualTo(since.plusSeconds(2));
        assertThat(counts.get(0).endTime()).isEqualTo(since.plusSeconds(3));
    }

    @Test
    void countByResource_shouldLabelWithResourceName() {
        UUID run = UUID.randomUUID();
        List<EventCount> counts = EventCounter.count(filter,
            List.of(Events.flowRun(run, "Running", since)), Countable.RESOURCE, TimeUnit.DAY, 1.0);

        assertThat(counts).singleElement().satisfies(c -> {
            assertThat(c.value()).isEqualTo(Events.flowRunResource(run));
            assertThat(c.label()).isEqualTo("run-" + run);
        });
    }

    @Test
    void timeInterval_belowMinimum_shouldBeRejected() {
        assertThatThrownBy(() -> EventCounter.count(filter, List.of(), Countable.TIME, TimeUnit.MINUTE, 0.001))
            .isInstanceOf(InvalidEventCountParametersException.class)
            .hasMessageContaining("time_interval");
    }

    @Test
    void tooManyBuckets_shouldBeRejected() {
        assertThatThrownBy(() -> EventCounter.count(filter, List.of(), Countable.TIME, TimeUnit.SECOND, 0.1))
            .isInstanceOf(InvalidEventCountParametersException.class)
            .hasMessageContaining("6000 buckets");
    }
}
