package com.automation.scheduler;

import com.automation.core.action.SuspendFlowRun;
import com.automation.core.model.Automation;
import com.automation.core.model.EventTrigger;
import com.automation.core.model.Firing;
import com.automation.core.model.Posture;
import com.automation.core.orchestration.FlowRun;
import com.automation.core.orchestration.FlowRunState;
import com.automation.core.orchestration.StateType;
import com.automation.core.test.Events;
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

class DeadlineSchedulerTest {

    private EngineHarness harness;
    private DeadlineScheduler scheduler;
    private UUID flowRunId;

    @BeforeEach
    void setUp() {
        harness = new EngineHarness();
        scheduler = new DeadlineScheduler(harness.triggerEngine, harness.dispatcher, harness.clock,
            Duration.ofMillis(20));
        flowRunId = UUID.randomUUID();
        harness.orchestration.register(new FlowRun(flowRunId, "slow-run", null,
            new FlowRunState(StateType.RUNNING, "Running", null, harness.clock.instant()), Map.of(), null));
        harness.save(Automation.create("suspend slow runs", null,
            EventTrigger.builder()
                .match(Map.of("prefect.resource.id", "prefect.flow-run.*"))
                .after("prefect.flow-run.Running")
                .expect("prefect.flow-run.Completed")
                .posture(Posture.PROACTIVE)
                .within(Duration.ofMinutes(5))
                .build(),
            List.of(SuspendFlowRun.inferred()),
            harness.clock.instant()));
        harness.publish(Events.flowRun(flowRunId, "Running", harness.clock.instant()));
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        harness.close();
    }

    @Test
    void sweepOnce_beforeDeadline_shouldNotFire() {
        harness.clock.advanceMinutes(4);

        assertThat(scheduler.sweepOnce()).isEmpty();
        assertThat(harness.orchestration.proposals(flowRunId)).isEmpty();
    }

    @Test
    void sweepOnce_afterDeadline_shouldDispatchOnce() {
        harness.clock.advance(Duration.ofMinutes(5).plusSeconds(1));

        List<Firing> firings = scheduler.sweepOnce();
        harness.settle();

        assertThat(firings).hasSize(1);
        assertThat(scheduler.sweepOnce()).isEmpty();
        assertThat(harness.orchestration.readFlowRun(flowRunId).orElseThrow().state().type())
            .isEqualTo(StateType.PAUSED);
    }

    @Test
    void start_shouldSweepPeriodically() throws InterruptedException {
        scheduler.start();
        harness.clock.advance(Duration.ofMinutes(6));

        long deadline = System.currentTimeMillis() + 5000;
        while (harness.eventsNamed(EngineHarness.EXECUTED).isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        assertThat(scheduler.isRunning()).isTrue();
        assertThat(harness.eventsNamed(EngineHarness.EXECUTED)).hasSize(1);
    }

    @Test
    void constructor_nonPositiveInterval_shouldBeRejected() {
        assertThatThrownBy(() -> new DeadlineScheduler(harness.triggerEngine, harness.dispatcher, harness.clock,
            Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
