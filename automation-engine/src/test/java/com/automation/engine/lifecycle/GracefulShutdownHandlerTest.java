package com.automation.engine.lifecycle;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GracefulShutdownHandlerTest {

    @Test
    void shutdown_shouldRefuseNewInvocations() {
        GracefulShutdownHandler handler = new GracefulShutdownHandler(Duration.ofSeconds(1));
        assertThat(handler.canAcceptDispatches()).isTrue();

        handler.shutdown();

        assertThat(handler.isShuttingDown()).isTrue();
        assertThat(handler.canAcceptDispatches()).isFalse();
        assertThatThrownBy(() -> handler.registerActiveInvocation(UUID.randomUUID()))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shutdown_shouldRunStopHooksOnce() {
        GracefulShutdownHandler handler = new GracefulShutdownHandler(Duration.ofSeconds(1));
        List<String> calls = new ArrayList<>();
        handler.onStop(() -> calls.add("first"));
        handler.onStop(() -> {
            throw new IllegalStateException("boom");
        });
        handler.onStop(() -> calls.add("third"));

        handler.shutdown();
        handler.shutdown();

        assertThat(calls).containsExactly("first", "third");
    }

    @Test
    void shutdown_shouldWaitForInFlightInvocations() throws Exception {
        GracefulShutdownHandler handler = new GracefulShutdownHandler(Duration.ofSeconds(5));
        UUID invocationId = UUID.randomUUID();
        handler.registerActiveInvocation(invocationId);

        CompletableFuture<Void> shutdown = CompletableFuture.runAsync(handler::shutdown);
        Thread.sleep(250);
        assertThat(shutdown).isNotDone();

        handler.unregisterActiveInvocation(invocationId);
        shutdown.get(2, TimeUnit.SECONDS);

        assertThat(handler.getActiveInvocationCount()).isZero();
    }

    @Test
    void shutdown_timeout_shouldGiveUpWaiting() throws Exception {
        GracefulShutdownHandler handler = new GracefulShutdownHandler(Duration.ofMillis(200));
        handler.registerActiveInvocation(UUID.randomUUID());

        CompletableFuture.runAsync(handler::shutdown).get(2, TimeUnit.SECONDS);

        assertThat(handler.getActiveInvocationCount()).isEqualTo(1);
    }
}
