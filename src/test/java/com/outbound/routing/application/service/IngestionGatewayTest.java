package com.outbound.routing.application.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.outbound.routing.application.port.in.ProcessEventUseCase;
import com.outbound.routing.domain.entity.RawEngagementEvent;
import com.outbound.routing.domain.entity.RoutingOutcome;
import com.outbound.routing.domain.exception.IngestionRejectedException;
import com.outbound.routing.domain.exception.InvalidEventException;
import com.outbound.routing.support.Events;

class IngestionGatewayTest {

    private static final RawEngagementEvent EVENT = Events.emailOpened("lead-1", "open-1",
            Instant.parse("2026-03-02T12:00:00Z"));

    private final ProcessEventUseCase useCase = mock(ProcessEventUseCase.class);
    private final ExecutorService callers = Executors.newFixedThreadPool(2);
    private IngestionGateway gateway;

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
        if (gateway != null) {
            gateway.shutdown();
        }
    }

    @Test
    void returnsPipelineOutcome() {
        RoutingOutcome outcome = new RoutingOutcome(null, null, null);
        when(useCase.process(EVENT)).thenReturn(outcome);
        gateway = new IngestionGateway(useCase, 2, 10, Duration.ofSeconds(5));

        assertThat(gateway.submit(EVENT)).isSameAs(outcome);
    }

    @Test
    void pipelineExceptionsReachCallerUnwrapped() {
        when(useCase.process(any())).thenThrow(new InvalidEventException("email", "malformed email"));
        gateway = new IngestionGateway(useCase, 1, 1, Duration.ofSeconds(5));

        assertThatThrownBy(() -> gateway.submit(EVENT))
                .isInstanceOf(InvalidEventException.class)
                .hasMessage("malformed email");
    }

    @Test
    void slowPipelineIsRejectedAsRetriable() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(useCase.process(any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return null;
        });
        gateway = new IngestionGateway(useCase, 1, 1, Duration.ofMillis(100));

        try {
            assertThatThrownBy(() -> gateway.submit(EVENT)).isInstanceOf(IngestionRejectedException.class);
        } finally {
            release.countDown();
        }
    }

    @Test
    void fullQueueIsRejectedAsRetriable() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        when(useCase.process(any())).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        });
        gateway = new IngestionGateway(useCase, 1, 1, Duration.ofSeconds(5));

        try {
            callers.submit(() -> gateway.submit(EVENT));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            callers.submit(() -> gateway.submit(EVENT));
            long deadline = System.currentTimeMillis() + 5000;
            while (gateway.queuedCount() < 1 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }

            assertThatThrownBy(() -> gateway.submit(EVENT))
                    .isInstanceOf(IngestionRejectedException.class)
                    .hasMessageContaining("full");
        } finally {
            release.countDown();
        }
    }
}
