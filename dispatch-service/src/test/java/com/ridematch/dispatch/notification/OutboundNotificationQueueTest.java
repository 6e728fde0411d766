package com.ridematch.dispatch.notification;

import com.ridematch.dispatch.metrics.DispatchMetrics;
import com.ridematch.shared.events.RideOfferEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class OutboundNotificationQueueTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final DispatchMetrics metrics = new DispatchMetrics(registry);

    private static RideOfferEvent offer(String driverId) {
        return RideOfferEvent.builder().driverId(driverId).rideId("ride-1").broadcastRound(1).build();
    }

    private double notifications(String result) {
        return registry.get("dispatch.notifications").tag("result", result).counter().count();
    }

    @Test
    @Timeout(5)
    @DisplayName("submit returns before slow pushes finish")
    void submit_doesNotBlock() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        NotificationSink slowSink = (userId, payload) -> {
            try {
                return release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        };
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            OutboundNotificationQueue queue = new OutboundNotificationQueue(slowSink, executor, metrics);

            CompletableFuture<DeliveryReport> report = queue.submit(List.of(offer("d1"), offer("d2")));
            assertThat(report).isNotDone();

            release.countDown();
            assertThat(report.get(5, TimeUnit.SECONDS)).isEqualTo(new DeliveryReport(2, 0));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Failed and throwing pushes are counted, not retried")
    void submit_countsFailures() throws Exception {
        NotificationSink sink = (userId, payload) -> {
            if (userId.equals("boom")) {
                throw new IllegalStateException("gateway down");
            }
            return !userId.equals("offline");
        };
        OutboundNotificationQueue queue = new OutboundNotificationQueue(sink, Runnable::run, metrics);

        DeliveryReport report = queue.submit(List.of(offer("d1"), offer("offline"), offer("boom"))).get();

        assertThat(report).isEqualTo(new DeliveryReport(1, 2));
        assertThat(notifications("delivered")).isEqualTo(1.0);
        assertThat(notifications("failed")).isEqualTo(2.0);
    }

    @Test
    @DisplayName("A saturated executor drops the push and counts it as failed")
    void submit_saturated() throws Exception {
        OutboundNotificationQueue queue = new OutboundNotificationQueue((u, p) -> true,
                task -> { throw new RejectedExecutionException("full"); }, metrics);

        DeliveryReport report = queue.submit(List.of(offer("d1"))).get();

        assertThat(report).isEqualTo(new DeliveryReport(0, 1));
        assertThat(notifications("failed")).isEqualTo(1.0);
    }
}
