package com.ridematch.dispatch.notification;

import com.ridematch.dispatch.metrics.DispatchMetrics;
import com.ridematch.shared.events.RideOfferEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget fan-out of ride offers to the {@link NotificationSink}.
 *
 * submit() only enqueues work and returns immediately. Failed pushes are
 * counted and logged, never retried; the pending offer stored for the driver
 * remains the source of truth.
 */
@Slf4j
@Component
public class OutboundNotificationQueue {

    private final NotificationSink sink;
    private final Executor executor;
    private final DispatchMetrics metrics;

    public OutboundNotificationQueue(NotificationSink sink,
                                     @Qualifier("notificationExecutor") Executor executor,
                                     DispatchMetrics metrics) {
        this.sink = sink;
        this.executor = executor;
        this.metrics = metrics;
    }

    public CompletableFuture<DeliveryReport> submit(List<RideOfferEvent> offers) {
        List<CompletableFuture<Boolean>> pushes = new ArrayList<>(offers.size());
        for (RideOfferEvent offer : offers) {
            try {
                pushes.add(CompletableFuture.supplyAsync(() -> deliver(offer), executor));
            } catch (RejectedExecutionException e) {
                log.warn("Notification queue saturated, dropping push of ride {} to driver {}",
                        offer.getRideId(), offer.getDriverId());
                metrics.recordNotificationFailed();
                pushes.add(CompletableFuture.completedFuture(false));
            }
        }

        return CompletableFuture.allOf(pushes.toArray(new CompletableFuture[0]))
                .thenApply(v -> {
                    int delivered = (int) pushes.stream().filter(CompletableFuture::join).count();
                    return new DeliveryReport(delivered, pushes.size() - delivered);
                });
    }

    private boolean deliver(RideOfferEvent offer) {
        boolean delivered;
        try {
            delivered = sink.push(offer.getDriverId(), offer);
        } catch (RuntimeException e) {
            log.warn("Push of ride {} to driver {} failed", offer.getRideId(), offer.getDriverId(), e);
            delivered = false;
        }
        if (delivered) {
            metrics.recordNotificationDelivered();
        } else {
            metrics.recordNotificationFailed();
        }
        return delivered;
    }
}
