package com.ridematch.dispatch.service;

import com.ridematch.dispatch.config.DispatchProperties;
import com.ridematch.dispatch.entity.Ride;
import com.ridematch.dispatch.metrics.DispatchMetrics;
import com.ridematch.dispatch.model.BroadcastRecord;
import com.ridematch.dispatch.result.RejectOutcome;
import com.ridematch.dispatch.store.BroadcastStore;
import com.ridematch.dispatch.store.DriverNotificationStore;
import com.ridematch.dispatch.store.RejectionStore;
import com.ridematch.dispatch.store.RideStore;
import com.ridematch.shared.enums.RideStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Records explicit declines. A decline never closes the ride; the broadcast
 * stays open for everyone else who was notified.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RejectionTracker {

    private final RideStore rideStore;
    private final BroadcastStore broadcastStore;
    private final RejectionStore rejectionStore;
    private final DriverNotificationStore notificationStore;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;
    private final Clock clock;

    public RejectOutcome reject(UUID rideId, String driverId) {
        Optional<Ride> ride = rideStore.findById(rideId);
        if (ride.isEmpty()) {
            return new RejectOutcome.NotFound(rideId, "Ride " + rideId + " not found");
        }
        if (ride.get().getStatus() != RideStatus.REQUESTED) {
            return new RejectOutcome.AlreadyResolved(rideId, ride.get().getStatus());
        }

        Optional<BroadcastRecord> broadcast = broadcastStore.find(rideId).filter(BroadcastRecord::isActive);
        if (broadcast.isEmpty()) {
            return new RejectOutcome.NotFound(rideId, "No active broadcast for ride " + rideId);
        }
        List<String> notified = broadcast.get().getNotifiedDriverIds();
        if (!notified.contains(driverId)) {
            return new RejectOutcome.NotNotified(rideId, driverId);
        }

        rejectionStore.record(rideId, driverId, clock.instant(), properties.getBroadcastTtl());
        notificationStore.remove(driverId, rideId);

        Map<String, ?> rejections = rejectionStore.findAll(rideId);
        List<String> remaining = notified.stream()
                .filter(id -> !rejections.containsKey(id))
                .toList();

        metrics.recordRejection();
        log.info("Driver {} declined ride {} ({} of {} notified still open)",
                driverId, rideId, remaining.size(), notified.size());
        return new RejectOutcome.Recorded(rideId, driverId, rejections.size(), remaining);
    }
}
