package com.ridematch.dispatch.service;

import com.ridematch.dispatch.config.DispatchProperties;
import com.ridematch.dispatch.entity.Ride;
import com.ridematch.dispatch.metrics.DispatchMetrics;
import com.ridematch.dispatch.model.BroadcastRecord;
import com.ridematch.dispatch.model.DriverCandidate;
import com.ridematch.dispatch.model.NotifiedDriver;
import com.ridematch.dispatch.result.ExpandOutcome;
import com.ridematch.dispatch.store.BroadcastStore;
import com.ridematch.dispatch.store.RideStore;
import com.ridematch.shared.enums.RideStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Widens an open broadcast. Only drivers that were never notified for the
 * ride, and did not cancel it, are contacted; the notified set and the
 * broadcast round only grow.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RadiusExpansionService {

    private final RideStore rideStore;
    private final BroadcastStore broadcastStore;
    private final BroadcastCoordinator broadcastCoordinator;
    private final DriverEligibilityPolicy eligibilityPolicy;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;
    private final Clock clock;

    /**
     * @param currentRadiusKm radius to grow from; {@code null} uses the radius
     *                        stored on the broadcast record
     */
    public ExpandOutcome expand(UUID rideId, Double currentRadiusKm, double incrementKm) {
        if (Double.isNaN(incrementKm) || incrementKm <= 0) {
            return new ExpandOutcome.Invalid("Radius increment must be positive, got " + incrementKm);
        }

        Optional<Ride> found = rideStore.findById(rideId);
        if (found.isEmpty()) {
            return new ExpandOutcome.NotFound(rideId, "Ride " + rideId + " not found");
        }
        Ride ride = found.get();
        if (ride.getStatus() != RideStatus.REQUESTED) {
            return new ExpandOutcome.AlreadyResolved(rideId, ride.getStatus());
        }

        Optional<BroadcastRecord> active = broadcastStore.find(rideId).filter(BroadcastRecord::isActive);
        if (active.isEmpty()) {
            return new ExpandOutcome.NotFound(rideId, "No active broadcast for ride " + rideId);
        }
        BroadcastRecord record = active.get();

        double previousRadiusKm = currentRadiusKm != null ? currentRadiusKm : record.getRadiusKm();
        double newRadiusKm = previousRadiusKm + incrementKm;

        Set<String> alreadyNotified = new HashSet<>(record.getNotifiedDriverIds());
        List<DriverCandidate> newlyFound = broadcastCoordinator
                .findEligibleDrivers(record.pickupPoint(), newRadiusKm, eligibilityPolicy.forRide(ride))
                .stream()
                .filter(c -> !alreadyNotified.contains(c.getDriverId()))
                .filter(c -> !record.excludes(c.getDriverId()))
                .toList();

        newlyFound.forEach(c -> record.getNotifiedDriverIds().add(c.getDriverId()));
        record.setBroadcastCount(record.getBroadcastCount() + 1);
        record.setRadiusKm(newRadiusKm);
        record.setLastExpandedAt(clock.instant());
        broadcastStore.save(record, properties.getBroadcastTtl());

        List<NotifiedDriver> notified =
                broadcastCoordinator.notifyDrivers(record, newlyFound, record.getBroadcastCount());
        metrics.recordExpansion(notified.size());

        log.info("Ride {} radius {}km -> {}km, round {}, {} new drivers ({} total)",
                rideId, previousRadiusKm, newRadiusKm, record.getBroadcastCount(),
                notified.size(), record.getNotifiedDriverIds().size());

        return new ExpandOutcome.Expanded(rideId, previousRadiusKm, newRadiusKm,
                record.getBroadcastCount(), notified, record.getNotifiedDriverIds().size());
    }
}
