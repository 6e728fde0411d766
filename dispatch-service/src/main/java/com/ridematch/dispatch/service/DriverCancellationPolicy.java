package com.ridematch.dispatch.service;

import com.ridematch.dispatch.config.DispatchProperties;
import com.ridematch.dispatch.entity.CancellationParty;
import com.ridematch.dispatch.entity.DriverProfile;
import com.ridematch.dispatch.entity.Ride;
import com.ridematch.dispatch.metrics.DispatchMetrics;
import com.ridematch.dispatch.model.BroadcastRecord;
import com.ridematch.dispatch.model.BroadcastResult;
import com.ridematch.dispatch.model.DriverEligibility;
import com.ridematch.dispatch.notification.RideEventPublisher;
import com.ridematch.dispatch.result.DriverCancelOutcome;
import com.ridematch.dispatch.store.DriverProfileStore;
import com.ridematch.dispatch.store.RideStore;
import com.ridematch.shared.enums.RideStatus;
import com.ridematch.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Handles a driver backing out of a matched ride.
 *
 * The ride goes back to REQUESTED and is re-broadcast without the cancelling
 * driver, who stays excluded from the ride for the rest of its life. Cancellations are counted per driver in a rolling window; the
 * cancellation that takes the count past the threshold suspends the driver.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriverCancellationPolicy {

    private static final Set<RideStatus> DRIVER_CANCELLABLE =
            EnumSet.of(RideStatus.MATCHED, RideStatus.DRIVER_ARRIVING);

    private final RideStore rideStore;
    private final DriverProfileStore profileStore;
    private final DriverAvailabilityRegistry registry;
    private final BroadcastCoordinator broadcastCoordinator;
    private final DriverEligibilityPolicy eligibilityPolicy;
    private final RideEventPublisher eventPublisher;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;
    private final Clock clock;

    public DriverCancelOutcome driverCancel(UUID rideId, String driverId, String reason) {
        Optional<Ride> found = rideStore.findById(rideId);
        if (found.isEmpty()) {
            return new DriverCancelOutcome.NotFound("Ride " + rideId + " not found");
        }
        Ride ride = found.get();
        if (!driverId.equals(ride.getDriverId())) {
            return new DriverCancelOutcome.NotAssigned(rideId, driverId);
        }
        if (!DRIVER_CANCELLABLE.contains(ride.getStatus())) {
            return new DriverCancelOutcome.NotCancellable(rideId, ride.getStatus());
        }
        Optional<DriverProfile> foundProfile = profileStore.findById(driverId);
        if (foundProfile.isEmpty()) {
            return new DriverCancelOutcome.NotFound("Driver " + driverId + " not found");
        }

        DispatchProperties.Cancellation rules = properties.getCancellation();
        Instant now = clock.instant();
        String effectiveReason = reason == null || reason.isBlank() ? rules.getDefaultDriverReason() : reason;

        // ride first: a stale read must not cost the driver a strike
        RideStatus previous = ride.getStatus();
        ride.setStatus(RideStatus.REQUESTED);
        ride.setDriverId(null);
        ride.setMatchedAt(null);
        ride.setPickupTime(null);
        ride.setCancelledBy(CancellationParty.DRIVER);
        ride.setCancellationReason(effectiveReason);
        ride.setCancellationTimestamp(now);
        ride.setCancellationFee(BigDecimal.ZERO);
        Ride saved;
        try {
            saved = rideStore.save(ride);
        } catch (OptimisticLockingFailureException e) {
            log.info("Ride {} changed while driver {} was cancelling it", rideId, driverId);
            return new DriverCancelOutcome.Conflict(rideId);
        }

        DriverProfile profile = foundProfile.get();
        resetCounterIfWindowElapsed(profile, now, rules.getCountingWindow());
        profile.setCancellationCount(profile.getCancellationCount() + 1);

        boolean suspended = profile.getCancellationCount() > rules.getSuspensionThreshold();
        Instant expiresAt = null;
        if (suspended) {
            profile.setSuspended(true);
            profile.setSuspendedAt(now);
            expiresAt = now.plus(rules.getSuspensionDuration());
        }
        profileStore.save(profile);

        if (suspended) {
            registry.setUnavailable(driverId);
            eventPublisher.publishDriverSuspended(profile, expiresAt, effectiveReason);
            log.warn("Driver {} suspended until {} after {} cancellations",
                    driverId, expiresAt, profile.getCancellationCount());
        } else {
            registry.release(driverId);
        }

        List<String> excluded = new ArrayList<>(broadcastCoordinator.getBroadcast(rideId)
                .map(BroadcastRecord::getExcludedDriverIds)
                .orElse(List.of()));
        if (!excluded.contains(driverId)) {
            excluded.add(driverId);
        }
        broadcastCoordinator.cancelBroadcast(rideId);
        DriverEligibility eligibility = eligibilityPolicy.forRide(saved);
        BroadcastResult rebroadcast = broadcastCoordinator.broadcast(rideId, saved.pickupPoint(),
                saved.destinationPoint(), saved.getEstimatedFare(), properties.getRebroadcastRadiusKm(),
                eligibility, excluded);

        eventPublisher.publishStatusChange(saved, previous, effectiveReason, KafkaTopics.RIDE_DRIVER_CANCELLED);
        metrics.recordDriverCancellation(suspended);
        metrics.recordTransition(RideStatus.REQUESTED.name());
        log.info("Driver {} cancelled ride {} ({} cancellations in window), re-broadcast to {} drivers",
                driverId, rideId, profile.getCancellationCount(), rebroadcast.notifiedDrivers().size());

        return new DriverCancelOutcome.Processed(rideId, driverId, profile.getCancellationCount(),
                suspended, expiresAt, rebroadcast);
    }

    // window starts at the first cancellation after a reset, not at each cancellation
    private static void resetCounterIfWindowElapsed(DriverProfile profile, Instant now, Duration window) {
        Instant lastReset = profile.getLastCancellationResetAt();
        if (lastReset == null || Duration.between(lastReset, now).compareTo(window) > 0) {
            profile.setCancellationCount(0);
            profile.setLastCancellationResetAt(now);
        }
    }
}
