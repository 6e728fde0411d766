package com.ridematch.dispatch.service;

import com.ridematch.dispatch.config.DispatchProperties;
import com.ridematch.dispatch.entity.DriverProfile;
import com.ridematch.dispatch.entity.Ride;
import com.ridematch.dispatch.metrics.DispatchMetrics;
import com.ridematch.dispatch.model.DriverAvailability;
import com.ridematch.dispatch.notification.RideEventPublisher;
import com.ridematch.dispatch.result.AcceptOutcome;
import com.ridematch.dispatch.store.DriverProfileStore;
import com.ridematch.dispatch.store.RideLock;
import com.ridematch.dispatch.store.RideStore;
import com.ridematch.shared.enums.DriverStatus;
import com.ridematch.shared.enums.RideStatus;
import com.ridematch.shared.util.KafkaTopics;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves concurrent accepts for a ride to a single winner.
 *
 * Protocol:
 *  1. Try the per-ride lock once, no waiting. Held lock means another accept
 *     is in flight: ALREADY_MATCHED if the ride is matched, else BUSY.
 *  2. Inside the lock re-read the ride (must be REQUESTED, same rider, not
 *     cancelled earlier by this driver) and the driver (must be AVAILABLE with
 *     a known location)
 *  3. Commit with a conditional REQUESTED → MATCHED update; zero rows means
 *     someone got there first, even if the lock was bypassed
 *  4. Driver → BUSY, broadcast cancelled, ride.matched published
 *  5. Lock released in finally on every path
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AcceptanceArbitrator {

    private final RideLock rideLock;
    private final RideStore rideStore;
    private final DriverProfileStore profileStore;
    private final DriverAvailabilityRegistry registry;
    private final BroadcastCoordinator broadcastCoordinator;
    private final RideEventPublisher eventPublisher;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;
    private final Clock clock;

    public AcceptOutcome accept(UUID rideId, String driverId, String riderId) {
        AcceptOutcome outcome = arbitrate(rideId, driverId, riderId);
        metrics.recordAcceptOutcome(outcome.code().toLowerCase());
        if (outcome.succeeded()) {
            log.info("Ride {} won by driver {}", rideId, driverId);
        } else {
            log.info("Accept of ride {} by driver {} -> {}", rideId, driverId, outcome.code());
        }
        return outcome;
    }

    private AcceptOutcome arbitrate(UUID rideId, String driverId, String riderId) {
        boolean acquired;
        try {
            acquired = rideLock.tryLock(rideId, properties.getLockLease());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while acquiring lock for ride {}", rideId);
            return new AcceptOutcome.Busy(rideId);
        }

        if (!acquired) {
            metrics.recordLockContention();
            boolean matched = rideStore.findById(rideId)
                    .map(r -> r.getStatus() == RideStatus.MATCHED)
                    .orElse(false);
            return matched ? new AcceptOutcome.AlreadyMatched(rideId) : new AcceptOutcome.Busy(rideId);
        }

        Timer.Sample sample = Timer.start();
        try {
            return decide(rideId, driverId, riderId);
        } finally {
            sample.stop(metrics.getArbitrationTimer());
            rideLock.unlock(rideId);
        }
    }

    private AcceptOutcome decide(UUID rideId, String driverId, String riderId) {
        Optional<Ride> found = rideStore.findById(rideId);
        if (found.isEmpty()) {
            return new AcceptOutcome.NotFound(rideId);
        }
        Ride ride = found.get();

        if (ride.getStatus() != RideStatus.REQUESTED) {
            if (ride.getStatus() == RideStatus.MATCHED) {
                return new AcceptOutcome.AlreadyMatched(rideId);
            }
            return new AcceptOutcome.PreconditionFailed(rideId,
                    "Ride " + rideId + " is " + ride.getStatus() + " and can no longer be accepted");
        }
        if (!ride.getRiderId().equals(riderId)) {
            return new AcceptOutcome.PreconditionFailed(rideId, "Rider does not match ride " + rideId);
        }
        boolean excluded = broadcastCoordinator.getBroadcast(rideId)
                .map(b -> b.excludes(driverId))
                .orElse(false);
        if (excluded) {
            return new AcceptOutcome.DriverExcluded(rideId, driverId);
        }

        Optional<DriverAvailability> availability = registry.getStatus(driverId);
        if (availability.isEmpty()
                || availability.get().getStatus() != DriverStatus.AVAILABLE
                || !availability.get().hasLocation()) {
            return new AcceptOutcome.DriverUnavailable(driverId);
        }

        double distanceKm = availability.get().location().distanceKmTo(ride.pickupPoint());
        int etaMinutes = (int) (distanceKm / properties.getAverageSpeedKmh() * 60);
        Instant matchedAt = clock.instant();

        if (!rideStore.assignDriver(rideId, driverId, matchedAt)) {
            log.warn("Ride {} left REQUESTED while driver {} held the lock", rideId, driverId);
            return new AcceptOutcome.AlreadyMatched(rideId);
        }

        registry.setBusy(driverId);
        broadcastCoordinator.cancelBroadcast(rideId);

        ride.setDriverId(driverId);
        ride.setStatus(RideStatus.MATCHED);
        ride.setMatchedAt(matchedAt);
        eventPublisher.publishStatusChange(ride, RideStatus.REQUESTED, null, KafkaTopics.RIDE_MATCHED);
        metrics.recordTransition(RideStatus.MATCHED.name());

        DriverProfile profile = profileStore.findById(driverId).orElse(null);
        return new AcceptOutcome.Won(
                rideId,
                driverId,
                profile != null ? profile.getFullName() : null,
                profile != null ? profile.getPhone() : null,
                profile != null ? profile.getRating() : 0.0,
                profile != null
                        ? new AcceptOutcome.Vehicle(profile.getVehicleRegistration(), profile.getVehicleMake(),
                                profile.getVehicleModel(), profile.getVehicleColor())
                        : null,
                distanceKm,
                etaMinutes,
                matchedAt);
    }
}
