package com.ridematch.dispatch.service;

import com.ridematch.dispatch.config.DispatchProperties;
import com.ridematch.dispatch.entity.CancellationParty;
import com.ridematch.dispatch.entity.FareBreakdown;
import com.ridematch.dispatch.entity.Ride;
import com.ridematch.dispatch.metrics.DispatchMetrics;
import com.ridematch.dispatch.notification.RideEventPublisher;
import com.ridematch.dispatch.result.DriverCancelOutcome;
import com.ridematch.dispatch.result.ErrorKind;
import com.ridematch.dispatch.result.LifecycleResult;
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
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives a matched ride through arrival, trip and completion, and handles
 * cancellation by either party.
 *
 * State machine:
 *   REQUESTED → MATCHED → DRIVER_ARRIVING → IN_PROGRESS → COMPLETED
 *   MATCHED → IN_PROGRESS (driver starts without announcing arrival)
 *   REQUESTED | MATCHED | DRIVER_ARRIVING → CANCELLED
 * REQUESTED → MATCHED belongs to {@link AcceptanceArbitrator}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RideLifecycleService {

    private final RideStore rideStore;
    private final DriverProfileStore profileStore;
    private final DriverAvailabilityRegistry registry;
    private final BroadcastCoordinator broadcastCoordinator;
    private final DriverCancellationPolicy cancellationPolicy;
    private final FareCalculatorService fareCalculator;
    private final RideEventPublisher eventPublisher;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;
    private final Clock clock;

    public LifecycleResult arrive(UUID rideId, String driverId) {
        Optional<Ride> found = rideStore.findById(rideId);
        if (found.isEmpty()) {
            return notFound(rideId);
        }
        Ride ride = found.get();
        if (ride.getStatus() != RideStatus.MATCHED) {
            return illegalTransition(ride, RideStatus.DRIVER_ARRIVING);
        }
        if (!driverId.equals(ride.getDriverId())) {
            return notAssigned(rideId, driverId);
        }

        ride.setStatus(RideStatus.DRIVER_ARRIVING);
        ride.setPickupTime(clock.instant());
        return applied(ride, RideStatus.MATCHED, null, KafkaTopics.RIDE_DRIVER_ARRIVING);
    }

    public LifecycleResult start(UUID rideId, String driverId) {
        Optional<Ride> found = rideStore.findById(rideId);
        if (found.isEmpty()) {
            return notFound(rideId);
        }
        Ride ride = found.get();
        if (!ride.getStatus().canStart()) {
            return illegalTransition(ride, RideStatus.IN_PROGRESS);
        }
        if (!driverId.equals(ride.getDriverId())) {
            return notAssigned(rideId, driverId);
        }

        RideStatus previous = ride.getStatus();
        Instant now = clock.instant();
        ride.setStatus(RideStatus.IN_PROGRESS);
        ride.setStartTime(now);
        if (ride.getPickupTime() == null) {
            ride.setPickupTime(now);
        }
        return applied(ride, previous, null, KafkaTopics.RIDE_IN_PROGRESS);
    }

    /**
     * Ends the trip, charges the protected fare and returns the driver to the pool.
     */
    public LifecycleResult complete(UUID rideId, String driverId, double actualDistanceKm) {
        if (!Double.isFinite(actualDistanceKm) || actualDistanceKm < 0) {
            return LifecycleResult.refused(ErrorKind.VALIDATION,
                    "Actual distance must be a finite, non-negative number, got " + actualDistanceKm);
        }
        Optional<Ride> found = rideStore.findById(rideId);
        if (found.isEmpty()) {
            return notFound(rideId);
        }
        Ride ride = found.get();
        if (ride.getStatus() != RideStatus.IN_PROGRESS) {
            return illegalTransition(ride, RideStatus.COMPLETED);
        }
        if (!driverId.equals(ride.getDriverId())) {
            return notAssigned(rideId, driverId);
        }

        BigDecimal actualFare = fareCalculator.calculate(actualDistanceKm, ride.surgeMultiplier());
        BigDecimal charged = fareCalculator.finalFare(ride.getEstimatedFare(), actualFare);

        FareBreakdown breakdown = ride.getFareBreakdown() != null ? ride.getFareBreakdown() : new FareBreakdown();
        breakdown.setActualDistanceKm(actualDistanceKm);
        breakdown.setActualFare(actualFare);
        ride.setFareBreakdown(breakdown);
        ride.setFinalFare(charged);
        ride.setStatus(RideStatus.COMPLETED);
        ride.setCompletedAt(clock.instant());

        LifecycleResult result = applied(ride, RideStatus.IN_PROGRESS, null, KafkaTopics.RIDE_COMPLETED);
        if (!result.succeeded()) {
            return result;
        }

        registry.release(driverId);
        profileStore.findById(driverId).ifPresent(p -> {
            p.setTotalRides(p.getTotalRides() + 1);
            profileStore.save(p);
        });
        return result;
    }

    /**
     * Cancellation requested by a participant. A driver cancelling a matched
     * ride is routed to {@link DriverCancellationPolicy}, which re-opens the
     * ride instead of ending it.
     */
    public LifecycleResult cancel(UUID rideId, String userId, String reason) {
        Optional<Ride> found = rideStore.findById(rideId);
        if (found.isEmpty()) {
            return notFound(rideId);
        }
        Ride ride = found.get();
        boolean byRider = userId.equals(ride.getRiderId());
        boolean byDriver = userId.equals(ride.getDriverId());
        if (!byRider && !byDriver) {
            return LifecycleResult.refused(ErrorKind.FORBIDDEN,
                    "User " + userId + " is not a participant of ride " + rideId);
        }
        if (!ride.getStatus().isCancellable()) {
            return illegalTransition(ride, RideStatus.CANCELLED);
        }

        if (byDriver && !byRider) {
            return fromDriverCancel(rideId, cancellationPolicy.driverCancel(rideId, userId, reason));
        }

        RideStatus previous = ride.getStatus();
        BigDecimal fee = previous == RideStatus.REQUESTED
                ? BigDecimal.ZERO
                : properties.getCancellation().getRiderFee();

        ride.setStatus(RideStatus.CANCELLED);
        ride.setCancelledBy(CancellationParty.RIDER);
        ride.setCancellationReason(reason);
        ride.setCancellationTimestamp(clock.instant());
        ride.setCancellationFee(fee);
        LifecycleResult result = applied(ride, previous, reason, KafkaTopics.RIDE_CANCELLED);
        if (!result.succeeded()) {
            return result;
        }

        broadcastCoordinator.cancelBroadcast(rideId);
        if (ride.getDriverId() != null) {
            registry.release(ride.getDriverId());
        }
        return result;
    }

    private LifecycleResult fromDriverCancel(UUID rideId, DriverCancelOutcome outcome) {
        if (!outcome.succeeded()) {
            return LifecycleResult.refused(outcome.errorKind(), outcome.message());
        }
        return rideStore.findById(rideId)
                .<LifecycleResult>map(LifecycleResult.Applied::new)
                .orElseGet(() -> notFound(rideId));
    }

    // a concurrent accept or transition bumped the version after our read
    private LifecycleResult applied(Ride ride, RideStatus previous, String reason, String topic) {
        Ride saved;
        try {
            saved = rideStore.save(ride);
        } catch (OptimisticLockingFailureException e) {
            log.info("Ride {} changed concurrently, {} -> {} not applied", ride.getId(), previous, ride.getStatus());
            return LifecycleResult.refused(ErrorKind.CONFLICT,
                    "Ride " + ride.getId() + " was modified concurrently, retry");
        }
        eventPublisher.publishStatusChange(saved, previous, reason, topic);
        metrics.recordTransition(saved.getStatus().name());
        log.info("Ride {} {} -> {}", saved.getId(), previous, saved.getStatus());
        return new LifecycleResult.Applied(saved);
    }

    private static LifecycleResult notFound(UUID rideId) {
        return LifecycleResult.refused(ErrorKind.NOT_FOUND, "Ride " + rideId + " not found");
    }

    private static LifecycleResult notAssigned(UUID rideId, String driverId) {
        return LifecycleResult.refused(ErrorKind.FORBIDDEN,
                "Driver " + driverId + " is not assigned to ride " + rideId);
    }

    private static LifecycleResult illegalTransition(Ride ride, RideStatus target) {
        return LifecycleResult.refused(ErrorKind.PRECONDITION_FAILED,
                "Ride " + ride.getId() + " cannot move from " + ride.getStatus() + " to " + target);
    }
}
