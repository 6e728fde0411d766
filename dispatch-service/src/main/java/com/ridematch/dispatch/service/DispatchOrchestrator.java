package com.ridematch.dispatch.service;

import com.ridematch.dispatch.entity.FareBreakdown;
import com.ridematch.dispatch.entity.Ride;
import com.ridematch.dispatch.exception.DispatchException;
import com.ridematch.dispatch.metrics.DispatchMetrics;
import com.ridematch.dispatch.model.BroadcastRecord;
import com.ridematch.dispatch.model.BroadcastResult;
import com.ridematch.dispatch.model.DriverAvailability;
import com.ridematch.dispatch.model.FareQuote;
import com.ridematch.dispatch.model.GeoPoint;
import com.ridematch.dispatch.model.RideNotification;
import com.ridematch.dispatch.model.RideRequest;
import com.ridematch.dispatch.notification.RideEventPublisher;
import com.ridematch.dispatch.result.AcceptOutcome;
import com.ridematch.dispatch.result.DriverCancelOutcome;
import com.ridematch.dispatch.result.ExpandOutcome;
import com.ridematch.dispatch.result.LifecycleResult;
import com.ridematch.dispatch.result.RejectOutcome;
import com.ridematch.dispatch.store.RideStore;
import com.ridematch.shared.enums.RideStatus;
import com.ridematch.shared.enums.RideType;
import com.ridematch.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Public surface of the dispatch engine. Controllers talk only to this class.
 *
 * Ride request flow:
 *  1. Kill switch and service-area checks
 *  2. Estimate from the straight-line pickup → destination distance
 *  3. Persist the ride as REQUESTED, publish ride.requested
 *  4. First broadcast at the area's initial radius
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DispatchOrchestrator {

    private final RideStore rideStore;
    private final DriverAvailabilityRegistry registry;
    private final BroadcastCoordinator broadcastCoordinator;
    private final AcceptanceArbitrator arbitrator;
    private final RejectionTracker rejectionTracker;
    private final RadiusExpansionService expansionService;
    private final RideLifecycleService lifecycleService;
    private final DriverCancellationPolicy cancellationPolicy;
    private final DriverEligibilityPolicy eligibilityPolicy;
    private final FareCalculatorService fareCalculator;
    private final ServiceArea serviceArea;
    private final FeatureFlagService featureFlagService;
    private final RideEventPublisher eventPublisher;
    private final DispatchMetrics metrics;
    private final Clock clock;

    public Ride requestRide(RideRequest request) {
        if (featureFlagService.isEnabled(FeatureFlagService.DISPATCH_KILL_SWITCH, false)) {
            metrics.recordRideRejected();
            log.warn("Dispatch kill switch active, ride request from {} refused", request.getRiderId());
            throw new DispatchException("SERVICE_UNAVAILABLE", "Dispatch is temporarily disabled");
        }

        GeoPoint pickup = new GeoPoint(request.getPickupLat(), request.getPickupLng());
        GeoPoint destination = new GeoPoint(request.getDestinationLat(), request.getDestinationLng());
        if (!pickup.isValid() || !destination.isValid()) {
            throw new DispatchException("INVALID_COORDINATES", "Pickup or destination coordinates out of range");
        }
        if (!serviceArea.isWithinServiceArea(pickup)) {
            metrics.recordRideRejected();
            throw new DispatchException("OUTSIDE_SERVICE_AREA", "Pickup is outside the service area");
        }

        FareQuote quote = fareCalculator.quote(pickup.distanceKmTo(destination), request.getSurgeMultiplier());
        boolean extendedArea = serviceArea.isExtendedArea(pickup);
        Instant now = clock.instant();

        Ride ride = rideStore.save(Ride.builder()
                .riderId(request.getRiderId())
                .status(RideStatus.REQUESTED)
                .rideType(request.getRideType() != null ? request.getRideType() : RideType.RIDE)
                .pickupLat(pickup.lat())
                .pickupLng(pickup.lng())
                .destinationLat(destination.lat())
                .destinationLng(destination.lng())
                .extendedArea(extendedArea)
                .estimatedFare(quote.total())
                .fareBreakdown(FareBreakdown.builder()
                        .baseFare(quote.baseFare())
                        .distanceCharge(quote.distanceCharge())
                        .perKmRate(quote.perKmRate())
                        .estimatedDistanceKm(quote.distanceKm())
                        .surgeMultiplier(quote.surgeMultiplier())
                        .build())
                .requestedAt(now)
                .build());
        eventPublisher.publishRideRequested(ride);

        BroadcastResult result = broadcastCoordinator.broadcast(ride.getId(), pickup, destination,
                ride.getEstimatedFare(), serviceArea.initialRadiusKm(extendedArea), eligibilityPolicy.forRide(ride));
        metrics.recordRideCreated();
        log.info("Ride {} requested by {}: fare={} extendedArea={} notified={}",
                ride.getId(), ride.getRiderId(), ride.getEstimatedFare(), extendedArea,
                result.notifiedDrivers().size());
        return ride;
    }

    public Optional<Ride> getRide(UUID rideId) {
        return rideStore.findById(rideId);
    }

    /**
     * Starts a fresh broadcast round for a REQUESTED ride.
     *
     * @param radiusKm {@code null} for the area's initial radius
     */
    public BroadcastResult broadcastRide(UUID rideId, Double radiusKm) {
        Ride ride = rideStore.findById(rideId)
                .orElseThrow(() -> new DispatchException("RIDE_NOT_FOUND", "Ride " + rideId + " not found"));
        if (ride.getStatus() != RideStatus.REQUESTED) {
            throw new DispatchException("RIDE_NOT_OPEN", "Ride " + rideId + " is " + ride.getStatus());
        }
        double radius = radiusKm != null ? radiusKm : serviceArea.initialRadiusKm(ride.isExtendedArea());
        if (Double.isNaN(radius) || radius <= 0) {
            throw new DispatchException("INVALID_RADIUS", "Radius must be positive, got " + radius);
        }
        return broadcastCoordinator.broadcast(rideId, ride.pickupPoint(), ride.destinationPoint(),
                ride.getEstimatedFare(), radius, eligibilityPolicy.forRide(ride));
    }

    public Optional<BroadcastRecord> getBroadcast(UUID rideId) {
        return broadcastCoordinator.getBroadcast(rideId);
    }

    public boolean cancelBroadcast(UUID rideId) {
        return broadcastCoordinator.cancelBroadcast(rideId);
    }

    public AcceptOutcome accept(UUID rideId, String driverId, String riderId) {
        return arbitrator.accept(rideId, driverId, riderId);
    }

    public RejectOutcome reject(UUID rideId, String driverId) {
        return rejectionTracker.reject(rideId, driverId);
    }

    public ExpandOutcome expand(UUID rideId, Double currentRadiusKm, Double incrementKm) {
        double increment = incrementKm != null
                ? incrementKm
                : rideStore.findById(rideId)
                        .map(r -> serviceArea.radiusIncrementKm(r.isExtendedArea()))
                        .orElse(serviceArea.radiusIncrementKm(false));
        return expansionService.expand(rideId, currentRadiusKm, increment);
    }

    public LifecycleResult arrive(UUID rideId, String driverId) {
        return lifecycleService.arrive(rideId, driverId);
    }

    public LifecycleResult start(UUID rideId, String driverId) {
        return lifecycleService.start(rideId, driverId);
    }

    public LifecycleResult complete(UUID rideId, String driverId, double actualDistanceKm) {
        return lifecycleService.complete(rideId, driverId, actualDistanceKm);
    }

    public LifecycleResult cancel(UUID rideId, String userId, String reason) {
        return lifecycleService.cancel(rideId, userId, reason);
    }

    public DriverCancelOutcome driverCancel(UUID rideId, String driverId, String reason) {
        return cancellationPolicy.driverCancel(rideId, driverId, reason);
    }

    public DriverAvailability setDriverAvailable(String driverId, double lat, double lng) {
        return registry.setAvailable(driverId, lat, lng);
    }

    public DriverAvailability setDriverUnavailable(String driverId) {
        return registry.setUnavailable(driverId);
    }

    public DriverAvailability updateDriverLocation(String driverId, double lat, double lng) {
        return registry.updateLocation(driverId, lat, lng);
    }

    public Optional<DriverAvailability> getDriverStatus(String driverId) {
        return registry.getStatus(driverId);
    }

    public List<RideNotification> pendingNotifications(String driverId) {
        return broadcastCoordinator.pendingNotifications(driverId);
    }
}
