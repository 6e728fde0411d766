package com.ridematch.dispatch.service;

import com.ridematch.dispatch.config.DispatchProperties;
import com.ridematch.dispatch.entity.DriverProfile;
import com.ridematch.dispatch.metrics.DispatchMetrics;
import com.ridematch.dispatch.model.BroadcastRecord;
import com.ridematch.dispatch.model.BroadcastResult;
import com.ridematch.dispatch.model.BroadcastStatus;
import com.ridematch.dispatch.model.DriverCandidate;
import com.ridematch.dispatch.model.DriverEligibility;
import com.ridematch.dispatch.model.GeoPoint;
import com.ridematch.dispatch.model.NotifiedDriver;
import com.ridematch.dispatch.model.RideNotification;
import com.ridematch.dispatch.notification.OutboundNotificationQueue;
import com.ridematch.dispatch.store.BroadcastStore;
import com.ridematch.dispatch.store.DriverNotificationStore;
import com.ridematch.dispatch.store.DriverProfileStore;
import com.ridematch.shared.events.RideOfferEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Selects eligible drivers around a pickup and fans the ride out to them.
 *
 * Broadcast flow:
 *  1. Available drivers within the radius, closest first (registry)
 *  2. Drop drivers without a profile, suspended drivers and drivers the
 *     eligibility filter rejects
 *  3. Store a fresh ACTIVE broadcast record (replaces any previous round)
 *  4. Store one pending notification per driver, same TTL as the record
 *  5. Enqueue real-time pushes; delivery happens off the caller's thread
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BroadcastCoordinator {

    private final DriverAvailabilityRegistry registry;
    private final DriverProfileStore profileStore;
    private final BroadcastStore broadcastStore;
    private final DriverNotificationStore notificationStore;
    private final OutboundNotificationQueue notificationQueue;
    private final ServiceArea serviceArea;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;
    private final Clock clock;

    public BroadcastResult broadcast(UUID rideId, GeoPoint pickup, GeoPoint destination,
                                     BigDecimal estimatedFare, double radiusKm,
                                     DriverEligibility eligibility) {
        return broadcast(rideId, pickup, destination, estimatedFare, radiusKm, eligibility, List.of());
    }

    /**
     * Broadcast that never reaches {@code excludedDriverIds}. The exclusions are
     * kept on the record so later expansions and accepts honour them too.
     */
    public BroadcastResult broadcast(UUID rideId, GeoPoint pickup, GeoPoint destination,
                                     BigDecimal estimatedFare, double radiusKm,
                                     DriverEligibility eligibility, Collection<String> excludedDriverIds) {
        Set<String> excluded = new HashSet<>(excludedDriverIds);
        List<DriverCandidate> selected = findEligibleDrivers(pickup, radiusKm, eligibility).stream()
                .filter(c -> !excluded.contains(c.getDriverId()))
                .toList();
        boolean extendedArea = serviceArea.isExtendedArea(pickup);
        Instant now = clock.instant();

        BroadcastRecord record = BroadcastRecord.builder()
                .rideId(rideId)
                .pickupLat(pickup.lat())
                .pickupLng(pickup.lng())
                .destinationLat(destination.lat())
                .destinationLng(destination.lng())
                .estimatedFare(estimatedFare)
                .radiusKm(radiusKm)
                .extendedArea(extendedArea)
                .notifiedDriverIds(new ArrayList<>(selected.stream().map(DriverCandidate::getDriverId).toList()))
                .excludedDriverIds(new ArrayList<>(excluded))
                .status(BroadcastStatus.ACTIVE)
                .broadcastCount(1)
                .createdAt(now)
                .build();
        broadcastStore.save(record, properties.getBroadcastTtl());

        List<NotifiedDriver> notified = notifyDrivers(record, selected, 1);
        metrics.recordBroadcast(notified.size());
        log.info("Broadcast ride {} to {} drivers within {}km (extendedArea={})",
                rideId, notified.size(), radiusKm, extendedArea);

        return new BroadcastResult(rideId, notified, radiusKm, extendedArea);
    }

    public BroadcastResult broadcast(UUID rideId, GeoPoint pickup, GeoPoint destination,
                                     BigDecimal estimatedFare, double radiusKm) {
        return broadcast(rideId, pickup, destination, estimatedFare, radiusKm, DriverEligibility.any());
    }

    /**
     * Available, unsuspended drivers with a profile inside the radius that pass
     * {@code eligibility}, closest first. Profiles are attached to the candidates.
     */
    public List<DriverCandidate> findEligibleDrivers(GeoPoint pickup, double radiusKm,
                                                     DriverEligibility eligibility) {
        List<DriverCandidate> inRadius = registry.findAvailableWithin(pickup, radiusKm);
        if (inRadius.isEmpty()) {
            return List.of();
        }
        Map<String, DriverProfile> profiles = profileStore.findAllById(
                inRadius.stream().map(DriverCandidate::getDriverId).toList());

        List<DriverCandidate> eligible = new ArrayList<>();
        for (DriverCandidate candidate : inRadius) {
            DriverProfile profile = profiles.get(candidate.getDriverId());
            if (profile == null || profile.isSuspended()) {
                log.debug("Skipping driver {}: no profile or suspended", candidate.getDriverId());
                continue;
            }
            DriverCandidate enriched = candidate.toBuilder().profile(profile).build();
            if (eligibility.test(enriched)) {
                eligible.add(enriched);
            }
        }
        return eligible;
    }

    /**
     * Stores a pending notification for each driver and enqueues the pushes.
     * Used for the first round and for radius expansions.
     */
    public List<NotifiedDriver> notifyDrivers(BroadcastRecord record, List<DriverCandidate> drivers, int round) {
        Instant now = clock.instant();
        List<NotifiedDriver> notified = new ArrayList<>(drivers.size());
        List<RideOfferEvent> offers = new ArrayList<>(drivers.size());

        for (DriverCandidate driver : drivers) {
            RideNotification notification = RideNotification.builder()
                    .rideId(record.getRideId())
                    .pickupLat(record.getPickupLat())
                    .pickupLng(record.getPickupLng())
                    .destinationLat(record.getDestinationLat())
                    .destinationLng(record.getDestinationLng())
                    .estimatedFare(record.getEstimatedFare())
                    .distanceToPickupKm(driver.getDistanceKm())
                    .extendedArea(record.isExtendedArea())
                    .broadcastRound(round)
                    .notifiedAt(now)
                    .build();
            notificationStore.put(driver.getDriverId(), notification, properties.getBroadcastTtl());

            offers.add(RideOfferEvent.builder()
                    .driverId(driver.getDriverId())
                    .rideId(record.getRideId().toString())
                    .pickupLat(record.getPickupLat())
                    .pickupLng(record.getPickupLng())
                    .destinationLat(record.getDestinationLat())
                    .destinationLng(record.getDestinationLng())
                    .estimatedFare(record.getEstimatedFare())
                    .distanceToPickupKm(driver.getDistanceKm())
                    .extendedArea(record.isExtendedArea())
                    .broadcastRound(round)
                    .offeredAt(now)
                    .build());
            notified.add(new NotifiedDriver(driver.getDriverId(), driver.getDistanceKm()));
        }

        if (!offers.isEmpty()) {
            notificationQueue.submit(offers);
        }
        return notified;
    }

    /**
     * Marks the ride's broadcast cancelled and withdraws its pending
     * notifications. Returns false if no record exists.
     */
    public boolean cancelBroadcast(UUID rideId) {
        Optional<BroadcastRecord> found = broadcastStore.find(rideId);
        if (found.isEmpty()) {
            return false;
        }
        BroadcastRecord record = found.get();
        record.setStatus(BroadcastStatus.CANCELLED);
        record.setCancelledAt(clock.instant());
        broadcastStore.save(record, properties.getBroadcastTtl());

        for (String driverId : record.getNotifiedDriverIds()) {
            notificationStore.remove(driverId, rideId);
        }
        log.info("Broadcast for ride {} cancelled, {} notifications withdrawn",
                rideId, record.getNotifiedDriverIds().size());
        return true;
    }

    public Optional<BroadcastRecord> getBroadcast(UUID rideId) {
        return broadcastStore.find(rideId);
    }

    /** Offers still pending for the driver, newest first. */
    public List<RideNotification> pendingNotifications(String driverId) {
        Instant cutoff = clock.instant().minus(properties.getBroadcastTtl());
        return notificationStore.findAll(driverId).stream()
                .filter(n -> n.getNotifiedAt() != null && n.getNotifiedAt().isAfter(cutoff))
                .toList();
    }
}
