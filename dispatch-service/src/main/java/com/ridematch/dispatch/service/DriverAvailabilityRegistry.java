package com.ridematch.dispatch.service;

import com.ridematch.dispatch.config.DispatchProperties;
import com.ridematch.dispatch.entity.DriverProfile;
import com.ridematch.dispatch.exception.DispatchException;
import com.ridematch.dispatch.model.DriverAvailability;
import com.ridematch.dispatch.model.DriverCandidate;
import com.ridematch.dispatch.model.GeoPoint;
import com.ridematch.dispatch.store.DriverAvailabilityStore;
import com.ridematch.dispatch.store.DriverProfileStore;
import com.ridematch.shared.enums.DriverStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Current status and last known location of every driver.
 *
 * Records live in the shared store with a 24h TTL that every write refreshes;
 * an expired record means the driver is offline. Only AVAILABLE drivers are
 * members of the available index, so proximity searches never see the others.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriverAvailabilityRegistry {

    private final DriverAvailabilityStore store;
    private final DriverProfileStore profileStore;
    private final DispatchProperties properties;
    private final Clock clock;

    public DriverAvailability setAvailable(String driverId, double lat, double lng) {
        requireValidCoordinates(lat, lng);
        DriverProfile profile = profileStore.findById(driverId)
                .orElseThrow(() -> new DispatchException("DRIVER_NOT_FOUND", "Driver " + driverId + " not found"));
        if (profile.isSuspended()) {
            throw new DispatchException("DRIVER_SUSPENDED",
                    "Driver " + driverId + " is suspended and cannot go online");
        }

        DriverAvailability record = write(driverId, DriverStatus.AVAILABLE, lat, lng);
        syncProfileStatus(profile, DriverStatus.AVAILABLE);
        log.info("Driver {} available at ({},{})", driverId, lat, lng);
        return record;
    }

    public DriverAvailability setUnavailable(String driverId) {
        DriverAvailability record = writeKeepingLocation(driverId, DriverStatus.UNAVAILABLE);
        profileStore.findById(driverId).ifPresent(p -> syncProfileStatus(p, DriverStatus.UNAVAILABLE));
        log.info("Driver {} unavailable", driverId);
        return record;
    }

    public DriverAvailability setBusy(String driverId) {
        DriverAvailability record = writeKeepingLocation(driverId, DriverStatus.BUSY);
        profileStore.findById(driverId).ifPresent(p -> syncProfileStatus(p, DriverStatus.BUSY));
        log.info("Driver {} busy", driverId);
        return record;
    }

    /**
     * Puts a driver back in the pool at their last known location after a
     * ride ends. Suspended drivers and drivers without a location stay out.
     */
    public void release(String driverId) {
        Optional<DriverAvailability> current = store.find(driverId);
        if (current.isEmpty() || !current.get().hasLocation()) {
            log.info("Driver {} has no known location, not returned to the pool", driverId);
            return;
        }
        Optional<DriverProfile> profile = profileStore.findById(driverId);
        if (profile.isPresent() && profile.get().isSuspended()) {
            log.info("Driver {} is suspended, not returned to the pool", driverId);
            return;
        }
        DriverAvailability record = current.get();
        write(driverId, DriverStatus.AVAILABLE, record.getLat(), record.getLng());
        profile.ifPresent(p -> syncProfileStatus(p, DriverStatus.AVAILABLE));
        log.info("Driver {} returned to the available pool", driverId);
    }

    public Optional<DriverAvailability> getStatus(String driverId) {
        return store.find(driverId);
    }

    public boolean isAvailable(String driverId) {
        return store.find(driverId)
                .map(r -> r.getStatus() == DriverStatus.AVAILABLE)
                .orElse(false);
    }

    /**
     * Location-only refresh. Status is preserved; an unknown driver gets an
     * UNAVAILABLE record carrying the location.
     */
    public DriverAvailability updateLocation(String driverId, double lat, double lng) {
        requireValidCoordinates(lat, lng);
        DriverStatus status = store.find(driverId)
                .map(DriverAvailability::getStatus)
                .orElse(DriverStatus.UNAVAILABLE);
        return write(driverId, status, lat, lng);
    }

    /**
     * Available drivers within {@code radiusKm} of {@code point}, closest first.
     */
    public List<DriverCandidate> findAvailableWithin(GeoPoint point, double radiusKm) {
        List<DriverCandidate> candidates = new ArrayList<>();
        for (DriverAvailability record : store.findIndexedNear(point, radiusKm)) {
            if (record.getStatus() != DriverStatus.AVAILABLE || !record.hasLocation()) {
                continue;
            }
            double distanceKm = record.location().distanceKmTo(point);
            if (distanceKm <= radiusKm) {
                candidates.add(DriverCandidate.builder()
                        .driverId(record.getDriverId())
                        .lat(record.getLat())
                        .lng(record.getLng())
                        .distanceKm(distanceKm)
                        .build());
            }
        }
        // index distances are approximate; order by the exact ones
        candidates.sort(Comparator.comparingDouble(DriverCandidate::getDistanceKm));
        log.debug("Found {} available drivers within {}km of ({},{})",
                candidates.size(), radiusKm, point.lat(), point.lng());
        return candidates;
    }

    private DriverAvailability writeKeepingLocation(String driverId, DriverStatus status) {
        Optional<DriverAvailability> current = store.find(driverId);
        Double lat = current.map(DriverAvailability::getLat).orElse(null);
        Double lng = current.map(DriverAvailability::getLng).orElse(null);
        return write(driverId, status, lat, lng);
    }

    private DriverAvailability write(String driverId, DriverStatus status, Double lat, Double lng) {
        DriverAvailability record = DriverAvailability.builder()
                .driverId(driverId)
                .status(status)
                .lat(lat)
                .lng(lng)
                .updatedAt(clock.instant())
                .build();
        store.write(record, status == DriverStatus.AVAILABLE, properties.getAvailabilityTtl());
        return record;
    }

    private void syncProfileStatus(DriverProfile profile, DriverStatus status) {
        try {
            profile.setStatus(status);
            profileStore.save(profile);
        } catch (DataAccessException e) {
            // reporting copy only; matching reads the registry
            log.warn("Could not sync profile status of driver {} to {}: {}",
                    profile.getDriverId(), status, e.getMessage());
        }
    }

    private static void requireValidCoordinates(double lat, double lng) {
        if (!new GeoPoint(lat, lng).isValid()) {
            throw new DispatchException("INVALID_COORDINATES",
                    "Coordinates out of range: (" + lat + ", " + lng + ")");
        }
    }
}
