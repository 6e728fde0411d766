package com.ridematch.dispatch.store;

import com.ridematch.dispatch.model.DriverAvailability;
import com.ridematch.dispatch.model.GeoPoint;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

public interface DriverAvailabilityStore {

    /**
     * Writes the record with a fresh TTL and, in the same transaction, puts
     * the driver into the available-drivers geo index at the record's
     * location or takes them out of it.
     */
    void write(DriverAvailability record, boolean available, Duration ttl);

    Optional<DriverAvailability> find(String driverId);

    /**
     * Records of indexed drivers around {@code point}, nearest first. The
     * index search may reach slightly past {@code radiusKm}, so callers apply
     * the exact cut. Index entries whose record has expired are dropped.
     */
    List<DriverAvailability> findIndexedNear(GeoPoint point, double radiusKm);
}
