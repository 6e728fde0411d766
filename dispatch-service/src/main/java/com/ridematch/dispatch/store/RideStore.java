package com.ridematch.dispatch.store;

import com.ridematch.dispatch.entity.Ride;
import com.ridematch.shared.enums.RideStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent ride storage shared by every service instance.
 */
public interface RideStore {

    Optional<Ride> findById(UUID rideId);

    Ride save(Ride ride);

    List<Ride> findByStatus(RideStatus status);

    /**
     * Atomically moves the ride from REQUESTED to MATCHED with the given driver.
     *
     * @return false if the ride was no longer REQUESTED
     */
    boolean assignDriver(UUID rideId, String driverId, Instant matchedAt);
}
