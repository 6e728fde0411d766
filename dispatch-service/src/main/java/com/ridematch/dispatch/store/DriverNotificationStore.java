package com.ridematch.dispatch.store;

import com.ridematch.dispatch.model.RideNotification;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Per-driver pending offers, at most one per ride.
 */
public interface DriverNotificationStore {

    void put(String driverId, RideNotification notification, Duration ttl);

    void remove(String driverId, UUID rideId);

    List<RideNotification> findAll(String driverId);
}
