package com.ridematch.dispatch.model;

import java.util.List;
import java.util.UUID;

/**
 * Drivers notified by one broadcast round, closest first.
 */
public record BroadcastResult(UUID rideId,
                              List<NotifiedDriver> notifiedDrivers,
                              double radiusUsedKm,
                              boolean extendedArea) {

    public List<String> driverIds() {
        return notifiedDrivers.stream().map(NotifiedDriver::driverId).toList();
    }
}
