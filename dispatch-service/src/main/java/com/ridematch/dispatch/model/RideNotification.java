package com.ridematch.dispatch.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Pending ride offer kept for a driver until it expires, is rejected or the
 * broadcast is cancelled.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideNotification {

    private UUID rideId;
    private double pickupLat;
    private double pickupLng;
    private double destinationLat;
    private double destinationLng;
    private BigDecimal estimatedFare;
    private double distanceToPickupKm;
    private boolean extendedArea;
    private int broadcastRound;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant notifiedAt;
}
