package com.ridematch.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Real-time "new ride near you" push for a single driver.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideOfferEvent {

    public static final String TOPIC = "driver.ride.offered";

    private String driverId;
    private String rideId;
    private double pickupLat;
    private double pickupLng;
    private double destinationLat;
    private double destinationLng;
    private BigDecimal estimatedFare;
    private double distanceToPickupKm;
    private boolean extendedArea;
    private int broadcastRound;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant offeredAt;
}
