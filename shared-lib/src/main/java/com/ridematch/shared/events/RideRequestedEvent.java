package com.ridematch.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.ridematch.shared.enums.RideType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideRequestedEvent {

    public static final String TOPIC = "ride.requested";

    private String rideId;
    private String riderId;
    private RideType rideType;
    private double pickupLat;
    private double pickupLng;
    private double destinationLat;
    private double destinationLng;
    private BigDecimal estimatedFare;
    private boolean extendedArea;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant requestedAt;
}
