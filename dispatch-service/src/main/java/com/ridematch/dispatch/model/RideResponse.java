package com.ridematch.dispatch.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.ridematch.dispatch.entity.CancellationParty;
import com.ridematch.dispatch.entity.Ride;
import com.ridematch.shared.enums.RideStatus;
import com.ridematch.shared.enums.RideType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideResponse {

    private UUID rideId;
    private String riderId;
    private String driverId;
    private RideStatus status;
    private RideType rideType;
    private boolean extendedArea;
    private BigDecimal estimatedFare;
    private BigDecimal finalFare;
    private double surgeMultiplier;
    private CancellationParty cancelledBy;
    private String cancellationReason;
    private BigDecimal cancellationFee;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant requestedAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant matchedAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant completedAt;

    public static RideResponse from(Ride ride) {
        return RideResponse.builder()
                .rideId(ride.getId())
                .riderId(ride.getRiderId())
                .driverId(ride.getDriverId())
                .status(ride.getStatus())
                .rideType(ride.getRideType())
                .extendedArea(ride.isExtendedArea())
                .estimatedFare(ride.getEstimatedFare())
                .finalFare(ride.getFinalFare())
                .surgeMultiplier(ride.surgeMultiplier())
                .cancelledBy(ride.getCancelledBy())
                .cancellationReason(ride.getCancellationReason())
                .cancellationFee(ride.getCancellationFee())
                .requestedAt(ride.getRequestedAt())
                .matchedAt(ride.getMatchedAt())
                .completedAt(ride.getCompletedAt())
                .build();
    }
}
