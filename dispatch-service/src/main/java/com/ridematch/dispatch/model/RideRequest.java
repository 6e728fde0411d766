package com.ridematch.dispatch.model;

import com.ridematch.shared.enums.RideType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class RideRequest {

    @NotBlank
    private String riderId;

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double pickupLat;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double pickupLng;

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double destinationLat;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double destinationLng;

    private RideType rideType = RideType.RIDE;

    @DecimalMin("1.0") @DecimalMax("5.0")
    private double surgeMultiplier = 1.0;
}
