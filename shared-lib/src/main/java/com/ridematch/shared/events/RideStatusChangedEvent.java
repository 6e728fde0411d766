package com.ridematch.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.ridematch.shared.enums.RideStatus;
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
public class RideStatusChangedEvent {

    private String rideId;
    private String riderId;
    private String driverId;
    private RideStatus previousStatus;
    private RideStatus status;
    private String reason;
    private BigDecimal fare;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant changedAt;
}
