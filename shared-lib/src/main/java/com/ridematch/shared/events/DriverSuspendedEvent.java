package com.ridematch.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriverSuspendedEvent {

    public static final String TOPIC = "driver.suspended";

    private String driverId;
    private int cancellationCount;
    private String reason;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant suspendedAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant expiresAt;
}
