package com.ridematch.dispatch.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.ridematch.shared.enums.DriverStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Registry entry for one driver. Stored as JSON; absent once it expires.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DriverAvailability {

    private String driverId;
    private DriverStatus status;
    private Double lat;
    private Double lng;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant updatedAt;

    public boolean hasLocation() {
        return lat != null && lng != null;
    }

    public GeoPoint location() {
        return hasLocation() ? new GeoPoint(lat, lng) : null;
    }
}
