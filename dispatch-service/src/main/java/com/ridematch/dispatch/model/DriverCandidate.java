package com.ridematch.dispatch.model;

import com.ridematch.dispatch.entity.DriverProfile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An available driver inside the search radius, with the profile used by
 * eligibility filters. Profile is null until the coordinator enriches it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DriverCandidate {

    private String driverId;
    private double lat;
    private double lng;
    private double distanceKm;
    private DriverProfile profile;
}
