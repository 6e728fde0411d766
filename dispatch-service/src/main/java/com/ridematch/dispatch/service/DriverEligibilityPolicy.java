package com.ridematch.dispatch.service;

import com.ridematch.dispatch.entity.Ride;
import com.ridematch.dispatch.model.DriverEligibility;
import com.ridematch.shared.enums.RideType;
import com.ridematch.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds the capability filter a ride's broadcasts and expansions use.
 */
@Component
@RequiredArgsConstructor
public class DriverEligibilityPolicy {

    private final FeatureFlagService featureFlagService;

    public DriverEligibility forRide(Ride ride) {
        DriverEligibility eligibility = DriverEligibility.any();
        if (ride.isExtendedArea()
                && featureFlagService.isEnabled(FeatureFlagService.EXTENDED_AREA_FILTER, true)) {
            eligibility = eligibility.and(DriverEligibility.acceptsExtendedArea());
        }
        if (ride.getRideType() == RideType.PARCEL) {
            eligibility = eligibility.and(DriverEligibility.acceptsParcels());
        }
        return eligibility;
    }
}
