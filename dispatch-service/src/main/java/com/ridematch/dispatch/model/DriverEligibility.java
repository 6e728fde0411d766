package com.ridematch.dispatch.model;

import java.util.Objects;

/**
 * Caller-supplied capability check over a candidate, e.g. "accepts parcels".
 */
@FunctionalInterface
public interface DriverEligibility {

    boolean test(DriverCandidate candidate);

    default DriverEligibility and(DriverEligibility other) {
        Objects.requireNonNull(other);
        return candidate -> test(candidate) && other.test(candidate);
    }

    static DriverEligibility any() {
        return candidate -> true;
    }

    static DriverEligibility acceptsExtendedArea() {
        return candidate -> candidate.getProfile() == null || candidate.getProfile().isAcceptExtendedArea();
    }

    static DriverEligibility acceptsParcels() {
        return candidate -> candidate.getProfile() == null || candidate.getProfile().isAcceptParcelDelivery();
    }
}
