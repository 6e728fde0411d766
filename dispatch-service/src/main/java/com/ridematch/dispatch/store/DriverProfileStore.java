package com.ridematch.dispatch.store;

import com.ridematch.dispatch.entity.DriverProfile;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface DriverProfileStore {

    Optional<DriverProfile> findById(String driverId);

    /** Profiles keyed by driver id; unknown ids are simply missing. */
    Map<String, DriverProfile> findAllById(Collection<String> driverIds);

    DriverProfile save(DriverProfile profile);

    List<DriverProfile> findSuspendedAtOrBefore(Instant cutoff);
}
