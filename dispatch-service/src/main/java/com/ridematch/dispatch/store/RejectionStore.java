package com.ridematch.dispatch.store;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public interface RejectionStore {

    void record(UUID rideId, String driverId, Instant rejectedAt, Duration ttl);

    /** Driver id to rejection time. */
    Map<String, Instant> findAll(UUID rideId);
}
