package com.ridematch.dispatch.store;

import com.ridematch.dispatch.model.BroadcastRecord;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

public interface BroadcastStore {

    /** Stores the record, replacing any previous one for the same ride. */
    void save(BroadcastRecord record, Duration ttl);

    Optional<BroadcastRecord> find(UUID rideId);
}
