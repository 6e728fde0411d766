package com.ridematch.dispatch.store;

import java.time.Duration;
import java.util.UUID;

/**
 * Short-lease mutual exclusion per ride, used only by acceptance arbitration.
 */
public interface RideLock {

    /**
     * Tries once, without waiting. The lease bounds how long a crashed holder
     * can stall the ride.
     */
    boolean tryLock(UUID rideId, Duration lease) throws InterruptedException;

    /** Releases the lock if the calling thread holds it; otherwise a no-op. */
    void unlock(UUID rideId);
}
