package com.ridematch.dispatch.store;

import lombok.RequiredArgsConstructor;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

@Component
@RequiredArgsConstructor
public class RedissonRideLock implements RideLock {

    static final String LOCK_PREFIX = "lock:ride:";

    private final RedissonClient redissonClient;

    @Override
    public boolean tryLock(UUID rideId, Duration lease) throws InterruptedException {
        RLock lock = redissonClient.getLock(LOCK_PREFIX + rideId);
        return lock.tryLock(0, lease.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void unlock(UUID rideId) {
        RLock lock = redissonClient.getLock(LOCK_PREFIX + rideId);
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
        }
    }
}
