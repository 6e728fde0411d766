package com.ridematch.dispatch.store;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Key: ride:rejections:{rideId}, hash of driverId to epoch millis.
 */
@Component
@RequiredArgsConstructor
public class RedisRejectionStore implements RejectionStore {

    static final String KEY_PREFIX = "ride:rejections:";

    private final RedisTemplate<String, String> redisTemplate;

    @Override
    public void record(UUID rideId, String driverId, Instant rejectedAt, Duration ttl) {
        String key = KEY_PREFIX + rideId;
        redisTemplate.opsForHash().put(key, driverId, String.valueOf(rejectedAt.toEpochMilli()));
        redisTemplate.expire(key, ttl);
    }

    @Override
    public Map<String, Instant> findAll(UUID rideId) {
        Map<Object, Object> entries = redisTemplate.opsForHash().entries(KEY_PREFIX + rideId);
        Map<String, Instant> rejections = new HashMap<>();
        entries.forEach((driverId, millis) ->
                rejections.put(driverId.toString(), Instant.ofEpochMilli(Long.parseLong(millis.toString()))));
        return rejections;
    }
}
