package com.ridematch.dispatch.store;

import com.ridematch.dispatch.model.BroadcastRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Key: ride:broadcast:{rideId} holding the JSON record. One key per ride, so a
 * new broadcast overwrites the previous round.
 */
@Component
@RequiredArgsConstructor
public class RedisBroadcastStore implements BroadcastStore {

    static final String KEY_PREFIX = "ride:broadcast:";

    private final RedisTemplate<String, String> redisTemplate;
    private final RedisJson json;

    @Override
    public void save(BroadcastRecord record, Duration ttl) {
        redisTemplate.opsForValue().set(KEY_PREFIX + record.getRideId(), json.write(record), ttl);
    }

    @Override
    public Optional<BroadcastRecord> find(UUID rideId) {
        String value = redisTemplate.opsForValue().get(KEY_PREFIX + rideId);
        return Optional.ofNullable(value).map(v -> json.read(v, BroadcastRecord.class));
    }
}
