package com.ridematch.dispatch.store;

import com.ridematch.dispatch.model.RideNotification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Key: driver:notifications:{driverId}, hash of rideId to JSON payload.
 *
 * Every put refreshes the key's TTL, so a driver who keeps receiving offers
 * would keep old ones forever. Entries older than one TTL are pruned on put.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisDriverNotificationStore implements DriverNotificationStore {

    static final String KEY_PREFIX = "driver:notifications:";

    private final RedisTemplate<String, String> redisTemplate;
    private final RedisJson json;

    @Override
    public void put(String driverId, RideNotification notification, Duration ttl) {
        String key = KEY_PREFIX + driverId;
        HashOperations<String, Object, Object> hash = redisTemplate.opsForHash();
        if (notification.getNotifiedAt() != null) {
            pruneOlderThan(hash, key, notification.getNotifiedAt().minus(ttl));
        }
        hash.put(key, notification.getRideId().toString(), json.write(notification));
        redisTemplate.expire(key, ttl);
    }

    @Override
    public void remove(String driverId, UUID rideId) {
        redisTemplate.opsForHash().delete(KEY_PREFIX + driverId, rideId.toString());
    }

    @Override
    public List<RideNotification> findAll(String driverId) {
        return redisTemplate.opsForHash().values(KEY_PREFIX + driverId).stream()
                .map(v -> json.read(v.toString(), RideNotification.class))
                .sorted(Comparator.comparing(RideNotification::getNotifiedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    private void pruneOlderThan(HashOperations<String, Object, Object> hash, String key, Instant cutoff) {
        Map<Object, Object> entries = hash.entries(key);
        if (entries == null || entries.isEmpty()) {
            return;
        }
        Object[] stale = entries.entrySet().stream()
                .filter(e -> {
                    Instant notifiedAt = json.read(e.getValue().toString(), RideNotification.class).getNotifiedAt();
                    return notifiedAt == null || notifiedAt.isBefore(cutoff);
                })
                .map(Map.Entry::getKey)
                .toArray();
        if (stale.length > 0) {
            hash.delete(key, stale);
            log.debug("Pruned {} expired notifications from {}", stale.length, key);
        }
    }
}
