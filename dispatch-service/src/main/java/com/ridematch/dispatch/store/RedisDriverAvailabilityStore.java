package com.ridematch.dispatch.store;

import com.ridematch.dispatch.model.DriverAvailability;
import com.ridematch.dispatch.model.GeoPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.geo.Circle;
import org.springframework.data.geo.Distance;
import org.springframework.data.geo.GeoResults;
import org.springframework.data.geo.Metrics;
import org.springframework.data.geo.Point;
import org.springframework.data.redis.connection.RedisGeoCommands;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Keys:
 *   driver:availability:{driverId}  JSON record, TTL refreshed on every write
 *   drivers:available:geo           geo set of drivers currently AVAILABLE
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisDriverAvailabilityStore implements DriverAvailabilityStore {

    static final String RECORD_PREFIX   = "driver:availability:";
    static final String AVAILABLE_INDEX = "drivers:available:geo";

    /** GEOADD refuses latitudes past this. */
    static final double MAX_GEO_LAT = 85.05112878;

    // Redis measures on a 6372.8 km sphere, GeoUtil on 6371 km
    private static final double SEARCH_SLACK_FACTOR = 1.001;
    private static final double SEARCH_SLACK_KM     = 0.01;

    private final RedisTemplate<String, String> redisTemplate;
    private final RedisJson json;

    @Override
    public void write(DriverAvailability record, boolean available, Duration ttl) {
        String key = RECORD_PREFIX + record.getDriverId();
        String value = json.write(record);
        boolean indexed = available && isIndexable(record);

        redisTemplate.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                ops.opsForValue().set(key, value, ttl);
                if (indexed) {
                    ops.opsForGeo().add(AVAILABLE_INDEX, new Point(record.getLng(), record.getLat()),
                            record.getDriverId());
                } else {
                    ops.opsForGeo().remove(AVAILABLE_INDEX, record.getDriverId());
                }
                return ops.exec();
            }
        });
    }

    @Override
    public Optional<DriverAvailability> find(String driverId) {
        String value = redisTemplate.opsForValue().get(RECORD_PREFIX + driverId);
        return Optional.ofNullable(value).map(v -> json.read(v, DriverAvailability.class));
    }

    @Override
    public List<DriverAvailability> findIndexedNear(GeoPoint point, double radiusKm) {
        Circle circle = new Circle(
                new Point(point.lng(), point.lat()),
                new Distance(radiusKm * SEARCH_SLACK_FACTOR + SEARCH_SLACK_KM, Metrics.KILOMETERS));

        GeoResults<RedisGeoCommands.GeoLocation<String>> results = redisTemplate.opsForGeo().radius(
                AVAILABLE_INDEX,
                circle,
                RedisGeoCommands.GeoRadiusCommandArgs.newGeoRadiusArgs().sortAscending());
        if (results == null || results.getContent().isEmpty()) {
            return List.of();
        }

        List<String> driverIds = results.getContent().stream()
                .map(r -> r.getContent().getName())
                .toList();
        List<String> values = redisTemplate.opsForValue()
                .multiGet(driverIds.stream().map(id -> RECORD_PREFIX + id).toList());
        if (values == null) {
            return List.of();
        }

        List<DriverAvailability> records = new ArrayList<>();
        List<String> stale = new ArrayList<>();
        for (int i = 0; i < driverIds.size(); i++) {
            String value = values.get(i);
            if (value == null) {
                stale.add(driverIds.get(i));
            } else {
                records.add(json.read(value, DriverAvailability.class));
            }
        }
        if (!stale.isEmpty()) {
            // record expired but index entry survived
            redisTemplate.opsForGeo().remove(AVAILABLE_INDEX, stale.toArray(new String[0]));
            log.debug("Pruned {} expired drivers from the available index", stale.size());
        }
        return records;
    }

    private static boolean isIndexable(DriverAvailability record) {
        return record.hasLocation() && Math.abs(record.getLat()) <= MAX_GEO_LAT;
    }
}
