package com.ridematch.dispatch.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.ridematch.dispatch.model.DriverAvailability;
import com.ridematch.dispatch.model.GeoPoint;
import com.ridematch.shared.enums.DriverStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.geo.Circle;
import org.springframework.data.geo.Distance;
import org.springframework.data.geo.GeoResult;
import org.springframework.data.geo.GeoResults;
import org.springframework.data.geo.Metrics;
import org.springframework.data.geo.Point;
import org.springframework.data.redis.connection.RedisGeoCommands;
import org.springframework.data.redis.core.GeoOperations;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisDriverAvailabilityStoreTest {

    private static final ObjectMapper MAPPER = JsonMapper.builder().findAndAddModules().build();
    private static final Duration TTL = Duration.ofMinutes(5);
    private static final String INDEX = "drivers:available:geo";

    @Mock private RedisTemplate<String, String> redisTemplate;
    @Mock private RedisOperations<String, String> session;
    @Mock private ValueOperations<String, String> valueOps;
    @Mock private GeoOperations<String, String> geoOps;

    private RedisDriverAvailabilityStore store;

    @BeforeEach
    void setUp() {
        store = new RedisDriverAvailabilityStore(redisTemplate, new RedisJson(MAPPER));
    }

    /** Runs the store's transaction callbacks against {@code session}. */
    @SuppressWarnings("unchecked")
    private void runTransactions() {
        when(redisTemplate.execute(any(SessionCallback.class)))
                .thenAnswer(inv -> ((SessionCallback<Object>) inv.getArgument(0)).execute(session));
        when(session.opsForValue()).thenReturn(valueOps);
        when(session.opsForGeo()).thenReturn(geoOps);
    }

    private static DriverAvailability record(String driverId, Double lat, Double lng) {
        return DriverAvailability.builder()
                .driverId(driverId)
                .status(DriverStatus.AVAILABLE)
                .lat(lat)
                .lng(lng)
                .updatedAt(Instant.parse("2024-03-01T08:00:00Z"))
                .build();
    }

    private static GeoResult<RedisGeoCommands.GeoLocation<String>> hit(String driverId, double km) {
        return new GeoResult<>(new RedisGeoCommands.GeoLocation<>(driverId, new Point(75.8577, 22.7196)),
                new Distance(km, Metrics.KILOMETERS));
    }

    @Test
    @DisplayName("An available driver's record and geo entry are written in one MULTI/EXEC")
    void write_available_indexedInSameTransaction() throws Exception {
        runTransactions();
        DriverAvailability record = record("d1", 22.7196, 75.8577);

        store.write(record, true, TTL);

        InOrder tx = inOrder(session, valueOps, geoOps);
        tx.verify(session).multi();
        tx.verify(valueOps).set("driver:availability:d1", MAPPER.writeValueAsString(record), TTL);
        tx.verify(geoOps).add(INDEX, new Point(75.8577, 22.7196), "d1");
        tx.verify(session).exec();
        verify(geoOps, never()).remove(anyString(), any());
    }

    @Test
    @DisplayName("Writing an unavailable driver drops the geo entry inside the same transaction")
    void write_unavailable_removedInSameTransaction() {
        runTransactions();

        store.write(record("d1", 22.7196, 75.8577), false, TTL);

        InOrder tx = inOrder(session, valueOps, geoOps);
        tx.verify(session).multi();
        tx.verify(valueOps).set(eq("driver:availability:d1"), anyString(), eq(TTL));
        tx.verify(geoOps).remove(INDEX, "d1");
        tx.verify(session).exec();
        verify(geoOps, never()).add(anyString(), any(Point.class), anyString());
    }

    @Test
    @DisplayName("Drivers without a location or beyond the geo latitude limit are never indexed")
    void write_unindexable_notIndexed() {
        runTransactions();

        store.write(record("d1", null, null), true, TTL);
        store.write(record("d2", 89.0, 10.0), true, TTL);

        verify(geoOps).remove(INDEX, "d1");
        verify(geoOps).remove(INDEX, "d2");
        verify(geoOps, never()).add(anyString(), any(Point.class), anyString());
    }

    @Test
    @DisplayName("findIndexedNear queries the geo index nearest first and prunes hits whose record expired")
    void findIndexedNear_prunesExpired() throws Exception {
        when(redisTemplate.opsForGeo()).thenReturn(geoOps);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(geoOps.radius(eq(INDEX), any(Circle.class), any(RedisGeoCommands.GeoRadiusCommandArgs.class)))
                .thenReturn(new GeoResults<>(List.of(hit("d1", 1.0), hit("d2", 2.0))));
        DriverAvailability d1 = record("d1", 22.7286, 75.8577);
        when(valueOps.multiGet(List.of("driver:availability:d1", "driver:availability:d2")))
                .thenReturn(Arrays.asList(MAPPER.writeValueAsString(d1), null));

        List<DriverAvailability> found = store.findIndexedNear(new GeoPoint(22.7196, 75.8577), 5.0);

        assertThat(found).extracting(DriverAvailability::getDriverId).containsExactly("d1");
        verify(geoOps).remove(INDEX, "d2");

        ArgumentCaptor<Circle> circle = ArgumentCaptor.forClass(Circle.class);
        verify(geoOps).radius(eq(INDEX), circle.capture(), any(RedisGeoCommands.GeoRadiusCommandArgs.class));
        assertThat(circle.getValue().getCenter()).isEqualTo(new Point(75.8577, 22.7196));
        assertThat(circle.getValue().getRadius().getValue()).isBetween(5.0, 5.02);
        assertThat(circle.getValue().getRadius().getMetric()).isEqualTo(Metrics.KILOMETERS);
    }

    @Test
    @DisplayName("No geo hits → empty, no record reads")
    void findIndexedNear_empty() {
        when(redisTemplate.opsForGeo()).thenReturn(geoOps);
        when(geoOps.radius(eq(INDEX), any(Circle.class), any(RedisGeoCommands.GeoRadiusCommandArgs.class)))
                .thenReturn(new GeoResults<>(List.of()));

        assertThat(store.findIndexedNear(new GeoPoint(22.7196, 75.8577), 5.0)).isEmpty();
        verify(redisTemplate, never()).opsForValue();
    }
}
