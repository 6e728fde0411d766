package com.ridematch.dispatch.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.ridematch.dispatch.model.BroadcastRecord;
import com.ridematch.dispatch.model.BroadcastStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.serializer.SerializationException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisBroadcastStoreTest {

    private static final ObjectMapper MAPPER = JsonMapper.builder().findAndAddModules().build();

    @Mock private RedisTemplate<String, String> redisTemplate;
    @Mock private ValueOperations<String, String> valueOps;

    private RedisBroadcastStore store;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        store = new RedisBroadcastStore(redisTemplate, new RedisJson(MAPPER));
    }

    private static BroadcastRecord record(UUID rideId) {
        return BroadcastRecord.builder()
                .rideId(rideId)
                .pickupLat(22.7196)
                .pickupLng(75.8577)
                .destinationLat(22.76)
                .destinationLng(75.86)
                .estimatedFare(new BigDecimal("90.00"))
                .radiusKm(5.0)
                .notifiedDriverIds(new ArrayList<>(List.of("d1", "d2")))
                .status(BroadcastStatus.ACTIVE)
                .broadcastCount(1)
                .createdAt(Instant.parse("2024-03-01T08:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("save writes JSON under ride:broadcast:{rideId} with the TTL")
    void save() throws Exception {
        UUID rideId = UUID.randomUUID();
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);

        store.save(record(rideId), Duration.ofMinutes(10));

        verify(valueOps).set(eq("ride:broadcast:" + rideId), json.capture(), eq(Duration.ofMinutes(10)));
        assertThat(MAPPER.readTree(json.getValue()).get("createdAt").asText()).isEqualTo("2024-03-01T08:00:00Z");
        assertThat(MAPPER.readTree(json.getValue()).has("active")).isFalse();
    }

    @Test
    @DisplayName("find reads back the stored record")
    void find() throws Exception {
        UUID rideId = UUID.randomUUID();
        when(valueOps.get("ride:broadcast:" + rideId)).thenReturn(MAPPER.writeValueAsString(record(rideId)));

        BroadcastRecord found = store.find(rideId).orElseThrow();

        assertThat(found.getNotifiedDriverIds()).containsExactly("d1", "d2");
        assertThat(found.isActive()).isTrue();
        assertThat(found.getCreatedAt()).isEqualTo(Instant.parse("2024-03-01T08:00:00Z"));
    }

    @Test
    @DisplayName("Missing key → empty; corrupt value → SerializationException")
    void missingAndCorrupt() {
        UUID missing = UUID.randomUUID();
        UUID corrupt = UUID.randomUUID();
        when(valueOps.get("ride:broadcast:" + missing)).thenReturn(null);
        when(valueOps.get("ride:broadcast:" + corrupt)).thenReturn("{not json");

        assertThat(store.find(missing)).isEmpty();
        assertThatThrownBy(() -> store.find(corrupt)).isInstanceOf(SerializationException.class);
    }
}
