package com.ridematch.shared.featureflag;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeatureFlagServiceTest {

    @Mock private RedisTemplate<String, String> redisTemplate;
    @Mock private HashOperations<String, Object, Object> hashOps;

    private FeatureFlagService service;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForHash()).thenReturn(hashOps);
        service = new FeatureFlagService(redisTemplate);
    }

    @Test
    @DisplayName("Scoped value wins over global")
    void scopedValueWins() {
        when(hashOps.get("feature-flags:default", FeatureFlagService.DISPATCH_KILL_SWITCH)).thenReturn("true");

        assertThat(service.isEnabled(FeatureFlagService.DISPATCH_KILL_SWITCH, false)).isTrue();
    }

    @Test
    @DisplayName("Falls back to global, then to the default value")
    void fallsBack() {
        when(hashOps.get("feature-flags:default", FeatureFlagService.AUTO_RADIUS_EXPANSION)).thenReturn(null);
        when(hashOps.get("feature-flags:global", FeatureFlagService.AUTO_RADIUS_EXPANSION)).thenReturn("false");
        assertThat(service.isEnabled(FeatureFlagService.AUTO_RADIUS_EXPANSION, true)).isFalse();

        when(hashOps.get("feature-flags:default", FeatureFlagService.EXTENDED_AREA_FILTER)).thenReturn(null);
        when(hashOps.get("feature-flags:global", FeatureFlagService.EXTENDED_AREA_FILTER)).thenReturn(null);
        assertThat(service.isEnabled(FeatureFlagService.EXTENDED_AREA_FILTER, true)).isTrue();
    }

    @Test
    @DisplayName("initDefaults never overwrites existing flags")
    void initDefaultsUsesPutIfAbsent() {
        service.initDefaults("default");

        verify(hashOps).putIfAbsent("feature-flags:default", FeatureFlagService.DISPATCH_KILL_SWITCH, "false");
        verify(hashOps).putIfAbsent("feature-flags:default", FeatureFlagService.EXTENDED_AREA_FILTER, "true");
        verify(hashOps).putIfAbsent("feature-flags:default", FeatureFlagService.AUTO_RADIUS_EXPANSION, "true");
    }
}
